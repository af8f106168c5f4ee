package com.ryuqq.docstore.adapter.github;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Contents API 본문 인코딩 (UTF-8 텍스트 ⇄ Base64).
 *
 * <p>GitHub는 응답 본문을 60자마다 줄바꿈한 Base64로 돌려주므로 디코딩에는 MIME 디코더를 사용합니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class ContentEncoding {

    private ContentEncoding() {
    }

    public static String encode(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @param base64 Base64 본문 (줄바꿈 허용)
     * @return UTF-8 텍스트
     */
    public static String decode(String base64) {
        if (base64 == null) {
            throw new IllegalArgumentException("base64 cannot be null");
        }
        return new String(Base64.getMimeDecoder().decode(base64), StandardCharsets.UTF_8);
    }
}
