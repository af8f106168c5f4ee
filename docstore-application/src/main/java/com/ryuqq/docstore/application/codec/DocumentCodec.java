package com.ryuqq.docstore.application.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ryuqq.docstore.core.exception.DocumentFormatException;
import com.ryuqq.docstore.core.model.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 컬렉션 파일 본문과 {@link Document} 목록 간 JSON 변환기.
 *
 * <p>컬렉션 파일은 항상 JSON 객체 배열입니다. 빈 본문은 빈 컬렉션으로 취급합니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 내부 {@link ObjectMapper}는 설정 이후 변경되지 않으므로
 * 여러 스레드에서 공유해도 안전합니다.</p>
 *
 * @author DocStore Team
 * @since 1.0.0
 */
public final class DocumentCodec {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public DocumentCodec() {
        this(new ObjectMapper());
    }

    /**
     * 외부 ObjectMapper로 코덱 생성.
     *
     * @param mapper 사용할 ObjectMapper (복사본에 pretty-print가 설정됨)
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    public DocumentCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 컬렉션 본문을 문서 목록으로 변환.
     *
     * @param content UTF-8 JSON 텍스트 (null 또는 공백이면 빈 목록)
     * @return 변경 불가 문서 목록
     * @throws DocumentFormatException JSON이 아니거나 객체 배열이 아닌 경우
     */
    public List<Document> decode(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Collection content is not valid JSON", e);
        }
        if (root == null || root.isMissingNode()) {
            return List.of();
        }
        if (!root.isArray()) {
            throw new DocumentFormatException(
                "Collection content must be a JSON array (current: " + root.getNodeType() + ")");
        }
        List<Document> documents = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new DocumentFormatException(
                    "Collection entries must be JSON objects (current: " + node.getNodeType() + ")");
            }
            documents.add(Document.of(mapper.convertValue(node, FIELDS)));
        }
        return Collections.unmodifiableList(documents);
    }

    /**
     * 문서 목록을 들여쓰기된 JSON 배열로 변환.
     *
     * @param documents 저장할 문서 목록
     * @return JSON 텍스트
     */
    public String encode(List<Document> documents) {
        if (documents == null) {
            throw new IllegalArgumentException("documents cannot be null");
        }
        List<Map<String, Object>> rows = new ArrayList<>(documents.size());
        for (Document document : documents) {
            rows.add(document.toMap());
        }
        try {
            return mapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("Failed to encode collection", e);
        }
    }
}
