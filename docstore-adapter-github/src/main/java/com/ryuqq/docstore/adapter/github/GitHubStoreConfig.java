package com.ryuqq.docstore.adapter.github;

import java.time.Duration;
import java.util.Map;

/**
 * GitHub 저장소 좌표와 HTTP 설정 (불변 record).
 *
 * @param owner          저장소 소유자
 * @param repo           저장소 이름
 * @param branch         대상 브랜치 (null이면 main)
 * @param token          API 토큰
 * @param apiBaseUrl     API 루트 (null이면 https://api.github.com)
 * @param requestTimeout 요청 타임아웃 (null이면 30초)
 * @author DocStore Team
 * @since 1.0.0
 */
public record GitHubStoreConfig(
    String owner,
    String repo,
    String branch,
    String token,
    String apiBaseUrl,
    Duration requestTimeout
) {

    public static final String DEFAULT_BRANCH = "main";
    public static final String DEFAULT_API_BASE_URL = "https://api.github.com";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public static final String ENV_OWNER = "DOCSTORE_GITHUB_OWNER";
    public static final String ENV_REPO = "DOCSTORE_GITHUB_REPO";
    public static final String ENV_TOKEN = "DOCSTORE_GITHUB_TOKEN";
    public static final String ENV_BRANCH = "DOCSTORE_GITHUB_BRANCH";

    public GitHubStoreConfig {
        requireText(owner, "owner");
        requireText(repo, "repo");
        requireText(token, "token");
        branch = branch == null || branch.isBlank() ? DEFAULT_BRANCH : branch;
        apiBaseUrl = apiBaseUrl == null || apiBaseUrl.isBlank() ? DEFAULT_API_BASE_URL : stripTrailingSlash(apiBaseUrl);
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
    }

    /**
     * 기본 브랜치, API 루트, 타임아웃으로 생성.
     *
     * @param owner 저장소 소유자
     * @param repo  저장소 이름
     * @param token API 토큰
     * @return 설정
     */
    public static GitHubStoreConfig of(String owner, String repo, String token) {
        return new GitHubStoreConfig(owner, repo, null, token, null, null);
    }

    /**
     * 환경 변수에서 설정을 읽습니다.
     *
     * <p>{@code DOCSTORE_GITHUB_OWNER}, {@code DOCSTORE_GITHUB_REPO}, {@code DOCSTORE_GITHUB_TOKEN}은 필수,
     * {@code DOCSTORE_GITHUB_BRANCH}는 선택입니다.</p>
     *
     * @param environment 환경 변수 맵 (보통 {@link System#getenv()})
     * @return 설정
     * @throws IllegalArgumentException 필수 변수가 없는 경우
     */
    public static GitHubStoreConfig fromEnvironment(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        return new GitHubStoreConfig(
            requireVariable(environment, ENV_OWNER),
            requireVariable(environment, ENV_REPO),
            environment.get(ENV_BRANCH),
            requireVariable(environment, ENV_TOKEN),
            null,
            null
        );
    }

    public GitHubStoreConfig withBranch(String branch) {
        return new GitHubStoreConfig(owner, repo, branch, token, apiBaseUrl, requestTimeout);
    }

    public GitHubStoreConfig withApiBaseUrl(String apiBaseUrl) {
        return new GitHubStoreConfig(owner, repo, branch, token, apiBaseUrl, requestTimeout);
    }

    public GitHubStoreConfig withRequestTimeout(Duration requestTimeout) {
        return new GitHubStoreConfig(owner, repo, branch, token, apiBaseUrl, requestTimeout);
    }

    @Override
    public String toString() {
        return "GitHubStoreConfig{owner=" + owner + ", repo=" + repo + ", branch=" + branch
            + ", apiBaseUrl=" + apiBaseUrl + ", requestTimeout=" + requestTimeout + ", token=****}";
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    private static String requireVariable(Map<String, String> environment, String name) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Environment variable " + name + " is not set");
        }
        return value;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
