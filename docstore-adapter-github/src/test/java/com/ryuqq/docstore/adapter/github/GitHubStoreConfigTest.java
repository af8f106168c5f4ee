package com.ryuqq.docstore.adapter.github;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GitHubStoreConfig 테스트.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
class GitHubStoreConfigTest {

    @Test
    void 기본값() {
        GitHubStoreConfig config = GitHubStoreConfig.of("acme", "records", "token");

        assertThat(config.branch()).isEqualTo("main");
        assertThat(config.apiBaseUrl()).isEqualTo("https://api.github.com");
        assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void 환경_변수에서_읽는다() {
        GitHubStoreConfig config = GitHubStoreConfig.fromEnvironment(Map.of(
            "DOCSTORE_GITHUB_OWNER", "acme",
            "DOCSTORE_GITHUB_REPO", "records",
            "DOCSTORE_GITHUB_TOKEN", "token",
            "DOCSTORE_GITHUB_BRANCH", "develop"
        ));

        assertThat(config.owner()).isEqualTo("acme");
        assertThat(config.repo()).isEqualTo("records");
        assertThat(config.token()).isEqualTo("token");
        assertThat(config.branch()).isEqualTo("develop");
    }

    @Test
    void 필수_환경_변수가_없으면_예외() {
        Map<String, String> environment = Map.of("DOCSTORE_GITHUB_OWNER", "acme", "DOCSTORE_GITHUB_REPO", "records");

        assertThatThrownBy(() -> GitHubStoreConfig.fromEnvironment(environment))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Environment variable DOCSTORE_GITHUB_TOKEN is not set");
    }

    @Test
    void API_루트의_끝_슬래시를_제거한다() {
        GitHubStoreConfig config = GitHubStoreConfig.of("acme", "records", "token")
            .withApiBaseUrl("https://github.example.com/api/v3/");

        assertThat(config.apiBaseUrl()).isEqualTo("https://github.example.com/api/v3");
    }

    @Test
    void toString은_토큰을_노출하지_않는다() {
        GitHubStoreConfig config = GitHubStoreConfig.of("acme", "records", "ghp_secret");

        assertThat(config.toString()).doesNotContain("ghp_secret").contains("token=****");
    }

    @Test
    void 잘못된_값은_거부한다() {
        assertThatThrownBy(() -> GitHubStoreConfig.of(" ", "records", "token"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("owner cannot be null or blank");
        assertThatThrownBy(() -> GitHubStoreConfig.of("acme", "records", "token").withRequestTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("requestTimeout must be positive");
    }
}
