package com.ryuqq.docstore.application.codec;

import com.ryuqq.docstore.core.exception.DocumentFormatException;
import com.ryuqq.docstore.core.schema.FieldKind;
import com.ryuqq.docstore.core.schema.Schema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SchemaCatalogReader 유닛 테스트.
 *
 * @author DocStore Team
 * @since 1.0.0
 */
class SchemaCatalogReaderTest {

    private final SchemaCatalogReader reader = new SchemaCatalogReader();

    @Test
    void readPlatformCatalog_플랫폼_컬렉션_로드() {
        // when
        Map<String, Schema> catalog = reader.readPlatformCatalog();

        // then
        assertThat(catalog).hasSize(40);
        assertThat(catalog).containsKeys("users", "entities", "products", "orders", "patients", "access_grants");

        Schema users = catalog.get("users");
        assertThat(users.required()).containsExactly("email");
        assertThat(users.types()).containsEntry("email", FieldKind.STRING)
            .containsEntry("is_verified", FieldKind.BOOLEAN);
        assertThat(users.defaults()).containsEntry("is_active", true)
            .containsEntry("permissions", List.of());
    }

    @Test
    void readPlatformCatalog_중첩_기본값_유지() {
        Schema patients = reader.readPlatformCatalog().get("patients");

        assertThat(patients.defaults().get("preferences"))
            .isEqualTo(Map.of("language", "en", "communication_method", "email", "privacy_level", "standard"));
    }

    @Test
    void read_선언_순서_유지() {
        // given
        String json = "{\"b\":{\"required\":[\"x\"]},\"a\":{}}";

        // when
        Map<String, Schema> catalog = reader.read(json);

        // then
        assertThat(catalog.keySet()).containsExactly("b", "a");
        assertThat(catalog.get("a")).isEqualTo(Schema.empty());
    }

    @Test
    void read_알수없는_타입이면_예외() {
        assertThatThrownBy(() -> reader.read("{\"a\":{\"types\":{\"when\":\"date\"}}}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown field kind");
    }

    @Test
    void read_객체가_아니면_예외() {
        assertThatThrownBy(() -> reader.read("[]"))
            .isInstanceOf(DocumentFormatException.class);
    }

    @Test
    void readResource_없는_리소스면_예외() {
        assertThatThrownBy(() -> reader.readResource("docstore/missing.json"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not found");
    }
}
