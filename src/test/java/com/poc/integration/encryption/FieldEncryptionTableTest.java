package com.poc.integration.encryption;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldEncryptionTableTest {

    @Nested
    class CombinationRules {

        @Test
        void shouldAllowPrefixWithSuffix() {
            FieldEncryptionSpec spec = FieldEncryptionSpec.preview("email", "searchable_email",
                EnumSet.of(AlgorithmClass.PREFIX_PREVIEW, AlgorithmClass.SUFFIX_PREVIEW), 1, 50, 100);

            assertThat(spec.supports(QueryKind.PREFIX)).isTrue();
            assertThat(spec.supports(QueryKind.SUFFIX)).isTrue();
            assertThat(spec.supports(QueryKind.SUBSTRING)).isFalse();
        }

        @Test
        void shouldRejectSubstringCombinedWithAnotherClass() {
            assertThatThrownBy(() -> FieldEncryptionSpec.preview("name", "searchable_name",
                EnumSet.of(AlgorithmClass.SUBSTRING_PREVIEW, AlgorithmClass.PREFIX_PREVIEW), 2, 10, 60))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SUBSTRING_PREVIEW");
        }

        @Test
        void shouldRejectEqualityCombinedWithPreview() {
            assertThatThrownBy(() -> new FieldEncryptionSpec("phone", "searchable_phone", "string",
                EnumSet.of(AlgorithmClass.EQUALITY, AlgorithmClass.PREFIX_PREVIEW), 1, 10, 20, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("EQUALITY");
        }

        @Test
        void shouldRejectMoreThanTwoClasses() {
            assertThatThrownBy(() -> new FieldEncryptionSpec("email", "searchable_email", "string",
                EnumSet.of(AlgorithmClass.EQUALITY, AlgorithmClass.PREFIX_PREVIEW, AlgorithmClass.SUFFIX_PREVIEW),
                1, 10, 20, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at most 2");
        }

        @Test
        void shouldRejectEmptyAlgorithmSet() {
            assertThatThrownBy(() -> new FieldEncryptionSpec("phone", "searchable_phone", "string",
                Set.of(), 0, 0, 0, true))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectInvertedLengthBounds() {
            assertThatThrownBy(() -> FieldEncryptionSpec.preview("name", "searchable_name",
                EnumSet.of(AlgorithmClass.SUBSTRING_PREVIEW), 10, 2, 60))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("query length bounds");
        }
    }

    @Nested
    class TableConstruction {

        @Test
        void shouldRegisterDefaultFields() {
            FieldEncryptionTable table = FieldEncryptionTable.defaultTable();

            assertThat(table.fieldNames())
                .containsExactly("name", "email", "phone", "category", "status", "address", "preferences");
            assertThat(table.get("category").path()).isEqualTo("metadata.category");
        }

        @Test
        void shouldRejectDuplicateField() {
            assertThatThrownBy(() -> FieldEncryptionTable.of(List.of(
                FieldEncryptionSpec.equality("phone", "searchable_phone"),
                FieldEncryptionSpec.equality("phone", "other_phone"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate field");
        }

        @Test
        void shouldRejectTwoFieldsOnSamePath() {
            assertThatThrownBy(() -> FieldEncryptionTable.of(List.of(
                FieldEncryptionSpec.equality("phone", "searchable_phone"),
                FieldEncryptionSpec.equality("mobile", "searchable_phone"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same path");
        }

        @Test
        void shouldBuildFromConfigurationMap() {
            Map<String, Object> fields = Map.of(
                "email", Map.of(
                    "path", "searchable_email",
                    "algorithms", List.of("prefix_preview", "suffix_preview"),
                    "minQueryLength", 3,
                    "maxQueryLength", 20,
                    "maxLength", 80),
                "status", Map.of(
                    "path", "metadata.status",
                    "algorithms", List.of("EQUALITY")));

            FieldEncryptionTable table = FieldEncryptionTable.fromMap(fields);

            FieldEncryptionSpec email = table.get("email");
            assertThat(email.algorithms())
                .containsExactlyInAnyOrder(AlgorithmClass.PREFIX_PREVIEW, AlgorithmClass.SUFFIX_PREVIEW);
            assertThat(email.minQueryLength()).isEqualTo(3);
            assertThat(email.maxLength()).isEqualTo(80);
            assertThat(table.get("status").supports(QueryKind.EQUALITY)).isTrue();
        }
    }
}
