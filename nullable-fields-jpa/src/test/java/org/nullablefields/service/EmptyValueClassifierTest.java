package org.nullablefields.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nullablefields.record.InMemoryRecord;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EmptyValueClassifierTest {

    private EmptyValueClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new EmptyValueClassifier(new ObjectMapper());
    }

    @Test
    void shouldNullEmptyAndWhitespaceText() {
        assertThat(classifier.nullIfEmpty("")).isNull();
        assertThat(classifier.nullIfEmpty("   ")).isNull();
        assertThat(classifier.nullIfEmpty("\n\t")).isNull();
    }

    @Test
    void shouldKeepNonEmptyTextUntrimmed() {
        assertThat(classifier.nullIfEmpty("  Lee  ")).isEqualTo("  Lee  ");
    }

    @Test
    void shouldNullEmptyCollectionsAndKeepNonEmptyOnes() {
        List<String> tags = List.of("a");

        assertThat(classifier.nullIfEmpty(new ArrayList<>())).isNull();
        assertThat(classifier.nullIfEmpty(Map.of())).isNull();
        assertThat(classifier.nullIfEmpty(tags)).isSameAs(tags);
    }

    @Test
    void shouldNeverNullFalsyScalars() {
        assertThat(classifier.nullIfEmpty(0)).isEqualTo(0);
        assertThat(classifier.nullIfEmpty(false)).isEqualTo(false);
        assertThat(classifier.nullIfEmpty(0L)).isEqualTo(0L);
    }

    @Test
    void shouldDecodeStructuredValueAndReturnDecodedStructure() {
        // Given: a JSON attribute with no set mutator and no decoder of its own
        InMemoryRecord record = InMemoryRecord.withNullable("options").jsonCast("options");

        // When
        Object verdict = classifier.nullIfEmpty(record, "{\"theme\":\"dark\",\"size\":2}", "options");

        // Then: the decoded map is returned, not the JSON text
        assertThat(verdict).isEqualTo(Map.of("theme", "dark", "size", 2));
    }

    @Test
    void shouldNullStructuredValueThatDecodesToEmpty() {
        InMemoryRecord record = InMemoryRecord.withNullable("options").jsonCast("options");

        assertThat(classifier.nullIfEmpty(record, "[]", "options")).isNull();
        assertThat(classifier.nullIfEmpty(record, "{}", "options")).isNull();
        assertThat(classifier.nullIfEmpty(record, "null", "options")).isNull();
        assertThat(classifier.nullIfEmpty(record, "\"   \"", "options")).isNull();
        assertThat(classifier.nullIfEmpty(record, "   ", "options")).isNull();
    }

    @Test
    void shouldKeepStructuredValuesThatDecodeToScalars() {
        InMemoryRecord record = InMemoryRecord.withNullable("options").jsonCast("options");

        assertThat(classifier.nullIfEmpty(record, "0", "options")).isEqualTo(0);
        assertThat(classifier.nullIfEmpty(record, "false", "options")).isEqualTo(false);
        assertThat(classifier.nullIfEmpty(record, "\"x\"", "options")).isEqualTo("x");
    }

    @Test
    void shouldTreatMalformedStructuredTextAsEmpty() {
        InMemoryRecord record = InMemoryRecord.withNullable("options").jsonCast("options");

        assertThat(classifier.nullIfEmpty(record, "{not json", "options")).isNull();
    }

    @Test
    void shouldUseAlreadyDecodedStructuredValueAsIs() {
        InMemoryRecord record = InMemoryRecord.withNullable("options").jsonCast("options");
        Map<String, Object> decoded = Map.of("a", 1);

        assertThat(classifier.nullIfEmpty(record, decoded, "options")).isSameAs(decoded);
        assertThat(classifier.nullIfEmpty(record, Map.of(), "options")).isNull();
    }

    @Test
    void shouldTrustSetMutatorAndTestRawStructuredValue() {
        // Given: a JSON attribute with a set mutator
        InMemoryRecord record = InMemoryRecord.withNullable("options").jsonCast("options").setMutator("options");

        // Then: the raw text is trim-tested, never decoded
        assertThat(classifier.nullIfEmpty(record, "{}", "options")).isEqualTo("{}");
        assertThat(classifier.nullIfEmpty(record, "[]", "options")).isEqualTo("[]");
        assertThat(classifier.nullIfEmpty(record, "   ", "options")).isNull();
    }

    @Test
    void shouldPreferRecordDecoderOverGenericDecode() {
        InMemoryRecord record = InMemoryRecord.withNullable("labels")
                .jsonCast("labels")
                .decodedWith(json -> List.of("decoded:" + json));

        assertThat(classifier.nullIfEmpty(record, "[]", "labels")).isEqualTo(List.of("decoded:[]"));
    }

    @Test
    void shouldNotFallBackToGenericDecodeWhenRecordDecoderReturnsNull() {
        InMemoryRecord record = InMemoryRecord.withNullable("labels")
                .jsonCast("labels")
                .decodedWith(json -> null);

        assertThat(classifier.nullIfEmpty(record, "[1, 2]", "labels")).isNull();
    }

    @Test
    void shouldClassifyNonStructuredAttributesByValue() {
        InMemoryRecord record = InMemoryRecord.withNullable("title", "tags", "count");

        assertThat(classifier.nullIfEmpty(record, " ", "title")).isNull();
        assertThat(classifier.nullIfEmpty(record, "[]", "title")).isEqualTo("[]");
        assertThat(classifier.nullIfEmpty(record, List.of(), "tags")).isNull();
        assertThat(classifier.nullIfEmpty(record, 0, "count")).isEqualTo(0);
    }
}
