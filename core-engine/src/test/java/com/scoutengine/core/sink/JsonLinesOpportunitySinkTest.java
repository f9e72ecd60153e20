package com.scoutengine.core.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutengine.core.model.Opportunity;
import com.scoutengine.core.model.Priority;
import com.scoutengine.core.util.ObjectMappers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonLinesOpportunitySink}.
 */
class JsonLinesOpportunitySinkTest {

    private final ObjectMapper mapper = ObjectMappers.create();

    @Test
    @DisplayName("Should append one snake_case JSON object per line")
    void shouldWriteJsonLines(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("nested/opportunities.jsonl");
        JsonLinesOpportunitySink sink = new JsonLinesOpportunitySink(out);

        sink.write(List.of(opportunity("o1", Priority.HIGH)));
        sink.write(List.of(opportunity("o2", Priority.LOW)));

        List<String> lines = Files.readAllLines(out);
        assertThat(lines).hasSize(2);

        JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.get("id").asText()).isEqualTo("o1");
        assertThat(first.get("entity_id").asText()).isEqualTo("page_42");
        assertThat(first.get("priority").asText()).isEqualTo("high");
        assertThat(first.get("status").asText()).isEqualTo("new");
        assertThat(first.get("detected_at").asText()).isEqualTo("2024-05-01T00:00:00Z");
        assertThat(first.get("evidence").get("deviation_pct").asDouble()).isEqualTo(-43.4);
        assertThat(mapper.readTree(lines.get(1)).get("priority").asText()).isEqualTo("low");
    }

    @Test
    @DisplayName("Should not create the file for an empty batch")
    void shouldIgnoreEmptyBatch(@TempDir Path dir) {
        Path out = dir.resolve("opportunities.jsonl");

        new JsonLinesOpportunitySink(out).write(List.of());

        assertThat(out).doesNotExist();
    }

    @Test
    @DisplayName("Should wrap I/O failures")
    void shouldWrapIoFailures(@TempDir Path dir) throws IOException {
        Path blocker = Files.createFile(dir.resolve("file"));
        JsonLinesOpportunitySink sink = new JsonLinesOpportunitySink(blocker.resolve("child.jsonl"));

        assertThatThrownBy(() -> sink.write(List.of(opportunity("o1", Priority.MEDIUM))))
                .isInstanceOf(SinkWriteException.class)
                .hasMessageContaining("Failed to append");
    }

    static Opportunity opportunity(String id, Priority priority) {
        return Opportunity.builder()
                .id(id)
                .organizationId("org_1")
                .entityId("page_42")
                .entityType("page")
                .ruleId("content_decay_multitimeframe")
                .area("content")
                .category("content_decay")
                .priority(priority)
                .title("Decay")
                .evidence(Map.of("deviation_pct", -43.4))
                .confidenceScore(0.9)
                .potentialImpactScore(60)
                .urgencyScore(88)
                .detectedAt(Instant.parse("2024-05-01T00:00:00Z"))
                .build();
    }
}
