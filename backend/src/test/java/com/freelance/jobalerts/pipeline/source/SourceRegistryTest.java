package com.freelance.jobalerts.pipeline.source;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.SourceFetchResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceRegistryTest {

    @Test
    void followsConfigurationOrderAndSkipsDisabledSources() {
        AlertsProperties properties = new AlertsProperties();
        properties.getSources().put("skywalker", new AlertsProperties.Source());
        AlertsProperties.Source disabled = new AlertsProperties.Source();
        disabled.setEnabled(false);
        properties.getSources().put("upwork", disabled);
        properties.getSources().put("freelancer", new AlertsProperties.Source());

        SourceRegistry registry = new SourceRegistry(
            List.of(stub("freelancer"), stub("upwork"), stub("skywalker")),
            properties
        );

        assertThat(registry.enabledAdapters())
            .extracting(JobSourceAdapter::sourceId)
            .containsExactly("skywalker", "freelancer");
    }

    @Test
    void sourceWithIntervalIsDueOnlyAfterItElapses() {
        AlertsProperties properties = new AlertsProperties();
        AlertsProperties.Source tenMinutes = new AlertsProperties.Source();
        tenMinutes.setIntervalSeconds(600);
        properties.getSources().put("skywalker", tenMinutes);
        properties.getSources().put("freelancer", new AlertsProperties.Source());
        SourceRegistry registry = new SourceRegistry(List.of(stub("freelancer"), stub("skywalker")), properties);
        Instant start = Instant.parse("2025-01-01T10:00:00Z");

        assertThat(registry.dueAdapters(start))
            .extracting(JobSourceAdapter::sourceId)
            .containsExactly("skywalker", "freelancer");
        assertThat(registry.dueAdapters(start.plusSeconds(120)))
            .extracting(JobSourceAdapter::sourceId)
            .containsExactly("freelancer");
        assertThat(registry.dueAdapters(start.plusSeconds(600)))
            .extracting(JobSourceAdapter::sourceId)
            .containsExactly("skywalker", "freelancer");
    }

    @Test
    void duplicateSourceIdsAreRejected() {
        AlertsProperties properties = new AlertsProperties();

        assertThatThrownBy(() -> new SourceRegistry(List.of(stub("freelancer"), stub("freelancer")), properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("freelancer");
    }

    private JobSourceAdapter stub(String id) {
        return new JobSourceAdapter() {
            @Override
            public String sourceId() {
                return id;
            }

            @Override
            public SourceFetchResult fetch(List<String> keywords) {
                return SourceFetchResult.success(id, List.of());
            }
        };
    }
}
