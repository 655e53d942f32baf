package com.freelance.jobalerts.pipeline.source;

import com.freelance.jobalerts.config.AlertsProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed list of adapters in configuration order. An adapter whose source is switched off under
 * {@code alerts.sources.<id>.enabled} is left out, and one with an {@code interval-seconds}
 * is only due again once that interval has passed since its last poll.
 */
@Component
public class SourceRegistry {
    private final List<JobSourceAdapter> adapters;
    private final AlertsProperties properties;
    private final Map<String, Instant> lastPolled = new ConcurrentHashMap<>();

    public SourceRegistry(List<JobSourceAdapter> adapters, AlertsProperties properties) {
        Set<String> ids = new HashSet<>();
        for (JobSourceAdapter adapter : adapters) {
            if (!ids.add(adapter.sourceId())) {
                throw new IllegalStateException("Duplicate source adapter id: " + adapter.sourceId());
            }
        }
        this.adapters = List.copyOf(adapters);
        this.properties = properties;
    }

    public List<JobSourceAdapter> enabledAdapters() {
        List<String> configuredOrder = new ArrayList<>(properties.getSources().keySet());
        return adapters.stream()
            .filter(adapter -> properties.source(adapter.sourceId()).isEnabled())
            .sorted(Comparator.comparingInt(adapter -> orderOf(configuredOrder, adapter.sourceId())))
            .toList();
    }

    /**
     * Enabled adapters whose interval has elapsed at {@code now}. Each returned adapter is
     * recorded as polled at {@code now}.
     */
    public List<JobSourceAdapter> dueAdapters(Instant now) {
        List<JobSourceAdapter> due = new ArrayList<>();
        for (JobSourceAdapter adapter : enabledAdapters()) {
            String sourceId = adapter.sourceId();
            Duration interval = Duration.ofSeconds(properties.source(sourceId).getIntervalSeconds());
            Instant previous = lastPolled.get(sourceId);
            if (previous == null || !now.isBefore(previous.plus(interval))) {
                lastPolled.put(sourceId, now);
                due.add(adapter);
            }
        }
        return due;
    }

    private int orderOf(List<String> configuredOrder, String sourceId) {
        int index = configuredOrder.indexOf(sourceId);
        return index < 0 ? Integer.MAX_VALUE : index;
    }
}
