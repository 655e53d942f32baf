package com.freelance.jobalerts.pipeline.stats;

import com.freelance.jobalerts.pipeline.model.CycleStats;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

@Component
public class LastCycleStatsHolder implements StatsSink {
    private final AtomicReference<CycleStats> latest = new AtomicReference<>();

    @Override
    public void publish(CycleStats stats) {
        latest.set(stats);
    }

    public CycleStats latest() {
        return latest.get();
    }
}
