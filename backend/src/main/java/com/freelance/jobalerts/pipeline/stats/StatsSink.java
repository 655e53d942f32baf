package com.freelance.jobalerts.pipeline.stats;

import com.freelance.jobalerts.pipeline.model.CycleStats;

public interface StatsSink {

    /**
     * Replaces the previously published snapshot.
     */
    void publish(CycleStats stats);
}
