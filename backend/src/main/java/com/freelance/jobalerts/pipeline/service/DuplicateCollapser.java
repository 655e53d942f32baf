package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.pipeline.model.JobRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses records within one cycle that describe the same listing, keyed by
 * {@link FingerprintService#listingIdentity}. The affiliate-capable copy wins; otherwise
 * the first one seen is kept.
 */
@Component
public class DuplicateCollapser {
    private final FingerprintService fingerprintService;

    public DuplicateCollapser(FingerprintService fingerprintService) {
        this.fingerprintService = fingerprintService;
    }

    public List<JobRecord> collapse(List<JobRecord> jobs) {
        Map<String, JobRecord> seen = new LinkedHashMap<>();
        for (JobRecord job : jobs) {
            String key = fingerprintService.listingIdentity(job);
            JobRecord existing = seen.get(key);
            if (existing == null) {
                seen.put(key, job);
            } else if (job.isAffiliate() && !existing.isAffiliate()) {
                seen.put(key, job);
            }
        }
        return new ArrayList<>(seen.values());
    }
}
