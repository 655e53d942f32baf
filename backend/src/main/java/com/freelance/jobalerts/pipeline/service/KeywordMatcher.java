package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.pipeline.model.JobRecord;
import com.freelance.jobalerts.pipeline.model.KeywordMatch;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;

/**
 * Case-insensitive substring matching over title and description. "log" matches "blogger";
 * there is no word-boundary check. An empty keyword set matches nothing.
 */
@Component
public class KeywordMatcher {

    public boolean matches(JobRecord job, Collection<String> keywords) {
        return match(job, keywords).matched();
    }

    public KeywordMatch match(JobRecord job, Collection<String> keywords) {
        if (job == null || keywords == null || keywords.isEmpty()) {
            return KeywordMatch.NONE;
        }
        String haystack = haystack(job);
        String first = null;
        int hits = 0;
        for (String keyword : keywords) {
            if (keyword == null) {
                continue;
            }
            String needle = keyword.trim().toLowerCase(Locale.ROOT);
            if (needle.isEmpty() || !haystack.contains(needle)) {
                continue;
            }
            if (first == null) {
                first = needle;
            }
            hits++;
        }
        return hits == 0 ? KeywordMatch.NONE : new KeywordMatch(true, first, hits);
    }

    private String haystack(JobRecord job) {
        String title = job.title() == null ? "" : job.title();
        String description = job.description() == null ? "" : job.description();
        return (title + "\n" + description).toLowerCase(Locale.ROOT);
    }
}
