package com.freelance.jobalerts.pipeline.service;

import com.freelance.jobalerts.pipeline.model.JobRecord;
import com.freelance.jobalerts.pipeline.model.KeywordMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordMatcherTest {
    private final KeywordMatcher matcher = new KeywordMatcher();

    @Test
    void matchIsCaseInsensitive() {
        assertThat(matcher.matches(job("Need a LOGO designer", ""), List.of("logo"))).isTrue();
    }

    @Test
    void matchIsSubstringNotWholeWord() {
        assertThat(matcher.matches(job("blogger wanted", ""), List.of("log"))).isTrue();
    }

    @Test
    void descriptionIsSearchedToo() {
        assertThat(matcher.matches(job("Small task", "We need a WordPress fix"), List.of("wordpress"))).isTrue();
        assertThat(matcher.matches(job("Small task", "We need a WordPress fix"), List.of("python"))).isFalse();
    }

    @Test
    void emptyKeywordSetMatchesNothing() {
        assertThat(matcher.matches(job("Logo design", "anything at all"), Set.of())).isFalse();
        assertThat(matcher.matches(job("Logo design", "anything at all"), null)).isFalse();
        assertThat(matcher.match(job("Logo design", ""), List.of())).isEqualTo(KeywordMatch.NONE);
    }

    @Test
    void reportsFirstHitAndHitCount() {
        KeywordMatch match = matcher.match(job("Logo and banner design", ""), List.of("python", "banner", "logo"));

        assertThat(match.matched()).isTrue();
        assertThat(match.firstKeyword()).isEqualTo("banner");
        assertThat(match.hits()).isEqualTo(2);
    }

    private JobRecord job(String title, String description) {
        return new JobRecord("freelancer", "1", title, description, "https://x/1", null, null, null, null, null);
    }
}
