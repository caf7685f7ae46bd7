package com.example.cablebox.application.service;

import com.example.cablebox.common.util.HashUtil;
import com.example.cablebox.common.util.TextNormalizer;
import com.example.cablebox.domain.model.CandidateFilter;
import com.example.cablebox.domain.model.StationRules;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns station rules into a {@link CandidateFilter} and into the signature
 * that identifies the filter in the candidate pool cache.
 * <p>
 * Both derive from the same normalized values, so two rule sets that differ
 * only in case, spacing, order or duplicates share one filter and one key.
 */
@Component
public class CandidateFilterBuilder {

    public CandidateFilter build(StationRules rules, Instant now) {
        CandidateFilter filter = new CandidateFilter();
        filter.setIncludeGenres(matchKeys(rules.getIncludeGenres()));
        filter.setExcludeGenres(matchKeys(rules.getExcludeGenres()));
        filter.setIncludeArtists(matchKeys(rules.getIncludeArtists()));
        filter.setExcludeArtists(matchKeys(rules.getExcludeArtists()));
        filter.setIncludeAlbums(matchKeys(rules.getIncludeAlbums()));
        filter.setExcludeAlbums(matchKeys(rules.getExcludeAlbums()));

        if (rules.getYearRange() != null) {
            filter.setYearMin(rules.getYearRange().getMin());
            filter.setYearMax(rules.getYearRange().getMax());
        }
        if (rules.getDurationRange() != null) {
            filter.setDurationMinSec(rules.getDurationRange().getMinSec());
            filter.setDurationMaxSec(rules.getDurationRange().getMaxSec());
        }
        if (rules.getRecentlyAddedDays() != null) {
            Instant cutoff = hourBucket(now).minus(Duration.ofDays(rules.getRecentlyAddedDays()));
            filter.setAddedAfter(LocalDateTime.ofInstant(cutoff, ZoneOffset.UTC));
        }
        return filter;
    }

    /**
     * Cache signature: md5 of the canonical filter fields plus the hour
     * bucket of {@code now}.
     */
    public String signature(StationRules rules, Instant now) {
        CandidateFilter filter = build(rules, now);
        StringBuilder canonical = new StringBuilder(128);
        appendList(canonical, "genre+", filter.getIncludeGenres());
        appendList(canonical, "genre-", filter.getExcludeGenres());
        appendList(canonical, "artist+", filter.getIncludeArtists());
        appendList(canonical, "artist-", filter.getExcludeArtists());
        appendList(canonical, "album+", filter.getIncludeAlbums());
        appendList(canonical, "album-", filter.getExcludeAlbums());
        canonical.append("year=").append(filter.getYearMin()).append("..").append(filter.getYearMax()).append('|');
        canonical.append("duration=").append(filter.getDurationMinSec()).append("..")
                .append(filter.getDurationMaxSec()).append('|');
        canonical.append("addedDays=").append(rules.getRecentlyAddedDays()).append('|');
        canonical.append("bucket=").append(hourBucket(now));
        return HashUtil.md5Hex(canonical.toString());
    }

    public static Instant hourBucket(Instant now) {
        return now.truncatedTo(ChronoUnit.HOURS);
    }

    private static List<String> matchKeys(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> keys = new LinkedHashSet<>();
        for (String value : values) {
            String key = TextNormalizer.matchKey(value);
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return new ArrayList<>(keys);
    }

    private static void appendList(StringBuilder target, String label, List<String> keys) {
        List<String> sorted = new ArrayList<>(keys);
        Collections.sort(sorted);
        target.append(label).append('=');
        for (int i = 0; i < sorted.size(); i++) {
            if (i > 0) {
                target.append(',');
            }
            target.append(sorted.get(i).replace("\\", "\\\\").replace(",", "\\,"));
        }
        target.append('|');
    }
}
