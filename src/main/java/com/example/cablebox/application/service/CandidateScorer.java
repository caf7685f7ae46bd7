package com.example.cablebox.application.service;

import com.example.cablebox.common.config.AppStationProperties;
import com.example.cablebox.common.util.RandomSource;
import com.example.cablebox.common.util.TextNormalizer;
import com.example.cablebox.domain.model.ListeningHistorySnapshot;
import com.example.cablebox.domain.model.TrackFeedback;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Desirability of one candidate:
 * <pre>
 * base + recencyBoost + likeBoost - dislikePenalty - artistPenalty
 * </pre>
 * {@code base} is uniform in [0, 1), keyed by track and seed when seeded.
 * The artist penalty is soft and applies even when the exclusion engine had
 * to relax artist separation.
 */
@Component
public class CandidateScorer {

    private static final double MILLIS_PER_HOUR = 3_600_000D;

    private final AppStationProperties stationProperties;
    private final RandomSource randomSource;

    @Autowired
    public CandidateScorer(AppStationProperties stationProperties) {
        this(stationProperties, RandomSource.system());
    }

    CandidateScorer(AppStationProperties stationProperties, RandomSource randomSource) {
        this.stationProperties = stationProperties;
        this.randomSource = randomSource;
    }

    public double score(TrackEntity track,
                        ListeningHistorySnapshot history,
                        Collection<String> recentArtistWindow,
                        Instant now,
                        String seed) {
        double base = randomSource.drawFor(seed == null ? null : track.getId() + ":" + seed);
        double score = base + recencyBoost(history.lastPlayedAt(track.getId()), now);

        TrackFeedback feedback = history.feedbackFor(track.getId());
        if (feedback.isLiked()) {
            score += stationProperties.getLikeBoost();
        }
        if (feedback.isDisliked()) {
            score -= stationProperties.getDislikePenalty();
        }

        String artistKey = TextNormalizer.matchKey(track.getArtist());
        if (!artistKey.isEmpty() && recentArtistWindow.contains(artistKey)) {
            score -= stationProperties.getArtistPenalty();
        }
        return score;
    }

    public double recencyBoost(Instant lastPlayedAt, Instant now) {
        return computeRecencyBoost(lastPlayedAt, now, stationProperties.getRecencyHalfLifeHours());
    }

    /**
     * {@code 1 - e^(-hoursSinceLastPlay / halfLifeHours)}; a never-played
     * track gets the maximum of 1.
     */
    public static double computeRecencyBoost(Instant lastPlayedAt, Instant now, double halfLifeHours) {
        if (lastPlayedAt == null) {
            return 1D;
        }
        double hours = Math.max(0L, Duration.between(lastPlayedAt, now).toMillis()) / MILLIS_PER_HOUR;
        return 1D - Math.exp(-hours / Math.max(1e-9, halfLifeHours));
    }
}
