package com.example.cablebox.application.service;

import com.example.cablebox.common.config.AppStationProperties;
import com.example.cablebox.domain.model.ScoredCandidate;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Picks one track from the best {@code topK} scored candidates with
 * probability proportional to its shifted score.
 */
@Component
public class WeightedSampler {

    private final AppStationProperties stationProperties;

    public WeightedSampler(AppStationProperties stationProperties) {
        this.stationProperties = stationProperties;
    }

    /**
     * @param draw uniform value in [0, 1)
     * @throws IllegalStateException when {@code scored} is empty
     */
    public TrackEntity sample(List<ScoredCandidate> scored, double draw) {
        if (scored.isEmpty()) {
            throw new IllegalStateException("Sampling exhausted: no scored candidates left after exclusion");
        }
        List<ScoredCandidate> ranked = topCandidates(scored);

        double minScore = ranked.get(ranked.size() - 1).getScore();
        double floor = stationProperties.getWeightFloor();
        double[] weights = new double[ranked.size()];
        double totalWeight = 0D;
        for (int i = 0; i < ranked.size(); i++) {
            weights[i] = ranked.get(i).getScore() - minScore + floor;
            totalWeight += weights[i];
        }

        double cursor = Math.min(Math.max(draw, 0D), 1D) * totalWeight;
        for (int i = 0; i < ranked.size(); i++) {
            cursor -= weights[i];
            if (cursor <= 0D) {
                return ranked.get(i).getTrack();
            }
        }
        return ranked.get(ranked.size() - 1).getTrack();
    }

    /** Candidates sorted by score, highest first, cut to {@code topK}. */
    List<ScoredCandidate> topCandidates(List<ScoredCandidate> scored) {
        List<ScoredCandidate> ranked = new ArrayList<>(scored);
        ranked.sort(Comparator.comparingDouble(ScoredCandidate::getScore).reversed());
        int keep = Math.min(ranked.size(), Math.max(1, stationProperties.getTopK()));
        return new ArrayList<>(ranked.subList(0, keep));
    }
}
