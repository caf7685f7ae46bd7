package com.example.cablebox.application.service;

import com.example.cablebox.common.config.AppStationProperties;
import com.example.cablebox.common.exception.BusinessException;
import com.example.cablebox.common.exception.StationErrorCodes;
import com.example.cablebox.common.util.RandomSource;
import com.example.cablebox.domain.model.ExclusionResult;
import com.example.cablebox.domain.model.GenerationContext;
import com.example.cablebox.domain.model.GenerationPick;
import com.example.cablebox.domain.model.GenerationState;
import com.example.cablebox.domain.model.ScoredCandidate;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * The single "pick one track" step shared by advance and preview.
 * <p>
 * Reads nothing but its arguments and writes nothing: the caller decides
 * whether the returned state is persisted or only threaded into the next
 * preview step.
 */
@Component
public class StationTrackPicker {

    private final CandidateExclusionEngine exclusionEngine;
    private final CandidateScorer candidateScorer;
    private final WeightedSampler weightedSampler;
    private final AppStationProperties stationProperties;
    private final RandomSource randomSource;

    @Autowired
    public StationTrackPicker(CandidateExclusionEngine exclusionEngine,
                              CandidateScorer candidateScorer,
                              WeightedSampler weightedSampler,
                              AppStationProperties stationProperties) {
        this(exclusionEngine, candidateScorer, weightedSampler, stationProperties, RandomSource.system());
    }

    StationTrackPicker(CandidateExclusionEngine exclusionEngine,
                       CandidateScorer candidateScorer,
                       WeightedSampler weightedSampler,
                       AppStationProperties stationProperties,
                       RandomSource randomSource) {
        this.exclusionEngine = exclusionEngine;
        this.candidateScorer = candidateScorer;
        this.weightedSampler = weightedSampler;
        this.stationProperties = stationProperties;
        this.randomSource = randomSource;
    }

    /**
     * @param state     state to pick against, persisted or simulated
     * @param pickedIds ids already chosen earlier in the same batch
     * @param step      position in the batch, 0 for a single advance
     * @throws BusinessException {@code STATION_NO_CANDIDATES} when no candidate
     *                           is left once {@code pickedIds} are removed
     */
    public GenerationPick pick(GenerationContext context, GenerationState state, Set<String> pickedIds, int step) {
        List<TrackEntity> subset = new ArrayList<>(context.getCandidates().size());
        for (TrackEntity candidate : context.getCandidates()) {
            if (!pickedIds.contains(candidate.getId())) {
                subset.add(candidate);
            }
        }
        if (subset.isEmpty()) {
            throw new BusinessException(StationErrorCodes.STATION_NO_CANDIDATES,
                    "No tracks match this station", "Loosen the station rules or sync the library");
        }

        Set<String> disallowed = new HashSet<>(context.getHistory().getRecentlyPlayedIds());
        disallowed.addAll(state.getRecentTrackIds());
        disallowed.addAll(pickedIds);
        List<String> artistWindow = state.recentArtistWindow(context.getRules().getArtistSeparation());

        ExclusionResult exclusion = exclusionEngine.apply(subset, disallowed, artistWindow);
        List<ScoredCandidate> scored = new ArrayList<>(exclusion.getTracks().size());
        for (TrackEntity track : exclusion.getTracks()) {
            double score = candidateScorer.score(
                    track, context.getHistory(), artistWindow, context.getNow(), context.getSeed());
            scored.add(new ScoredCandidate(track, score));
        }

        String seed = context.getSeed();
        double draw = randomSource.drawFor(seed == null ? null : seed + ":" + step);
        TrackEntity selected = weightedSampler.sample(scored, draw);
        GenerationState nextState = state.advance(
                selected.getId(), selected.getArtist(), context.getNow(), stationProperties.getStateCap());
        return new GenerationPick(selected, nextState, exclusion);
    }
}
