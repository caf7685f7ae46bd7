package com.example.cablebox.domain.model;

import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import com.example.cablebox.infrastructure.stream.StreamUrlResolver;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Everything one generation call reads, gathered up front. Discarded when
 * the call returns.
 */
public final class GenerationContext {

    private final Long stationId;
    private final Long userId;
    private final StationRules rules;
    private final Instant now;
    private final String seed;
    private final List<TrackEntity> candidates;
    private final ListeningHistorySnapshot history;
    private final GenerationState state;
    private final StreamUrlResolver streamUrlResolver;

    public GenerationContext(Long stationId,
                             Long userId,
                             StationRules rules,
                             Instant now,
                             String seed,
                             List<TrackEntity> candidates,
                             ListeningHistorySnapshot history,
                             GenerationState state,
                             StreamUrlResolver streamUrlResolver) {
        this.stationId = stationId;
        this.userId = userId;
        this.rules = rules;
        this.now = now;
        this.seed = seed;
        this.candidates = Collections.unmodifiableList(candidates);
        this.history = history;
        this.state = state;
        this.streamUrlResolver = streamUrlResolver;
    }

    public Long getStationId() {
        return stationId;
    }

    public Long getUserId() {
        return userId;
    }

    public StationRules getRules() {
        return rules;
    }

    public Instant getNow() {
        return now;
    }

    public String getSeed() {
        return seed;
    }

    public List<TrackEntity> getCandidates() {
        return candidates;
    }

    public ListeningHistorySnapshot getHistory() {
        return history;
    }

    /** State as persisted when the call started. */
    public GenerationState getState() {
        return state;
    }

    public StreamUrlResolver getStreamUrlResolver() {
        return streamUrlResolver;
    }
}
