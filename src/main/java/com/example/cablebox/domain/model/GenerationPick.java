package com.example.cablebox.domain.model;

import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;

public final class GenerationPick {

    private final TrackEntity track;
    private final GenerationState nextState;
    private final ExclusionResult exclusion;

    public GenerationPick(TrackEntity track, GenerationState nextState, ExclusionResult exclusion) {
        this.track = track;
        this.nextState = nextState;
        this.exclusion = exclusion;
    }

    public TrackEntity getTrack() {
        return track;
    }

    public GenerationState getNextState() {
        return nextState;
    }

    public boolean isRelaxedTrackExclusion() {
        return exclusion.isRelaxedTrackExclusion();
    }

    public boolean isRelaxedArtistExclusion() {
        return exclusion.isRelaxedArtistExclusion();
    }
}
