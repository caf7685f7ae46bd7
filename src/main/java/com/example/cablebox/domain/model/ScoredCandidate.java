package com.example.cablebox.domain.model;

import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;

public final class ScoredCandidate {

    private final TrackEntity track;
    private final double score;

    public ScoredCandidate(TrackEntity track, double score) {
        this.track = track;
        this.score = score;
    }

    public TrackEntity getTrack() {
        return track;
    }

    public double getScore() {
        return score;
    }
}
