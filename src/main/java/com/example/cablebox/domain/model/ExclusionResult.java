package com.example.cablebox.domain.model;

import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.util.Collections;
import java.util.List;

public final class ExclusionResult {

    private final List<TrackEntity> tracks;
    private final boolean relaxedTrackExclusion;
    private final boolean relaxedArtistExclusion;

    public ExclusionResult(List<TrackEntity> tracks, boolean relaxedTrackExclusion, boolean relaxedArtistExclusion) {
        this.tracks = Collections.unmodifiableList(tracks);
        this.relaxedTrackExclusion = relaxedTrackExclusion;
        this.relaxedArtistExclusion = relaxedArtistExclusion;
    }

    public List<TrackEntity> getTracks() {
        return tracks;
    }

    public boolean isRelaxedTrackExclusion() {
        return relaxedTrackExclusion;
    }

    public boolean isRelaxedArtistExclusion() {
        return relaxedArtistExclusion;
    }
}
