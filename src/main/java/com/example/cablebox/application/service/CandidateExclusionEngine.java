package com.example.cablebox.application.service;

import com.example.cablebox.common.util.TextNormalizer;
import com.example.cablebox.domain.model.ExclusionResult;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Drops disallowed tracks and recently heard artists from a candidate set,
 * loosening one constraint at a time when a stricter tier leaves nothing:
 * <ol>
 *   <li>no disallowed track, no artist from the window;</li>
 *   <li>no disallowed track (artist separation relaxed);</li>
 *   <li>no artist from the window (track repeat relaxed);</li>
 *   <li>the whole set (both relaxed).</li>
 * </ol>
 */
@Component
public class CandidateExclusionEngine {

    /**
     * @param recentArtistWindow artist match keys of the last plays, see
     *                           {@link TextNormalizer#matchKey(String)}
     */
    public ExclusionResult apply(List<TrackEntity> candidates,
                                 Set<String> disallowedTrackIds,
                                 Collection<String> recentArtistWindow) {
        Set<String> artistWindow = new HashSet<>(recentArtistWindow);

        List<TrackEntity> strict = new ArrayList<>();
        List<TrackEntity> allowedTracks = new ArrayList<>();
        List<TrackEntity> allowedArtists = new ArrayList<>();
        for (TrackEntity track : candidates) {
            boolean trackAllowed = !disallowedTrackIds.contains(track.getId());
            String artistKey = TextNormalizer.matchKey(track.getArtist());
            boolean artistAllowed = artistKey.isEmpty() || !artistWindow.contains(artistKey);
            if (trackAllowed && artistAllowed) {
                strict.add(track);
            }
            if (trackAllowed) {
                allowedTracks.add(track);
            }
            if (artistAllowed) {
                allowedArtists.add(track);
            }
        }

        if (!strict.isEmpty()) {
            return new ExclusionResult(strict, false, false);
        }
        if (!allowedTracks.isEmpty()) {
            return new ExclusionResult(allowedTracks, false, true);
        }
        if (!allowedArtists.isEmpty()) {
            return new ExclusionResult(allowedArtists, true, false);
        }
        return new ExclusionResult(new ArrayList<>(candidates), true, true);
    }
}
