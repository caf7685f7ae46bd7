package com.example.cablebox.domain.model;

import com.example.cablebox.common.util.TextNormalizer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rolling memory of one station: what was just played and by whom.
 * <p>
 * Instances are immutable. {@link #advance} returns a new state, so the
 * persisted state and a preview's simulated copy can never alias.
 */
public final class GenerationState {

    private final List<String> recentTrackIds;
    private final List<String> recentArtistNames;
    private final String lastTrackId;
    private final Instant lastPlayedAt;

    public GenerationState(List<String> recentTrackIds,
                           List<String> recentArtistNames,
                           String lastTrackId,
                           Instant lastPlayedAt) {
        this.recentTrackIds = Collections.unmodifiableList(new ArrayList<>(nullToEmpty(recentTrackIds)));
        this.recentArtistNames = Collections.unmodifiableList(new ArrayList<>(nullToEmpty(recentArtistNames)));
        this.lastTrackId = lastTrackId;
        this.lastPlayedAt = lastPlayedAt;
    }

    public static GenerationState empty() {
        return new GenerationState(Collections.emptyList(), Collections.emptyList(), null, null);
    }

    public GenerationState advance(String trackId, String artist, Instant playedAt, int cap) {
        return new GenerationState(
                pushCapped(recentTrackIds, trackId, cap),
                pushCapped(recentArtistNames, artist == null ? "" : artist, cap),
                trackId,
                playedAt
        );
    }

    /**
     * Lower-cased artist keys of the last {@code size} plays, oldest first.
     */
    public List<String> recentArtistWindow(int size) {
        if (size <= 0 || recentArtistNames.isEmpty()) {
            return Collections.emptyList();
        }
        int from = Math.max(0, recentArtistNames.size() - size);
        List<String> window = new ArrayList<>(recentArtistNames.size() - from);
        for (String artist : recentArtistNames.subList(from, recentArtistNames.size())) {
            window.add(TextNormalizer.matchKey(artist));
        }
        return window;
    }

    /**
     * Append {@code value}, then drop from the head until at most {@code cap}
     * entries remain.
     */
    public static List<String> pushCapped(List<String> list, String value, int cap) {
        int safeCap = Math.max(1, cap);
        List<String> next = new ArrayList<>(list.size() + 1);
        next.addAll(list);
        next.add(value);
        int overflow = next.size() - safeCap;
        if (overflow > 0) {
            return new ArrayList<>(next.subList(overflow, next.size()));
        }
        return next;
    }

    public List<String> getRecentTrackIds() {
        return recentTrackIds;
    }

    public List<String> getRecentArtistNames() {
        return recentArtistNames;
    }

    public String getLastTrackId() {
        return lastTrackId;
    }

    public Instant getLastPlayedAt() {
        return lastPlayedAt;
    }

    private static List<String> nullToEmpty(List<String> list) {
        return list == null ? Collections.emptyList() : list;
    }
}
