package com.example.cablebox.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Declarative catalog predicate. String lists hold lower-cased match keys;
 * an empty list or null bound means the clause is absent.
 */
@Data
public class CandidateFilter {

    private List<String> includeGenres = new ArrayList<>();

    private List<String> excludeGenres = new ArrayList<>();

    private List<String> includeArtists = new ArrayList<>();

    private List<String> excludeArtists = new ArrayList<>();

    private List<String> includeAlbums = new ArrayList<>();

    private List<String> excludeAlbums = new ArrayList<>();

    private Integer yearMin;

    private Integer yearMax;

    private Integer durationMinSec;

    private Integer durationMaxSec;

    private LocalDateTime addedAfter;

    public boolean hasClauses() {
        return !includeGenres.isEmpty() || !excludeGenres.isEmpty()
                || !includeArtists.isEmpty() || !excludeArtists.isEmpty()
                || !includeAlbums.isEmpty() || !excludeAlbums.isEmpty()
                || yearMin != null || yearMax != null
                || durationMinSec != null || durationMaxSec != null
                || addedAfter != null;
    }
}
