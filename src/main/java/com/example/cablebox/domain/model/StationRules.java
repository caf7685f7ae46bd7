package com.example.cablebox.domain.model;

import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.AssertTrue;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import lombok.Data;

/**
 * Rule set of one station. Instances are parsed from the station's stored
 * JSON by {@code StationRulesParser} and treated as read-only afterwards.
 */
@Data
public class StationRules {

    private List<String> includeGenres = new ArrayList<>();

    private List<String> excludeGenres = new ArrayList<>();

    private List<String> includeArtists = new ArrayList<>();

    private List<String> excludeArtists = new ArrayList<>();

    private List<String> includeAlbums = new ArrayList<>();

    private List<String> excludeAlbums = new ArrayList<>();

    @Valid
    private YearRange yearRange;

    @Valid
    private DurationRange durationRange;

    /** Only tracks added within this many days, when set. */
    @Min(1)
    @Max(3650)
    private Integer recentlyAddedDays;

    /** A track played within this window is not picked again. */
    @Min(1)
    @Max(168)
    private int avoidRepeatHours = 24;

    /** Tracks that must pass before the same artist may play again. */
    @Min(1)
    @Max(50)
    private int artistSeparation = 3;

    private boolean tuneInEnabled = true;

    @DecimalMin("0.05")
    @DecimalMax("0.95")
    private double tuneInMaxFraction = 0.6D;

    @Min(0)
    @Max(600)
    private int tuneInMinHeadSec = 8;

    @Min(0)
    @Max(600)
    private int tuneInMinTailSec = 20;

    @DecimalMin("0")
    @DecimalMax("1")
    private double tuneInProbability = 0.9D;

    @Data
    public static class YearRange {

        @Min(1900)
        @Max(3000)
        private Integer min;

        @Min(1900)
        @Max(3000)
        private Integer max;

        @AssertTrue(message = "yearRange.min must be <= yearRange.max")
        public boolean isOrdered() {
            return min == null || max == null || min <= max;
        }
    }

    @Data
    public static class DurationRange {

        @Min(0)
        private Integer minSec;

        @Min(0)
        private Integer maxSec;

        @AssertTrue(message = "durationRange.minSec must be <= durationRange.maxSec")
        public boolean isOrdered() {
            return minSec == null || maxSec == null || minSec <= maxSec;
        }
    }
}
