package com.example.cablebox.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning values for station generation. Defaults are the product values the
 * station engine has been calibrated with; override per deployment if needed.
 */
@Data
@ConfigurationProperties(prefix = "app.station")
public class AppStationProperties {

    /**
     * Upper bound of catalog rows sampled into one candidate pool.
     */
    private int candidatePoolSize = 900;

    /**
     * Number of best-scored candidates kept for weighted sampling.
     */
    private int topK = 200;

    /**
     * Lifetime of a cached candidate pool.
     */
    private long cacheTtlSeconds = 15;

    /**
     * Max live candidate pool entries kept in process.
     */
    private int cacheMaxEntries = 200;

    /**
     * Capacity of the recent track / recent artist ring buffers.
     */
    private int stateCap = 200;

    private double recencyHalfLifeHours = 36D;

    private double likeBoost = 0.5D;

    private double dislikePenalty = 1.0D;

    private double artistPenalty = 0.65D;

    /**
     * Smallest sampling weight after the score shift.
     */
    private double weightFloor = 0.001D;

    /**
     * Max track ids per history lookup statement.
     */
    private int historyBatchSize = 500;

    private int peekMaxCount = 50;

    /**
     * Lock stripes used to serialize advances of the same station.
     */
    private int advanceLockStripes = 64;
}
