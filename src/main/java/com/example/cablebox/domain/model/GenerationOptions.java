package com.example.cablebox.domain.model;

import com.example.cablebox.domain.PlaybackReason;
import java.time.Instant;
import lombok.Data;

/**
 * Optional knobs of one generation call. A non-blank {@code seed} makes every
 * random decision reproducible; {@code now} overrides the service clock.
 */
@Data
public class GenerationOptions {

    private String seed;

    private Instant now;

    private PlaybackReason reason = PlaybackReason.MANUAL;

    public static GenerationOptions defaults() {
        return new GenerationOptions();
    }

    public static GenerationOptions seeded(String seed, Instant now) {
        GenerationOptions options = new GenerationOptions();
        options.setSeed(seed);
        options.setNow(now);
        return options;
    }
}
