package com.example.cablebox.common.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniform draws in [0, 1). Production code uses {@link #system()};
 * tests pass a scripted or seeded source.
 */
@FunctionalInterface
public interface RandomSource {

    double nextDouble();

    static RandomSource system() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    /**
     * Draw keyed by {@code seedKey} when present, otherwise from this source.
     */
    default double drawFor(String seedKey) {
        return seedKey == null ? nextDouble() : HashUtil.unitInterval(seedKey);
    }
}
