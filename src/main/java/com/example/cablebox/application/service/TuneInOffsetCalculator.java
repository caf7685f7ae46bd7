package com.example.cablebox.application.service;

import com.example.cablebox.domain.model.TuneInSettings;
import org.springframework.stereotype.Component;

/**
 * Start offset that makes a station feel like it was already on air.
 * <p>
 * The offset is never below {@code minHeadSec} and always leaves at least
 * {@code minTailSec} of audio. Tracks shorter than a minute, or too short for
 * that window, start at 0.
 */
@Component
public class TuneInOffsetCalculator {

    static final int MIN_TUNE_IN_DURATION_SEC = 60;

    /**
     * @param probabilityDraw uniform draw gating whether to tune in at all
     * @param offsetDraw      uniform draw placing the offset inside the window
     * @return offset in whole seconds, 0 for a start from the top
     */
    public int compute(Integer durationSec, TuneInSettings settings, double probabilityDraw, double offsetDraw) {
        if (settings == null || !settings.isEnabled() || durationSec == null
                || durationSec < MIN_TUNE_IN_DURATION_SEC) {
            return 0;
        }
        int minHead = Math.max(0, settings.getMinHeadSec());
        int maxOffset = Math.min(
                (int) Math.floor(durationSec * settings.getMaxFraction()),
                durationSec - Math.max(0, settings.getMinTailSec()));
        if (maxOffset < minHead) {
            return 0;
        }
        if (probabilityDraw >= settings.getProbability()) {
            return 0;
        }
        double position = Math.min(Math.max(offsetDraw, 0D), 1D);
        int offset = minHead + (int) Math.floor(position * (maxOffset - minHead + 1));
        return Math.min(maxOffset, offset);
    }
}
