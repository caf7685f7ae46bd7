package com.example.cablebox.domain.model;

import lombok.Data;

@Data
public class TuneInSettings {

    private boolean enabled;

    private double maxFraction;

    private int minHeadSec;

    private int minTailSec;

    private double probability;

    public static TuneInSettings from(StationRules rules) {
        TuneInSettings settings = new TuneInSettings();
        settings.setEnabled(rules.isTuneInEnabled());
        settings.setMaxFraction(rules.getTuneInMaxFraction());
        settings.setMinHeadSec(rules.getTuneInMinHeadSec());
        settings.setMinTailSec(rules.getTuneInMinTailSec());
        settings.setProbability(rules.getTuneInProbability());
        return settings;
    }
}
