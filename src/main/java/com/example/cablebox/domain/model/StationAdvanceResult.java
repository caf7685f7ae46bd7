package com.example.cablebox.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StationAdvanceResult {

    private StationTrack track;

    private PlaybackInfo playback;
}
