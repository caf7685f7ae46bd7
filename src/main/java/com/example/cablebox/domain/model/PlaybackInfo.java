package com.example.cablebox.domain.model;

import com.example.cablebox.domain.PlaybackReason;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaybackInfo {

    private int startOffsetSec;

    private PlaybackReason reason;
}
