package com.example.cablebox.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class PlayEventEntity {

    private Long id;

    private Long userId;

    private Long stationId;

    private String trackId;

    private LocalDateTime playedAt;

    private Integer skipped;

    private Integer listenSeconds;

    private Integer startOffsetSec;

    private String reason;
}
