package com.example.cablebox.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class StationStateEntity {

    private Long stationId;

    private Long userId;

    /** JSON array of song ids, oldest first. */
    private String recentTrackIdsJson;

    /** JSON array of artist names, oldest first. */
    private String recentArtistNamesJson;

    private String lastTrackId;

    private LocalDateTime lastPlayedAt;

    private LocalDateTime updatedAt;
}
