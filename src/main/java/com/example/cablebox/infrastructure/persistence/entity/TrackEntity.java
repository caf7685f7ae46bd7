package com.example.cablebox.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * Catalog row mirrored from the Subsonic server by the library import job.
 * {@code id} is the server's song id.
 */
@Data
public class TrackEntity {

    private String id;

    private String title;

    private String artist;

    private String album;

    private String albumArtist;

    private String genre;

    private Integer year;

    private Integer durationSec;

    private String path;

    private String coverArtId;

    private LocalDateTime addedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
