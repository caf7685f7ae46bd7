package com.example.cablebox.domain.model;

import lombok.Data;

/**
 * A picked track resolved to playable URLs for the client.
 */
@Data
public class StationTrack {

    private String trackId;

    private String title;

    private String artist;

    private String album;

    private Integer durationSec;

    private String artworkUrl;

    private String streamUrl;

    private String genre;

    private Integer year;
}
