package com.example.cablebox.infrastructure.stream;

/**
 * Turns catalog ids into URLs a player can fetch.
 */
public interface StreamUrlResolver {

    String buildStreamUrl(String trackId);

    String buildCoverArtUrl(String coverArtId);
}
