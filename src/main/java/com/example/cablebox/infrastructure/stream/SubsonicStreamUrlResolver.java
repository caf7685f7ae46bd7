package com.example.cablebox.infrastructure.stream;

import java.net.URISyntaxException;
import org.apache.http.client.utils.URIBuilder;

/**
 * Builds token-authenticated Subsonic REST URLs
 * ({@code /rest/stream.view}, {@code /rest/getCoverArt.view}).
 */
public class SubsonicStreamUrlResolver implements StreamUrlResolver {

    private final String baseUrl;
    private final String username;
    private final String token;
    private final String salt;
    private final String clientName;
    private final String apiVersion;
    private final String responseFormat;

    public SubsonicStreamUrlResolver(String baseUrl,
                                     String username,
                                     String token,
                                     String salt,
                                     String clientName,
                                     String apiVersion,
                                     String responseFormat) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.username = username;
        this.token = token;
        this.salt = salt;
        this.clientName = clientName;
        this.apiVersion = apiVersion;
        this.responseFormat = responseFormat;
    }

    @Override
    public String buildStreamUrl(String trackId) {
        return buildUrl("/rest/stream.view", trackId);
    }

    @Override
    public String buildCoverArtUrl(String coverArtId) {
        return buildUrl("/rest/getCoverArt.view", coverArtId);
    }

    private String buildUrl(String path, String id) {
        try {
            URIBuilder builder = new URIBuilder(baseUrl + path);
            builder.addParameter("u", username);
            builder.addParameter("t", token);
            builder.addParameter("s", salt);
            builder.addParameter("v", apiVersion);
            builder.addParameter("c", clientName);
            builder.addParameter("f", responseFormat);
            builder.addParameter("id", id);
            return builder.build().toString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid Subsonic base URL: " + baseUrl, e);
        }
    }

    static String normalizeBaseUrl(String url) {
        String trimmed = url == null ? "" : url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
