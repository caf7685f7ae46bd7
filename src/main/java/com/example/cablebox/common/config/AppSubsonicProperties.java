package com.example.cablebox.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.subsonic")
public class AppSubsonicProperties {

    /**
     * Sent as the {@code c} parameter on every Subsonic URL.
     */
    private String clientName = "music-cable-box";

    private String apiVersion = "1.16.1";

    private String responseFormat = "json";
}
