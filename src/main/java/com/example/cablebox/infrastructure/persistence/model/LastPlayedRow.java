package com.example.cablebox.infrastructure.persistence.model;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class LastPlayedRow {

    private String trackId;
    private LocalDateTime lastPlayedAt;
}
