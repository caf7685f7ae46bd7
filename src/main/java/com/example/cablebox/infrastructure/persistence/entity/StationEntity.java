package com.example.cablebox.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class StationEntity {

    private Long id;

    private Long userId;

    private String name;

    private String description;

    private String rulesJson;

    private Integer isEnabled;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
