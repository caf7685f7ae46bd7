package com.example.cablebox.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class TrackFeedbackEntity {

    private Long userId;

    private String trackId;

    private Integer liked;

    private Integer disliked;
}
