package com.example.cablebox.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class NavidromeAccountEntity {

    private Long userId;

    private String baseUrl;

    private String username;

    /** Subsonic auth token: md5(password + salt). */
    private String token;

    private String salt;
}
