package com.example.cablebox;

import com.example.cablebox.common.config.AppStationProperties;
import com.example.cablebox.common.config.AppSubsonicProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.example.cablebox.infrastructure.persistence.mapper")
@EnableConfigurationProperties({
        AppStationProperties.class,
        AppSubsonicProperties.class
})
public class MusicCableBoxApplication {

    public static void main(String[] args) {
        SpringApplication.run(MusicCableBoxApplication.class, args);
    }
}
