package com.example.adaptivestream;

import com.example.adaptivestream.common.config.AppBufferProperties;
import com.example.adaptivestream.common.config.AppContentProperties;
import com.example.adaptivestream.common.config.AppFetchProperties;
import com.example.adaptivestream.common.config.AppProviderProperties;
import com.example.adaptivestream.common.config.AppQualityProperties;
import com.example.adaptivestream.common.config.AppSecurityProperties;
import com.example.adaptivestream.common.config.AppSessionProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.adaptivestream.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppSecurityProperties.class,
        AppProviderProperties.class,
        AppFetchProperties.class,
        AppBufferProperties.class,
        AppQualityProperties.class,
        AppSessionProperties.class,
        AppContentProperties.class
})
public class AdaptiveStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveStreamApplication.class, args);
    }
}
