package com.tradefeed.orderservice.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(OrderProperties.class)
public class OrderServiceConfig {

    // Order numbers carry the date in this clock's zone
    @Bean
    public Clock clock(OrderProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }
}
