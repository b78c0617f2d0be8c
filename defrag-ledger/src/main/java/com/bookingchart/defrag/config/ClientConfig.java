package com.bookingchart.defrag.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class ClientConfig {

    @Bean
    public RestTemplate holidayRestTemplate(RestTemplateBuilder builder, DefragProperties properties) {
        return builder
                .setConnectTimeout(properties.getHolidays().getConnectTimeout())
                .setReadTimeout(properties.getHolidays().getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
