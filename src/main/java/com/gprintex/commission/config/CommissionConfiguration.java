package com.gprintex.commission.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
    OracleWalletProperties.class,
    CommissionProperties.class
})
public class CommissionConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
