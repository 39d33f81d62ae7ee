package com.vcc.llmgateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GatewayConfig {

    // Credential expiry and session timestamps read time through this bean
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
