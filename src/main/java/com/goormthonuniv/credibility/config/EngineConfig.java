package com.goormthonuniv.credibility.config;

import com.goormthonuniv.credibility.service.GlobalPriorCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    /** 추세/기간 필터의 기준 시각 */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GlobalPriorCache globalPriorCache(CredibilityProperties props) {
        return new GlobalPriorCache(props.getPrior().getTtl());
    }
}
