package com.goormthonuniv.credibility.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "credibility")
@Data
public class CredibilityProperties {

    private Prior prior = new Prior();
    private Query query = new Query();

    @Data
    public static class Prior {
        /** global prior 재계산 주기 */
        private Duration ttl = Duration.ofHours(1);
        /** 분석 데이터가 없을 때의 평균 */
        private double defaultMean = 50.0;
        /** 분석이 2건 미만일 때의 분산 (표준편차 15) */
        private double defaultVariance = 225.0;
    }

    @Data
    public static class Query {
        /** 요청 limit 상한. 기본 limit 은 {@link com.goormthonuniv.credibility.dto.SourceStatsQuery#DEFAULT_LIMIT} */
        private int maxLimit = 200;
    }
}
