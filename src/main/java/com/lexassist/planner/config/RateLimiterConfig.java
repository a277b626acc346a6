package com.lexassist.planner.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.ratelimit.completionQps:0}")
    private double completionQps;

    @Bean("completionRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter completionRateLimiter() {
        // 0 or negative disables limiting
        double effectiveQps = completionQps > 0 ? completionQps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
