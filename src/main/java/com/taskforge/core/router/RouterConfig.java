package com.taskforge.core.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RouterConfig {

    private static final Logger log = LoggerFactory.getLogger(RouterConfig.class);

    /**
     * Quota gate, only when {@code taskforge.router.quota.enabled=true}.
     */
    @Bean
    @ConditionalOnProperty(prefix = "taskforge.router.quota", name = "enabled", havingValue = "true")
    public ResourceManager slidingWindowResourceManager(RouterProperties properties, Clock clock) {
        RouterProperties.Quota quota = properties.getQuota();
        log.info("Capability quota enabled: {} calls / {} tokens per {} ms",
                quota.getMaxCalls(), quota.getMaxTokens(), quota.getWindowMs());
        return new SlidingWindowResourceManager(quota.getMaxCalls(), quota.getMaxTokens(), quota.getWindowMs(), clock);
    }
}
