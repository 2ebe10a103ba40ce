package com.di.snapdiff.config;

import com.di.snapdiff.dq.DqRuleLoader;
import com.di.snapdiff.dq.DqRuleSet;
import com.di.snapdiff.routing.Router;
import com.di.snapdiff.routing.RoutingConfigLoader;
import com.di.snapdiff.routing.RoutingRuleSet;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Rule sets are loaded and validated once at startup and shared read-only for the run.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoutingRuleSet routingRuleSet(RoutingConfigLoader loader, SnapDiffProperties properties) {
        return loader.load(properties.getRoutingFile());
    }

    @Bean
    public Router router(RoutingRuleSet routingRuleSet) {
        return new Router(routingRuleSet);
    }

    @Bean
    public DqRuleSet dqRuleSet(DqRuleLoader loader, SnapDiffProperties properties) {
        return loader.load(properties.getDqRulesFile());
    }
}
