package com.flagship.reconciliation.config;

import com.flagship.reconciliation.matching.ConfiguredAliasResolver;
import com.flagship.reconciliation.matching.MatchingStrategyChain;
import com.flagship.reconciliation.safety.OverrideTokenValidator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the pure engine pieces, which carry no Spring annotations themselves.
 */
@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public MatchingStrategyChain matchingStrategyChain(ReconciliationProperties properties) {
        return MatchingStrategyChain.standard(
            new ConfiguredAliasResolver(properties.getMatching().getDescriptionAliases()));
    }

    @Bean
    public OverrideTokenValidator overrideTokenValidator(ReconciliationProperties properties, Clock clock) {
        return new OverrideTokenValidator(properties.getSafety().getOverrideTokenPrefix(), clock);
    }
}
