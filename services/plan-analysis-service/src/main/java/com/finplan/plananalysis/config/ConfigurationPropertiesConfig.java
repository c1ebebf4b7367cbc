package com.finplan.plananalysis.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the plan analysis {@code @ConfigurationProperties} classes.
 */
@Configuration
@EnableConfigurationProperties(PlanAnalysisProperties.class)
@Slf4j
public class ConfigurationPropertiesConfig {

    public ConfigurationPropertiesConfig() {
        log.info("Initializing Plan Analysis Service configuration properties");
    }
}
