package com.vidnyan.rulecov.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.rulecov.RuleCovProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for RuleCov components.
 */
@Slf4j
@Configuration
public class RuleCovConfiguration {

    /**
     * ObjectMapper for JSON reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Log the effective engine settings on startup.
     */
    @Bean
    public String logEngineSettings(RuleCovProperties properties) {
        log.info("Rule engine: {} (timeout {}s), syntax trees {}",
                properties.getEngine().getCommand(),
                properties.getEngine().getTimeout().toSeconds(),
                properties.getSyntaxTree().isEnabled() ? "enabled" : "disabled");
        return "engine-settings-logged";
    }
}
