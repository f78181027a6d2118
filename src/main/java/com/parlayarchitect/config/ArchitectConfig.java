package com.parlayarchitect.config;

import com.parlayarchitect.rules.ArchitectConfiguration;
import com.parlayarchitect.rules.ConfigurationHolder;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the immutable configuration snapshot and its holder.
 *
 * <p>The snapshot is built eagerly from {@link ArchitectProperties}; a
 * {@code ConfigurationException} here fails context startup.
 */
@Configuration
public class ArchitectConfig {

    @Bean
    public ArchitectConfigurationLoader architectConfigurationLoader() {
        return new ArchitectConfigurationLoader();
    }

    @Bean
    public ConfigurationHolder configurationHolder(
            ArchitectConfigurationLoader architectConfigurationLoader, ArchitectProperties architectProperties) {
        ArchitectConfiguration configuration = architectConfigurationLoader.load(architectProperties);
        return new ConfigurationHolder(configuration);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
