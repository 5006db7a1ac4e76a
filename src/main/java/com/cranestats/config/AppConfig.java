package com.cranestats.config;

import com.cranestats.model.TaskCatalog;
import com.cranestats.service.TaskCatalogLoader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(CraneStatsProperties.class)
public class AppConfig {

    /**
     * Source of "now" for predictions. Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Task definitions are static for the life of the process.
     */
    @Bean
    public TaskCatalog taskCatalog(TaskCatalogLoader loader, CraneStatsProperties properties) {
        return loader.load(properties.getTasks().getConfigFile());
    }
}
