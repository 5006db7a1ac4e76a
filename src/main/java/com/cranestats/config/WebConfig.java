package com.cranestats.config;

import com.cranestats.model.EntityType;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    // entityType=crane and entityType=CRANE are both accepted in query strings
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, EntityType.class, EntityType::fromValue);
    }
}
