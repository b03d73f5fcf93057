package com.example.liveview.server.config;

import com.example.liveview.shared.config.LiveViewProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Bean
    @ConfigurationProperties(prefix = "liveview")
    public LiveViewProperties liveViewProperties() {
        return new LiveViewProperties();
    }
}
