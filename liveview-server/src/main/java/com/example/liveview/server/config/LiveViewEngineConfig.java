package com.example.liveview.server.config;

import com.example.liveview.shared.config.LiveViewProperties;
import com.example.liveview.shared.context.LiveContextDirectory;
import com.example.liveview.shared.context.LivePageRenderer;
import com.example.liveview.shared.util.CallbackFrameCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;

@Configuration
public class LiveViewEngineConfig {

    @Bean(initMethod = "init", destroyMethod = "shutdown")
    public LiveContextDirectory liveContextDirectory(LiveViewProperties liveViewProperties,
                                                     @Qualifier("liveTimeoutScheduler") Scheduler liveTimeoutScheduler) {
        return new LiveContextDirectory(liveViewProperties.getConnectTimeout(), liveTimeoutScheduler, Clock.systemUTC());
    }

    @Bean
    public LivePageRenderer livePageRenderer(LiveContextDirectory liveContextDirectory) {
        return new LivePageRenderer(liveContextDirectory);
    }

    @Bean
    public CallbackFrameCodec callbackFrameCodec(ObjectMapper objectMapper) {
        return new CallbackFrameCodec(objectMapper);
    }
}
