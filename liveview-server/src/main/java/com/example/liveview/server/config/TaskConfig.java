package com.example.liveview.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Customizes the thread pool for @Scheduled methods.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("liveview-scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Runs connect-timeout tasks. A pending timeout costs a queued task, not a thread.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler liveTimeoutScheduler() {
        return Schedulers.newSingle("live-timeout");
    }

    /**
     * Callbacks are application code and may block, so they never run on the Netty event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler callbackScheduler() {
        return Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "live-callback");
    }
}
