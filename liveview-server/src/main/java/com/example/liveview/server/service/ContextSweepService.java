package com.example.liveview.server.service;

import com.example.liveview.shared.context.LiveContextDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class ContextSweepService {

    private final LiveContextDirectory liveContextDirectory;

    /**
     * Safety net behind the per-context timeout tasks.
     */
    @Scheduled(fixedDelayString = "#{@liveViewProperties.sweepInterval.toMillis()}")
    public void sweepExpiredContexts() {
        try {
            int expired = liveContextDirectory.sweepExpired();
            if (expired > 0) {
                log.info("Swept {} live contexts past their connect deadline", expired);
            }
        } catch (Exception e) {
            log.error("Error during live context sweep: {}", e.getMessage(), e);
        }
    }
}
