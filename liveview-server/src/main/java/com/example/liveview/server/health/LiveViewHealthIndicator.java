package com.example.liveview.server.health;

import com.example.liveview.shared.context.LiveContextDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LiveViewHealthIndicator implements HealthIndicator {

    private final LiveContextDirectory liveContextDirectory;

    @Override
    public Health health() {
        try {
            return Health.up()
                    .withDetail("liveContexts", liveContextDirectory.size())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("liveContextsError", e.getMessage())
                    .build();
        }
    }
}
