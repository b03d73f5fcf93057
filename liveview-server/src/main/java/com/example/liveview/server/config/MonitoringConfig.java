package com.example.liveview.server.config;

import com.example.liveview.shared.context.LiveContextDirectory;
import com.example.liveview.shared.model.CallbackOutcome;
import com.example.liveview.shared.model.ContextCloseReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics for live contexts, patches and callbacks.
 */
@Configuration
public class MonitoringConfig {

    @Bean
    public LiveViewMetrics liveViewMetrics(MeterRegistry registry, LiveContextDirectory liveContextDirectory) {
        LiveViewMetrics metrics = new LiveViewMetrics(registry, liveContextDirectory);
        liveContextDirectory.onContextClosed((context, reason) -> metrics.contextClosed(reason));
        return metrics;
    }

    public static class LiveViewMetrics {
        private final Counter patchesSent;
        private final Counter malformedFrames;
        private final Map<CallbackOutcome, Counter> callbacks = new EnumMap<>(CallbackOutcome.class);
        private final Map<ContextCloseReason, Counter> closedContexts = new EnumMap<>(ContextCloseReason.class);

        public LiveViewMetrics(MeterRegistry registry, LiveContextDirectory directory) {
            Gauge.builder("liveview.contexts.active", directory, LiveContextDirectory::size)
                    .description("Live contexts awaiting or holding a connection")
                    .register(registry);
            patchesSent = Counter.builder("liveview.patches.sent")
                    .description("Patches written to a transport")
                    .register(registry);
            malformedFrames = Counter.builder("liveview.frames.malformed")
                    .description("Inbound callback frames that could not be decoded")
                    .register(registry);
            for (CallbackOutcome outcome : CallbackOutcome.values()) {
                callbacks.put(outcome, registry.counter("liveview.callbacks.dispatched", "outcome", outcome.name()));
            }
            for (ContextCloseReason reason : ContextCloseReason.values()) {
                closedContexts.put(reason, registry.counter("liveview.contexts.closed", "reason", reason.name()));
            }
        }

        public void patchesSent(int count) {
            patchesSent.increment(count);
        }

        public void malformedFrame() {
            malformedFrames.increment();
        }

        public void callbackDispatched(CallbackOutcome outcome) {
            callbacks.get(outcome).increment();
        }

        public void contextClosed(ContextCloseReason reason) {
            closedContexts.get(reason).increment();
        }
    }
}
