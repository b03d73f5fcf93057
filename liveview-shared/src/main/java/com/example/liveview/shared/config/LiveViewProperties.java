package com.example.liveview.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class LiveViewProperties {

    @NotBlank
    private String path = "/__live";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration sweepInterval = Duration.ofSeconds(10);

    private final Sse sse = new Sse();
    private final Websocket websocket = new Websocket();
    private final Service service = new Service();

    @Data
    public static class Sse {
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Websocket {
        @Positive
        private int maxFramePayloadLength = 65536;
        private boolean compression = true;
    }

    @Data
    public static class Service {
        @NotBlank
        private String name = "liveview";
    }
}
