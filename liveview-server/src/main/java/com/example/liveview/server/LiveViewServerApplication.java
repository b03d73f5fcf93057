package com.example.liveview.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Live view server.
 *
 * Renders pages once, keeps a live context per browser tab and pushes patches over
 * WebSocket, falling back to Server-Sent Events with POST callbacks.
 */
@SpringBootApplication
@EnableScheduling
public class LiveViewServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveViewServerApplication.class, args);
    }
}
