package com.example.liveview.server.demo;

import com.example.liveview.server.service.LivePageService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;

@RestController
@RequiredArgsConstructor
public class DemoController {

    private final LivePageService livePageService;

    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public Flux<DataBuffer> counter(ServerWebExchange exchange) {
        return livePageService.renderPage(new CounterPage(), exchange.getResponse().bufferFactory());
    }
}
