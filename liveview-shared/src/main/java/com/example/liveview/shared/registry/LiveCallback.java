package com.example.liveview.shared.registry;

import java.util.List;

/**
 * Server-side handler invoked by the client with positional JSON arguments.
 */
@FunctionalInterface
public interface LiveCallback {

    void invoke(List<Object> args) throws Exception;

    static LiveCallback of(Runnable action) {
        return args -> action.run();
    }
}
