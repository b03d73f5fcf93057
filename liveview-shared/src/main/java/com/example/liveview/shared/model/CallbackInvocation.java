package com.example.liveview.shared.model;

import java.util.List;

public record CallbackInvocation(long callbackId, List<Object> args) {

    public CallbackInvocation {
        args = args == null ? List.of() : args;
    }
}
