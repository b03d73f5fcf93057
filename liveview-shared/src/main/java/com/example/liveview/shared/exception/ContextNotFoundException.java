package com.example.liveview.shared.exception;

import lombok.Getter;

@Getter
public class ContextNotFoundException extends RuntimeException {

    private final String contextId;

    public ContextNotFoundException(String contextId) {
        super("No such live context");
        this.contextId = contextId;
    }
}
