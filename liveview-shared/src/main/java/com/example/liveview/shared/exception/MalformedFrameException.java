package com.example.liveview.shared.exception;

import lombok.Getter;

/**
 * An inbound callback frame or body that cannot be decoded.
 * Keeps the raw frame so the message can be logged with its content.
 */
@Getter
public class MalformedFrameException extends RuntimeException {

    private final String frame;

    public MalformedFrameException(String message, String frame) {
        super(message);
        this.frame = frame;
    }
}
