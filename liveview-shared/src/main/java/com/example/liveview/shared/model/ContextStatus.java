package com.example.liveview.shared.model;

public enum ContextStatus {
    NOT_CONNECTED,
    CONNECTED,
    CLOSED
}
