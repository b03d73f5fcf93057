package com.example.liveview.shared.model;

public enum ContextCloseReason {
    /** The page rendered no sourced components, nothing to keep alive. */
    STATIC_PAGE,
    RENDER_FAILED,
    CONNECT_TIMEOUT,
    DISCONNECTED,
    SHUTDOWN
}
