package com.example.liveview.shared.model;

public enum CallbackOutcome {
    INVOKED,
    NOT_FOUND,
    FAILED
}
