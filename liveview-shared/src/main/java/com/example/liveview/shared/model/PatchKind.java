package com.example.liveview.shared.model;

public enum PatchKind {
    UPDATE,
    DELETE
}
