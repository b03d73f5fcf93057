package com.example.liveview.shared.model;

import java.util.Objects;

public record PatchPayload(PatchEncoding encoding, Object value) {

    public PatchPayload {
        Objects.requireNonNull(encoding, "encoding");
    }

    public static PatchPayload markup(String markup) {
        return new PatchPayload(PatchEncoding.MARKUP, markup == null ? "" : markup);
    }

    public static PatchPayload structured(Object value) {
        return new PatchPayload(PatchEncoding.STRUCTURED, value);
    }
}
