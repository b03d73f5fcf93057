package com.example.liveview.shared.model;

import java.util.Objects;

/**
 * One UI delta addressed to a rendered component.
 * Deletions carry only the target id; mode and payload are null.
 */
public record Patch(long targetId, PatchKind kind, PatchMode mode, PatchPayload payload) {

    public static final String DELETE_WIRE_NAME = "delete";

    public static Patch update(long targetId, PatchMode mode, PatchPayload payload) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(payload, "payload");
        if (payload.encoding() != mode.getEncoding()) {
            throw new IllegalArgumentException("Mode " + mode + " expects " + mode.getEncoding()
                    + " payload but got " + payload.encoding());
        }
        return new Patch(targetId, PatchKind.UPDATE, mode, payload);
    }

    public static Patch delete(long targetId) {
        return new Patch(targetId, PatchKind.DELETE, null, null);
    }

    public boolean isDelete() {
        return kind == PatchKind.DELETE;
    }

    public String wireMode() {
        return isDelete() ? DELETE_WIRE_NAME : mode.getWireName();
    }
}
