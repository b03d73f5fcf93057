package com.example.liveview.shared.model;

public enum PatchEncoding {
    /** Rendered markup, swapped into the DOM as-is. */
    MARKUP,
    /** A data value interpreted by client-side script. */
    STRUCTURED
}
