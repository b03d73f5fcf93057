package com.example.liveview.shared.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How the client applies an update patch to its target element.
 */
@Getter
@RequiredArgsConstructor
public enum PatchMode {
    REPLACE("replace", PatchEncoding.MARKUP, false),
    APPEND("append", PatchEncoding.MARKUP, false),
    PREPEND("prepend", PatchEncoding.MARKUP, false),
    /** Sets an attribute on the parent element, e.g. a class toggled by a boolean source. */
    ATTRIBUTE("attribute", PatchEncoding.STRUCTURED, true),
    /** Hands the raw value to a script-side binding. */
    JSON("json", PatchEncoding.STRUCTURED, false);

    private final String wireName;
    private final PatchEncoding encoding;
    private final boolean targetsParent;
}
