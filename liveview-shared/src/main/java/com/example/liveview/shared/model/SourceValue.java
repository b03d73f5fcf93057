package com.example.liveview.shared.model;

/**
 * A single emission of a live source: either a value or the signal that the
 * component bound to the source must be removed.
 * A present {@code null} value means nothing changed.
 */
public sealed interface SourceValue<T> permits SourceValue.Present, SourceValue.Removed {

    static <T> SourceValue<T> of(T value) {
        return new Present<>(value);
    }

    static <T> SourceValue<T> removed() {
        return new Removed<>();
    }

    record Present<T>(T value) implements SourceValue<T> {
    }

    record Removed<T>() implements SourceValue<T> {
    }
}
