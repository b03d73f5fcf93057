package com.example.liveview.shared.registry;

/**
 * Writes the markup of a component for one value. Components registered through the scope
 * while rendering become children of the component being rendered.
 */
@FunctionalInterface
public interface Renderer<T> {

    void render(RenderScope scope, T value) throws Exception;
}
