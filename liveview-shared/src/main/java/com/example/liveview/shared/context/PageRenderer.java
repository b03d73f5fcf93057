package com.example.liveview.shared.context;

import com.example.liveview.shared.registry.RenderScope;

/**
 * Produces a full page, registering its live components through the root scope.
 */
@FunctionalInterface
public interface PageRenderer {

    void render(RenderScope scope) throws Exception;
}
