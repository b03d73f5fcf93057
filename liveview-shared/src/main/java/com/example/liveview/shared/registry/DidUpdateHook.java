package com.example.liveview.shared.registry;

import com.example.liveview.shared.model.Patch;

import java.util.Optional;

/**
 * Computes an extra patch sent in the same batch as a component update.
 */
@FunctionalInterface
public interface DidUpdateHook<T> {

    Optional<Patch> afterUpdate(long targetId, T value);
}
