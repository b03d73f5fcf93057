package com.example.liveview.shared.registry;

import reactor.core.Disposable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable table row. Guarded by the owning registry's table lock.
 */
final class ComponentEntry<T> {

    final long id;
    final Long parentId;
    final ComponentDefinition<T> definition;
    final Set<Long> children = new LinkedHashSet<>();
    final Set<Long> callbacks = new LinkedHashSet<>();
    Disposable subscription;

    ComponentEntry(long id, Long parentId, ComponentDefinition<T> definition) {
        this.id = id;
        this.parentId = parentId;
        this.definition = definition;
    }

    boolean hasSource() {
        return definition.getSource() != null;
    }
}
