package com.example.liveview.shared.registry;

import com.example.liveview.shared.model.Patch;
import com.example.liveview.shared.model.PatchEncoding;
import com.example.liveview.shared.model.PatchMode;
import com.example.liveview.shared.model.PatchPayload;
import com.example.liveview.shared.model.SourceValue;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Per-context table of components and callbacks, and the pipeline turning source
 * emissions into patches.
 * <p>
 * Table mutations happen under one table lock so structural changes are never observed half
 * applied. Source updates, page renders, teardown and outbound sends additionally run under the update
 * lock, which makes the order of emitted batches match the order updates were processed in.
 * Callbacks are never invoked while either lock is held.
 */
@Slf4j
public class ComponentRegistry {

    @Getter
    private final UUID contextId;
    private final Consumer<List<Patch>> patchSink;
    private final Object tableLock = new Object();
    private final ReentrantLock updateLock = new ReentrantLock();
    private final Map<Long, ComponentEntry<?>> components = new HashMap<>();
    private final Map<Long, LiveCallback> callbacks = new HashMap<>();
    private long nextId;
    private boolean closed;

    public ComponentRegistry(UUID contextId, Consumer<List<Patch>> patchSink) {
        this.contextId = contextId;
        this.patchSink = patchSink;
    }

    /**
     * Scope for a page render. Registrations through it are rejected once it is closed.
     */
    public RenderScope rootScope(Writer out) {
        return new RenderScope(this, null, out);
    }

    public <T> long register(Long parentId, ComponentDefinition<T> definition) {
        definition.validate(parentId);
        long id;
        synchronized (tableLock) {
            ensureOpen();
            ComponentEntry<?> parent = parentId == null ? null : components.get(parentId);
            if (parentId != null && parent == null) {
                throw new IllegalStateException("Parent component " + parentId + " is no longer registered in context " + contextId);
            }
            id = nextId++;
            components.put(id, new ComponentEntry<>(id, parentId, definition));
            if (parent != null) {
                parent.children.add(id);
            }
        }
        if (definition.getSource() != null) {
            Disposable subscription = definition.getSource().listen(value -> handleSourceValue(id, value));
            boolean attached;
            synchronized (tableLock) {
                ComponentEntry<?> entry = components.get(id);
                attached = entry != null;
                if (attached) {
                    entry.subscription = subscription;
                }
            }
            if (!attached) {
                // removed while subscribing, e.g. by a publisher that completed synchronously
                subscription.dispose();
            }
        }
        log.debug("Registered component {} (parent {}, mode {}) in context {}", id, parentId, definition.getMode(), contextId);
        return id;
    }

    public long registerCallback(Long parentId, LiveCallback callback) {
        synchronized (tableLock) {
            ensureOpen();
            ComponentEntry<?> parent = parentId == null ? null : components.get(parentId);
            if (parentId != null && parent == null) {
                throw new IllegalStateException("Parent component " + parentId + " is no longer registered in context " + contextId);
            }
            long id = nextId++;
            callbacks.put(id, callback);
            if (parent != null) {
                parent.callbacks.add(id);
            }
            return id;
        }
    }

    public Optional<LiveCallback> findCallback(long id) {
        synchronized (tableLock) {
            return Optional.ofNullable(callbacks.get(id));
        }
    }

    /**
     * Routes one source emission of component {@code id} to the client.
     */
    public void handleSourceValue(long id, SourceValue<?> value) {
        updateLock.lock();
        try {
            ComponentEntry<?> entry;
            synchronized (tableLock) {
                entry = closed ? null : components.get(id);
            }
            if (entry == null) {
                log.debug("Ignoring value for component {} no longer registered in context {}", id, contextId);
                return;
            }
            if (value instanceof SourceValue.Present<?> present) {
                if (present.value() == null) {
                    return;
                }
                update(entry, present.value());
            } else {
                removeComponent(entry);
            }
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Sends patches that did not originate from a source, ordered with source updates.
     */
    public void emit(List<Patch> patches) {
        if (patches.isEmpty()) {
            return;
        }
        updateLock.lock();
        try {
            patchSink.accept(List.copyOf(patches));
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Runs a render pass so that no source update is applied halfway through it.
     */
    public <V> V withUpdatesHeld(Callable<V> pass) throws Exception {
        updateLock.lock();
        try {
            return pass.call();
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Tears down the component, its descendants and every callback they own.
     * Does nothing if the component is not registered. Waits for an update in progress to finish.
     */
    public void deregister(long id) {
        updateLock.lock();
        try {
            List<ComponentEntry<?>> removed;
            synchronized (tableLock) {
                ComponentEntry<?> entry = components.get(id);
                if (entry == null) {
                    return;
                }
                removed = detach(entry, true);
            }
            release(removed);
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Tears down every descendant and owned callback of the component, leaving it registered
     * with empty child and callback sets.
     */
    public void cleanupSubtree(long id) {
        updateLock.lock();
        try {
            List<ComponentEntry<?>> removed;
            synchronized (tableLock) {
                ComponentEntry<?> entry = components.get(id);
                if (entry == null) {
                    return;
                }
                removed = detach(entry, false);
            }
            release(removed);
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Tears down everything. Later registrations are rejected and later emissions ignored.
     */
    public void cleanupAll() {
        updateLock.lock();
        try {
            List<ComponentEntry<?>> removed;
            synchronized (tableLock) {
                if (closed) {
                    return;
                }
                closed = true;
                removed = new ArrayList<>(components.values());
                components.clear();
                callbacks.clear();
            }
            release(removed);
            log.debug("Cleaned up {} components of context {}", removed.size(), contextId);
        } finally {
            updateLock.unlock();
        }
    }

    public int componentCount() {
        synchronized (tableLock) {
            return components.size();
        }
    }

    public int sourcedComponentCount() {
        synchronized (tableLock) {
            return (int) components.values().stream().filter(ComponentEntry::hasSource).count();
        }
    }

    public int callbackCount() {
        synchronized (tableLock) {
            return callbacks.size();
        }
    }

    public boolean isRegistered(long id) {
        synchronized (tableLock) {
            return components.containsKey(id);
        }
    }

    public List<Long> childrenOf(long id) {
        synchronized (tableLock) {
            ComponentEntry<?> entry = components.get(id);
            return entry == null ? List.of() : List.copyOf(entry.children);
        }
    }

    private <T> void update(ComponentEntry<T> entry, Object raw) {
        @SuppressWarnings("unchecked")
        T value = (T) raw;
        ComponentDefinition<T> definition = entry.definition;
        PatchMode mode = definition.getMode();
        log.debug("Component {} of context {} has {}", entry.id, contextId, value);
        if (mode == PatchMode.REPLACE) {
            cleanupSubtree(entry.id);
        }
        long targetId = mode.isTargetsParent() ? entry.parentId : entry.id;
        Optional<PatchPayload> payload = render(entry, value);
        if (payload.isEmpty()) {
            return;
        }
        List<Patch> patches = new ArrayList<>(2);
        patches.add(Patch.update(targetId, mode, payload.get()));
        if (definition.getDidUpdate() != null) {
            try {
                definition.getDidUpdate().afterUpdate(targetId, value).ifPresent(patches::add);
            } catch (RuntimeException e) {
                log.error("Did-update hook of component {} in context {} failed", entry.id, contextId, e);
            }
        }
        patchSink.accept(List.copyOf(patches));
    }

    private <T> Optional<PatchPayload> render(ComponentEntry<T> entry, T value) {
        ComponentDefinition<T> definition = entry.definition;
        try {
            if (definition.getMode().getEncoding() == PatchEncoding.MARKUP) {
                StringWriter out = new StringWriter();
                try (RenderScope scope = new RenderScope(this, entry.id, out)) {
                    definition.getRenderer().render(scope, value);
                }
                return Optional.of(PatchPayload.markup(out.toString()));
            }
            return Optional.of(PatchPayload.structured(definition.getDataMapper().apply(value)));
        } catch (Exception e) {
            log.error("Component {} in context {} failed to render {}", entry.id, contextId, value, e);
            return Optional.empty();
        }
    }

    private void removeComponent(ComponentEntry<?> entry) {
        long targetId = entry.definition.getMode().isTargetsParent() ? entry.parentId : entry.id;
        log.debug("Source of component {} in context {} signalled removal", entry.id, contextId);
        patchSink.accept(List.of(Patch.delete(targetId)));
        deregister(entry.id);
    }

    /**
     * Removes the subtree below {@code entry} (and the entry itself if {@code includeSelf})
     * from the tables. Must hold the table lock. Returns the detached entries for release.
     */
    private List<ComponentEntry<?>> detach(ComponentEntry<?> entry, boolean includeSelf) {
        List<ComponentEntry<?>> removed = new ArrayList<>();
        for (Long childId : List.copyOf(entry.children)) {
            ComponentEntry<?> child = components.get(childId);
            if (child != null) {
                removed.addAll(detach(child, true));
            }
        }
        entry.callbacks.forEach(callbacks::remove);
        entry.children.clear();
        entry.callbacks.clear();
        if (includeSelf) {
            components.remove(entry.id);
            if (entry.parentId != null) {
                ComponentEntry<?> parent = components.get(entry.parentId);
                if (parent != null) {
                    parent.children.remove(entry.id);
                }
            }
            removed.add(entry);
        }
        return removed;
    }

    /**
     * Unsubscribes and closes the sources of detached entries, outside the table lock.
     */
    private void release(List<ComponentEntry<?>> removed) {
        for (ComponentEntry<?> entry : removed) {
            Disposable subscription;
            synchronized (tableLock) {
                subscription = entry.subscription;
                entry.subscription = null;
            }
            if (subscription != null) {
                subscription.dispose();
            }
            if (entry.hasSource()) {
                try {
                    entry.definition.getSource().close();
                } catch (RuntimeException e) {
                    log.warn("Closing source of component {} in context {} failed", entry.id, contextId, e);
                }
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Context " + contextId + " is closed");
        }
    }
}
