package com.example.liveview.shared.registry;

import com.example.liveview.shared.model.PatchEncoding;

import java.io.IOException;
import java.io.Writer;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Explicit render-time position in the component tree: the registry, the component that
 * owns anything registered through this scope, and the sink markup is written to.
 * <p>
 * A scope and the child scopes derived from it form one render pass. Closing any of them ends
 * the pass, after which registrations fail with {@link IllegalStateException}. A scope kept in
 * a callback therefore cannot grow the tree outside a render.
 */
public class RenderScope implements AutoCloseable {

    public static final String COMPONENT_ATTRIBUTE = "data-rl";

    private final ComponentRegistry registry;
    private final Long parentId;
    private final Writer out;
    private final AtomicBoolean pass;

    RenderScope(ComponentRegistry registry, Long parentId, Writer out) {
        this(registry, parentId, out, new AtomicBoolean(true));
    }

    private RenderScope(ComponentRegistry registry, Long parentId, Writer out, AtomicBoolean pass) {
        this.registry = registry;
        this.parentId = parentId;
        this.out = out;
        this.pass = pass;
    }

    public UUID contextId() {
        return registry.getContextId();
    }

    /**
     * Id of the enclosing component, or {@code null} at the top level of the page.
     */
    public Long parentId() {
        return parentId;
    }

    public Writer out() {
        return out;
    }

    public RenderScope write(String markup) throws IOException {
        out.write(markup);
        return this;
    }

    /**
     * Registers a component under the enclosing component without writing anything.
     */
    public <T> long register(ComponentDefinition<T> definition) {
        ensureActive();
        return registry.register(parentId, definition);
    }

    /**
     * Registers a component and, for markup modes, writes its container element with the
     * source's current value rendered inside.
     */
    public <T> long component(ComponentDefinition<T> definition) throws Exception {
        long id = register(definition);
        if (definition.getMode().getEncoding() != PatchEncoding.MARKUP) {
            return id;
        }
        out.write("<span " + COMPONENT_ATTRIBUTE + "=\"" + id + "\">");
        if (definition.getSource() != null && definition.getRenderer() != null) {
            Optional<T> initial = definition.getSource().current();
            if (initial.isPresent()) {
                definition.getRenderer().render(child(id), initial.get());
            }
        }
        out.write("</span>");
        return id;
    }

    /**
     * Registers a sourceless component. Its id marks an element that attribute components patch.
     */
    public long anchor() {
        return register(ComponentDefinition.anchor());
    }

    public RenderScope child(long componentId) {
        return new RenderScope(registry, componentId, out, pass);
    }

    public CallbackHandle callback(LiveCallback callback) {
        ensureActive();
        return new CallbackHandle(registry.registerCallback(parentId, callback));
    }

    public boolean isActive() {
        return pass.get();
    }

    /**
     * Ends the render pass this scope belongs to.
     */
    @Override
    public void close() {
        pass.set(false);
    }

    private void ensureActive() {
        if (!pass.get()) {
            throw new IllegalStateException("Render pass of context " + contextId() + " has ended");
        }
    }
}
