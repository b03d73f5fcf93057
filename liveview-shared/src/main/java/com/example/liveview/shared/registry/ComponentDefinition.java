package com.example.liveview.shared.registry;

import com.example.liveview.shared.model.PatchEncoding;
import com.example.liveview.shared.model.PatchMode;
import com.example.liveview.shared.source.LiveSource;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Function;

/**
 * Everything the registry needs to keep one component up to date.
 * Markup modes need a {@link #renderer}, structured modes a {@link #dataMapper}.
 */
@Getter
@Builder(toBuilder = true)
public class ComponentDefinition<T> {

    private final LiveSource<T> source;
    private final Renderer<T> renderer;
    private final Function<? super T, ?> dataMapper;
    @Builder.Default
    private final PatchMode mode = PatchMode.REPLACE;
    private final DidUpdateHook<T> didUpdate;

    public static <T> ComponentDefinition<T> markup(LiveSource<T> source, Renderer<T> renderer) {
        return ComponentDefinition.<T>builder().source(source).renderer(renderer).build();
    }

    public static <T> ComponentDefinition<T> markup(LiveSource<T> source, PatchMode mode, Renderer<T> renderer) {
        return ComponentDefinition.<T>builder().source(source).mode(mode).renderer(renderer).build();
    }

    public static <T> ComponentDefinition<T> attribute(LiveSource<T> source, Function<? super T, ?> dataMapper) {
        return ComponentDefinition.<T>builder().source(source).mode(PatchMode.ATTRIBUTE).dataMapper(dataMapper).build();
    }

    public static <T> ComponentDefinition<T> json(LiveSource<T> source, Function<? super T, ?> dataMapper) {
        return ComponentDefinition.<T>builder().source(source).mode(PatchMode.JSON).dataMapper(dataMapper).build();
    }

    /**
     * Component without a source, used as the parent of attribute components and as a plain
     * grouping node.
     */
    public static <T> ComponentDefinition<T> anchor() {
        return ComponentDefinition.<T>builder().build();
    }

    void validate(Long parentId) {
        if (mode == null) {
            throw new IllegalArgumentException("Component mode must not be null");
        }
        if (source == null) {
            return;
        }
        if (mode.getEncoding() == PatchEncoding.MARKUP && renderer == null) {
            throw new IllegalArgumentException("Mode " + mode + " requires a renderer");
        }
        if (mode.getEncoding() == PatchEncoding.STRUCTURED && dataMapper == null) {
            throw new IllegalArgumentException("Mode " + mode + " requires a data mapper");
        }
        if (mode.isTargetsParent() && parentId == null) {
            throw new IllegalArgumentException("Mode " + mode + " requires a parent component");
        }
    }
}
