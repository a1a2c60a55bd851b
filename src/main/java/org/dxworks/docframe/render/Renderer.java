package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders element trees in one {@link RenderFormat}, applying the registered overrides
 * first. Instances are immutable and can be shared, every call uses its own writer.
 */
public final class Renderer<W extends OutputWriter<W>> {

    private final RenderFormat<W> format;
    private final List<RenderOverride<W>> overrides;

    public Renderer(RenderFormat<W> format) {
        this(format, List.of());
    }

    private Renderer(RenderFormat<W> format, List<RenderOverride<W>> overrides) {
        this.format = Objects.requireNonNull(format, "format");
        this.overrides = List.copyOf(overrides);
    }

    public Renderer<W> withOverride(RenderOverride<W> override) {
        List<RenderOverride<W>> extended = new ArrayList<>(overrides);
        extended.add(Objects.requireNonNull(override, "override"));
        return new Renderer<>(format, extended);
    }

    /**
     * Writes the rendered tree to the output. The output is neither flushed nor closed.
     *
     * @throws java.io.UncheckedIOException if writing to the output fails
     */
    public void render(Element root, Appendable out) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.writer = format.newWriter(out, dispatcher::render);
        dispatcher.render(root);
    }

    public String renderToString(Element root) {
        StringBuilder sb = new StringBuilder();
        render(root, sb);
        return sb.toString();
    }

    private final class Dispatcher {
        private W writer;

        void render(Element element) {
            for (RenderOverride<W> override : overrides) {
                if (override.render(writer, element)) return;
            }
            format.renderElement(writer, element);
        }
    }
}
