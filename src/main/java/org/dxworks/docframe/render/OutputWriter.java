package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Element;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Writes rendered output to an {@link Appendable}. Child elements are not rendered by the
 * writer itself but handed to the render function of the {@link Renderer}, so overrides
 * registered there apply at every level of the tree.
 *
 * @param <W> the concrete writer type returned by the fluent methods
 */
public abstract class OutputWriter<W extends OutputWriter<W>> {

    private final Appendable out;
    private final Consumer<Element> render;
    private final String indentItem;
    private int level;

    protected OutputWriter(Appendable out, Consumer<Element> render, String indentItem) {
        this.out = Objects.requireNonNull(out, "out");
        this.render = Objects.requireNonNull(render, "render");
        this.indentItem = indentItem;
    }

    protected abstract W self();

    /**
     * Writes the text as it is.
     *
     * @throws UncheckedIOException if the underlying output fails
     */
    public W text(String text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return self();
    }

    /**
     * Starts a new line indented to the current level.
     */
    public W newLine() {
        return text("\n" + indentItem.repeat(level));
    }

    public W element(Element element) {
        render.accept(element);
        return self();
    }

    public W elements(List<? extends Element> elements) {
        elements.forEach(this::element);
        return self();
    }

    /**
     * Renders every element on its own line, one level deeper than the current one.
     */
    public W indented(List<? extends Element> elements) {
        return indented(() -> elements.forEach(element -> newLine().element(element)));
    }

    public W indented(Runnable body) {
        level++;
        try {
            body.run();
        } finally {
            level--;
        }
        return self();
    }
}
