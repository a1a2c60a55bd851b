package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Customizable;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementContainer;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.TextContainer;

import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Renders the structure of a tree, one element per line, for debugging and tests:
 * <pre>
 * Document - Blocks: 1
 * . Paragraph - Spans: 2
 * . . Text - 'some '
 * . . Emphasized - Spans: 1
 * . . . Text - 'text'
 * </pre>
 * Record elements show their other components as attributes, or as labelled groups when they
 * hold elements. Other elements are shown through their children.
 */
public class PrettyPrintRenderer implements RenderFormat<TextWriter> {

    public static final int DEFAULT_MAX_TEXT_WIDTH = 50;

    private final int maxTextWidth;

    public PrettyPrintRenderer() {
        this(DEFAULT_MAX_TEXT_WIDTH);
    }

    public PrettyPrintRenderer(int maxTextWidth) {
        if (maxTextWidth < 1) throw new IllegalArgumentException("maxTextWidth must be positive: " + maxTextWidth);
        this.maxTextWidth = maxTextWidth;
    }

    private record Group(String label, List<Element> elements) {
    }

    @Override
    public TextWriter newWriter(Appendable out, Consumer<Element> render) {
        return new TextWriter(out, render);
    }

    @Override
    public void renderElement(TextWriter out, Element element) {
        List<String> attributes = new ArrayList<>();
        List<Object> children = new ArrayList<>();
        if (element.getClass().isRecord()) {
            inspectRecord(element, attributes, children);
        } else {
            children.addAll(element.children());
        }
        if (element instanceof Customizable customizable && !customizable.options().isEmpty()) {
            attributes.add(customizable.options().toString());
        }

        out.text(element.getClass().getSimpleName());
        if (!attributes.isEmpty()) out.text("(" + String.join(",", attributes) + ")");
        if (element instanceof TextContainer text) {
            out.text(" - '" + abbreviate(text.content()) + "'");
        } else if (element instanceof ElementContainer<?, ?> container) {
            out.text(" - " + kind(container.childType()) + ": " + container.content().size());
        }

        out.indented(() -> {
            for (Object child : children) {
                out.newLine();
                if (child instanceof Group group) {
                    out.text(group.label() + " - " + kind(group.elements()) + ": " + group.elements().size())
                            .indented(group.elements());
                } else {
                    out.element((Element) child);
                }
            }
        });
    }

    /**
     * Sorts the components of a record element into attributes, child elements and groups.
     * The content of a container is listed as direct children.
     */
    private static void inspectRecord(Element element, List<String> attributes, List<Object> children) {
        for (RecordComponent component : element.getClass().getRecordComponents()) {
            String name = component.getName();
            Object value = read(element, component.getAccessor());
            if (value == null || value instanceof Options || name.equals("content") && value instanceof String) continue;

            if (value instanceof Element child) {
                children.add(child);
            } else if (value instanceof List<?> list && isElementList(list)) {
                List<Element> elements = new ArrayList<>();
                list.forEach(item -> elements.add((Element) item));
                if (name.equals("content") && element instanceof ElementContainer<?, ?>) {
                    children.addAll(elements);
                } else if (!elements.isEmpty()) {
                    children.add(new Group(capitalize(name), elements));
                }
            } else if (isPrintable(value)) {
                attributes.add(value.toString());
            }
        }
    }

    private static Object read(Element element, Method accessor) {
        try {
            accessor.trySetAccessible();
            return accessor.invoke(element);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot read " + accessor.getName() + " of " + element.getClass().getName(), e);
        }
    }

    private static boolean isElementList(List<?> list) {
        return list.stream().allMatch(Element.class::isInstance);
    }

    /**
     * Values whose string form is meaningful, leaving out functions and the like.
     */
    private static boolean isPrintable(Object value) {
        return value instanceof CharSequence || value instanceof Number || value instanceof Character
                || value instanceof Boolean || value instanceof Enum<?> || value.getClass().isRecord();
    }

    private static String kind(Class<?> childType) {
        if (childType == Block.class) return "Blocks";
        if (childType == Span.class) return "Spans";
        return "Elements";
    }

    private static String kind(List<?> elements) {
        if (!elements.isEmpty() && elements.stream().allMatch(Block.class::isInstance)) return "Blocks";
        if (!elements.isEmpty() && elements.stream().allMatch(Span.class::isInstance)) return "Spans";
        return "Elements";
    }

    String abbreviate(String text) {
        String singleLine = text.replace('\n', '|');
        if (singleLine.length() <= maxTextWidth) return singleLine;
        int half = maxTextWidth / 2;
        return singleLine.substring(0, half) + " [...] " + singleLine.substring(singleLine.length() - half);
    }

    private static String capitalize(String name) {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
