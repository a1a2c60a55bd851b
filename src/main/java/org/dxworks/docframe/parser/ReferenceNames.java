package org.dxworks.docframe.parser;

import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SpanContainer;
import org.dxworks.docframe.model.link.Image;
import org.dxworks.docframe.model.span.Literal;
import org.dxworks.docframe.model.span.Text;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns reference names and header titles into ids. All targets and references go through
 * the same normalization, so {@code `Some Title`_} finds the header {@code Some Title}.
 */
public final class ReferenceNames {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]+");

    private ReferenceNames() {
        // utility class
    }

    public static String toId(String name) {
        String id = NON_ALPHANUMERIC.matcher(name).replaceAll("-");
        if (id.startsWith("-")) id = id.substring(1);
        if (id.endsWith("-")) id = id.substring(0, id.length() - 1);
        return id.toLowerCase(Locale.ROOT);
    }

    /**
     * The text of the spans without any markup.
     */
    public static String flattenText(List<? extends Span> spans) {
        StringBuilder sb = new StringBuilder();
        for (Span span : spans) {
            if (span instanceof Text text) {
                sb.append(text.content());
            } else if (span instanceof SpanContainer<?> container) {
                sb.append(flattenText(container.content()));
            } else if (span instanceof Literal literal) {
                sb.append(literal.content());
            } else if (span instanceof Image image) {
                sb.append(image.text());
            }
        }
        return sb.toString();
    }
}
