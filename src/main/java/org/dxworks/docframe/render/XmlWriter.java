package org.dxworks.docframe.render;

import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.Options;

import java.util.function.Consumer;

/**
 * XML output: escaping, and tags whose id and role attributes come from {@link Options}.
 * Attributes are given as alternating names and values; attributes with a {@code null}
 * value are left out.
 */
public class XmlWriter extends OutputWriter<XmlWriter> {

    public XmlWriter(Appendable out, Consumer<Element> render) {
        super(out, render, "  ");
    }

    @Override
    protected XmlWriter self() {
        return this;
    }

    /**
     * Escapes markup characters. Characters XML does not allow, the control characters other
     * than tab, line feed and carriage return, are dropped.
     */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!isXmlChar(c)) continue;
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isXmlChar(char c) {
        if (c < 0x20) return c == '\t' || c == '\n' || c == '\r';
        return c != 0xFFFE && c != 0xFFFF;
    }

    /**
     * An XML comment. Characters XML does not allow are dropped and {@code --} is split, since
     * it cannot appear inside a comment.
     */
    public XmlWriter comment(String content) {
        StringBuilder sb = new StringBuilder(content.length());
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (isXmlChar(c)) sb.append(c);
        }
        String body = sb.toString();
        while (body.contains("--")) body = body.replace("--", "- -");
        return text("<!-- ").text(body).text(" -->");
    }

    /**
     * Escaped text with its line breaks indented to the current level.
     */
    public XmlWriter escaped(String text) {
        String[] lines = escape(text).split("\n", -1);
        text(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            newLine().text(lines[i]);
        }
        return this;
    }

    /**
     * Escaped text written exactly as it is, for content where whitespace matters.
     */
    public XmlWriter preformatted(String text) {
        return text(escape(text));
    }

    public XmlWriter startTag(String name, Options options, String... attributes) {
        return text("<" + name + attributes(options, attributes) + ">");
    }

    public XmlWriter emptyTag(String name, Options options, String... attributes) {
        return text("<" + name + attributes(options, attributes) + "/>");
    }

    public XmlWriter endTag(String name) {
        return text("</" + name + ">");
    }

    private static String attributes(Options options, String... attributes) {
        if (attributes.length % 2 != 0) {
            throw new IllegalArgumentException("Attributes must be given as name/value pairs");
        }
        StringBuilder sb = new StringBuilder();
        options.id().ifPresent(id -> appendAttribute(sb, "id", id));
        if (!options.styles().isEmpty()) appendAttribute(sb, "role", String.join(" ", options.styles()));
        for (int i = 0; i < attributes.length; i += 2) {
            if (attributes[i + 1] != null) appendAttribute(sb, attributes[i], attributes[i + 1]);
        }
        return sb.toString();
    }

    private static void appendAttribute(StringBuilder sb, String name, String value) {
        sb.append(' ').append(name).append("=\"").append(escape(value)).append('"');
    }
}
