package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.Literal;
import org.dxworks.docframe.model.span.SpanSequence;
import org.dxworks.docframe.model.span.Strong;
import org.dxworks.docframe.model.span.Text;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The standard roles of interpreted text.
 */
final class TextRoles {

    private TextRoles() {
        // utility class
    }

    static Map<String, Function<String, Span>> standard() {
        Map<String, Function<String, Span>> roles = new HashMap<>();
        roles.put("emphasis", text -> new Emphasized(List.of(new Text(text))));
        roles.put("strong", text -> new Strong(List.of(new Text(text))));
        roles.put("literal", Literal::new);
        Function<String, Span> titleReference =
                text -> new Emphasized(List.of(new Text(text)), Options.withStyles("title-reference"));
        roles.put("title-reference", titleReference);
        roles.put("title", titleReference);
        roles.put("t", titleReference);
        Function<String, Span> subscript = text -> new Text(text, Options.withStyles("subscript"));
        roles.put("subscript", subscript);
        roles.put("sub", subscript);
        Function<String, Span> superscript = text -> new Text(text, Options.withStyles("superscript"));
        roles.put("superscript", superscript);
        roles.put("sup", superscript);
        return roles;
    }

    /**
     * Adds options to the result of another role.
     */
    static Span withOptions(Span span, Options options) {
        if (span instanceof Text text) return new Text(text.content(), text.options().plus(options));
        if (span instanceof Emphasized emphasized) return new Emphasized(emphasized.content(), emphasized.options().plus(options));
        if (span instanceof Strong strong) return new Strong(strong.content(), strong.options().plus(options));
        if (span instanceof Literal literal) return new Literal(literal.content(), literal.options().plus(options));
        return new SpanSequence(List.of(span), options);
    }
}
