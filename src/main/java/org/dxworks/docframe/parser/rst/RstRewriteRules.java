package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementTraversal;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.block.DecoratedHeader;
import org.dxworks.docframe.model.block.Header;
import org.dxworks.docframe.model.block.HeaderDecoration;
import org.dxworks.docframe.model.rst.CustomizedTextRole;
import org.dxworks.docframe.model.rst.InterpretedText;
import org.dxworks.docframe.model.rst.SubstitutionDefinition;
import org.dxworks.docframe.model.rst.SubstitutionReference;
import org.dxworks.docframe.model.span.InvalidSpan;
import org.dxworks.docframe.rewrite.RewriteAction;
import org.dxworks.docframe.rewrite.RewriteEngine;
import org.dxworks.docframe.rewrite.RewriteRule;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Resolves the reStructuredText specific elements of a document: substitution references,
 * interpreted text and decorated headers. The lookup tables are built once from the raw document.
 */
public class RstRewriteRules implements RewriteRule {

    private final Map<String, SubstitutionDefinition> substitutionDefinitions = new HashMap<>();
    private final Map<String, Span> substitutions = new HashMap<>();
    private final Set<String> resolving = new HashSet<>();
    private final Map<String, Function<String, Span>> textRoles = TextRoles.standard();
    private final List<HeaderDecoration> decorations;

    private RstRewriteRules(Document document) {
        for (SubstitutionDefinition definition : ElementTraversal.collect(document, SubstitutionDefinition.class)) {
            substitutionDefinitions.putIfAbsent(key(definition.name()), definition);
        }
        for (CustomizedTextRole role : ElementTraversal.collect(document, CustomizedTextRole.class)) {
            textRoles.put(key(role.name()), role.roleFunction());
        }
        decorations = ElementTraversal.collect(document, DecoratedHeader.class).stream()
                .map(DecoratedHeader::decoration)
                .distinct()
                .toList();
    }

    public static RstRewriteRules forDocument(Document document) {
        return new RstRewriteRules(document);
    }

    @Override
    public RewriteAction apply(Element element) {
        if (element instanceof SubstitutionReference reference) {
            return RewriteAction.expand(substitution(reference));
        }
        if (element instanceof InterpretedText text) {
            Function<String, Span> role = textRoles.get(key(text.role()));
            if (role == null) return RewriteAction.replace(InvalidSpan.error("unknown text role: " + text.role(), text.source()));
            return RewriteAction.replace(role.apply(text.content()));
        }
        if (element instanceof DecoratedHeader header) {
            return RewriteAction.replace(new Header(levelOf(header.decoration()), header.content(), header.options()));
        }
        if (element instanceof SubstitutionDefinition || element instanceof CustomizedTextRole) {
            return RewriteAction.remove();
        }
        return RewriteAction.unmatched();
    }

    int levelOf(HeaderDecoration decoration) {
        return decorations.indexOf(decoration) + 1;
    }

    /**
     * The resolved value of a substitution. Substitutions may use other substitutions, a
     * substitution that refers back to itself becomes invalid.
     */
    private Span substitution(SubstitutionReference reference) {
        String key = key(reference.name());
        Span resolved = substitutions.get(key);
        if (resolved != null) return resolved;

        SubstitutionDefinition definition = substitutionDefinitions.get(key);
        if (definition == null) {
            return InvalidSpan.error("unknown substitution id: " + reference.name(), reference.source());
        }
        if (!resolving.add(key)) {
            return InvalidSpan.error("circular substitution reference: " + reference.name(), reference.source());
        }
        try {
            Span value = RewriteEngine.rewrite(definition.content(), Span.class, List.of(this));
            substitutions.put(key, value);
            return value;
        } finally {
            resolving.remove(key);
        }
    }

    private static String key(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }
}
