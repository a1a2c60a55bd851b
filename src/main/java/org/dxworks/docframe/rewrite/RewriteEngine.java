package org.dxworks.docframe.rewrite;

import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementRewriter;
import org.dxworks.docframe.parser.RawDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies rewrite rules bottom-up: the children of an element are rewritten first, then the
 * rules are tried on the element itself in order until one matches. The tree is never
 * modified, every changed element is copied.
 */
public final class RewriteEngine implements ElementRewriter {

    private final List<RewriteRule> rules;

    private RewriteEngine(List<RewriteRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Resolves a parsed document with its dialect rules followed by the {@link DefaultRewriteRules}.
     */
    public static Document rewrite(RawDocument raw) {
        List<RewriteRule> rules = new ArrayList<>(raw.rewriteRules());
        rules.addAll(DefaultRewriteRules.forDocument(raw.document()));
        return rewrite(raw.document(), Document.class, rules);
    }

    /**
     * @throws IllegalStateException if a rule removes the root or replaces it with an element of another kind
     */
    public static <E extends Element> E rewrite(E root, Class<E> kind, List<RewriteRule> rules) {
        return new RewriteEngine(rules).rewriteRequired(root, kind);
    }

    /**
     * @return the rewritten element, or {@code null} if it was removed
     */
    private Element rewriteElement(Element element) {
        Element rewritten = element.rewriteChildren(this);
        for (RewriteRule rule : rules) {
            RewriteAction action = rule.apply(rewritten);
            switch (action.kind()) {
                case UNMATCHED:
                    continue;
                case REPLACE:
                    return action.replacement();
                case EXPAND:
                    return rewriteElement(action.replacement());
                case REMOVE:
                    return null;
            }
        }
        return rewritten;
    }

    @Override
    public <E extends Element> List<E> rewriteAll(List<E> elements, Class<E> kind) {
        List<E> result = new ArrayList<>(elements.size());
        for (E element : elements) {
            Element rewritten = rewriteElement(element);
            if (rewritten == null) continue;
            if (!kind.isInstance(rewritten)) {
                throw new IllegalStateException("Rewrite rule replaced " + element.getClass().getSimpleName()
                        + " with " + rewritten.getClass().getSimpleName() + ", expected " + kind.getSimpleName());
            }
            result.add(kind.cast(rewritten));
        }
        return result;
    }

    @Override
    public <E extends Element> E rewriteRequired(E element, Class<E> kind) {
        Element rewritten = rewriteElement(element);
        if (rewritten == null) {
            throw new IllegalStateException("Rewrite rule removed required " + element.getClass().getSimpleName());
        }
        if (!kind.isInstance(rewritten)) {
            throw new IllegalStateException("Rewrite rule replaced " + element.getClass().getSimpleName()
                    + " with " + rewritten.getClass().getSimpleName() + ", expected " + kind.getSimpleName());
        }
        return kind.cast(rewritten);
    }
}
