package org.dxworks.docframe.rewrite;

import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementTraversal;
import org.dxworks.docframe.model.LinkTarget;
import org.dxworks.docframe.model.Temporary;
import org.dxworks.docframe.model.block.Paragraph;
import org.dxworks.docframe.model.block.Rule;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.Strong;
import org.dxworks.docframe.model.span.Text;
import org.dxworks.docframe.parser.rst.RstParser;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RewriteEngineTest {

    private static final RewriteRule A_TO_EMPHASIZED_X = element -> new Text("a").equals(element)
            ? RewriteAction.replace(new Emphasized(List.of(new Text("x"))))
            : RewriteAction.unmatched();

    private static final RewriteRule X_TO_STRONG = element -> new Text("x").equals(element)
            ? RewriteAction.replace(new Strong(List.of(new Text("y"))))
            : RewriteAction.unmatched();

    private static Document document(String text) {
        return new Document(List.of(new Paragraph(List.of(new Text(text)))));
    }

    @Test
    void rewrite_ReplacesNestedElementsAndKeepsOriginal() {
        Document original = document("a");

        Document rewritten = RewriteEngine.rewrite(original, Document.class, List.of(A_TO_EMPHASIZED_X));

        assertEquals(document("a"), original);
        assertEquals(new Document(List.of(new Paragraph(List.of(new Emphasized(List.of(new Text("x"))))))), rewritten);
    }

    @Test
    void rewrite_FirstMatchingRuleWins() {
        RewriteRule removeA = element -> new Text("a").equals(element) ? RewriteAction.remove() : RewriteAction.unmatched();

        Document rewritten = RewriteEngine.rewrite(document("a"), Document.class, List.of(A_TO_EMPHASIZED_X, removeA));

        assertEquals(1, ElementTraversal.collect(rewritten, Emphasized.class).size());
    }

    @Test
    void rewrite_ReplacementIsNotRewrittenAgain() {
        Document rewritten = RewriteEngine.rewrite(document("a"), Document.class, List.of(A_TO_EMPHASIZED_X, X_TO_STRONG));

        assertTrue(ElementTraversal.collect(rewritten, Strong.class).isEmpty());
    }

    @Test
    void rewrite_ExpandedReplacementIsRewritten() {
        RewriteRule expand = element -> new Text("a").equals(element)
                ? RewriteAction.expand(new Emphasized(List.of(new Text("x"))))
                : RewriteAction.unmatched();

        Document rewritten = RewriteEngine.rewrite(document("a"), Document.class, List.of(expand, X_TO_STRONG));

        assertEquals(List.of(new Emphasized(List.of(new Strong(List.of(new Text("y")))))),
                ((Paragraph) rewritten.content().get(0)).content());
    }

    @Test
    void rewrite_RemovesElements() {
        Document document = new Document(List.of(new Rule(), new Paragraph(List.of(new Text("a"))), new Rule()));
        RewriteRule removeRules = element -> element instanceof Rule ? RewriteAction.remove() : RewriteAction.unmatched();

        Document rewritten = RewriteEngine.rewrite(document, Document.class, List.of(removeRules));

        assertEquals(List.of(new Paragraph(List.of(new Text("a")))), rewritten.content());
    }

    @Test
    void rewrite_ReplacementOfWrongKindFails() {
        RewriteRule paragraphToText = element -> element instanceof Paragraph
                ? RewriteAction.replace(new Text("oops"))
                : RewriteAction.unmatched();

        assertThrows(IllegalStateException.class,
                () -> RewriteEngine.rewrite(document("a"), Document.class, List.of(paragraphToText)));
    }

    @Test
    void rewrite_RemovingRootFails() {
        RewriteRule removeDocument = element -> element instanceof Document ? RewriteAction.remove() : RewriteAction.unmatched();

        assertThrows(IllegalStateException.class,
                () -> RewriteEngine.rewrite(document("a"), Document.class, List.of(removeDocument)));
    }

    @Test
    void rewrite_ResolvedDocumentHasNoTemporaryElementsAndUniqueIds() {
        String source = String.join("\n",
                "Intro",
                "=====",
                "",
                "See Python_, intro_ and the footnote [#]_ with |sub|.",
                "",
                ".. _Python: http://www.python.org",
                ".. |sub| replace:: *replaced*",
                "",
                "Intro",
                "=====",
                "",
                "`Title` and :strong:`bold` and |missing| and unknown_.",
                "",
                ".. [#] The note.",
                "");

        Document document = RewriteEngine.rewrite(new RstParser().parse(source));

        List<Element> elements = ElementTraversal.stream(document).toList();
        assertTrue(elements.stream().noneMatch(Temporary.class::isInstance));
        Set<String> ids = new HashSet<>();
        for (LinkTarget target : ElementTraversal.collect(document, LinkTarget.class)) {
            target.options().id().ifPresent(id -> assertTrue(ids.add(id), "duplicate id " + id));
        }
        assertEquals(Set.of("intro", "intro-1", "footnote-1"), ids);
    }
}
