package org.dxworks.docframe.rewrite;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Customizable;
import org.dxworks.docframe.model.Definition;
import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementTraversal;
import org.dxworks.docframe.model.LinkTarget;
import org.dxworks.docframe.model.MessageLevel;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.SystemMessage;
import org.dxworks.docframe.model.block.InvalidBlock;
import org.dxworks.docframe.model.link.AutoLabel;
import org.dxworks.docframe.model.link.AutonumberLabel;
import org.dxworks.docframe.model.link.Citation;
import org.dxworks.docframe.model.link.CitationLink;
import org.dxworks.docframe.model.link.CitationReference;
import org.dxworks.docframe.model.link.ExternalLink;
import org.dxworks.docframe.model.link.ExternalLinkDefinition;
import org.dxworks.docframe.model.link.Footnote;
import org.dxworks.docframe.model.link.FootnoteDefinition;
import org.dxworks.docframe.model.link.FootnoteLabel;
import org.dxworks.docframe.model.link.FootnoteLink;
import org.dxworks.docframe.model.link.FootnoteReference;
import org.dxworks.docframe.model.link.Image;
import org.dxworks.docframe.model.link.ImageReference;
import org.dxworks.docframe.model.link.InternalLink;
import org.dxworks.docframe.model.link.LinkAlias;
import org.dxworks.docframe.model.link.LinkReference;
import org.dxworks.docframe.model.link.NumericLabel;
import org.dxworks.docframe.model.span.InvalidSpan;
import org.dxworks.docframe.parser.ReferenceNames;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves link, image, footnote and citation references against the targets of the
 * document, numbers footnotes and removes the definitions that are no longer needed.
 * A link target whose id is already taken by another target is marked as invalid.
 * <p>
 * An instance keeps counters for automatically numbered footnotes and is only used for
 * one rewrite of the document it was created for.
 */
public class LinkResolver implements RewriteRule {

    private static final String[] SYMBOLS = {"*", "†", "‡", "§", "¶", "#", "♠", "♥", "♦", "♣"};

    private record ResolvedFootnote(String id, String label) {
    }

    private record Resolution(ExternalLinkDefinition external, String internalId, String error) {
    }

    private final Map<String, ExternalLinkDefinition> externalDefinitions = new HashMap<>();
    private final Map<String, String> aliases = new HashMap<>();
    private final Set<String> internalIds = new HashSet<>();
    private final Set<String> citationIds = new HashSet<>();

    private final Map<Integer, ResolvedFootnote> numericFootnotes = new HashMap<>();
    private final Map<String, ResolvedFootnote> namedFootnotes = new HashMap<>();
    private final List<ResolvedFootnote> autoNumberedFootnotes = new ArrayList<>();
    private final List<ResolvedFootnote> symbolFootnotes = new ArrayList<>();
    private int autoNumberedDefinitions;
    private int symbolDefinitions;
    private int autoNumberedReferences;
    private int symbolReferences;

    private final Set<String> claimedIds = new HashSet<>();

    public LinkResolver(Document document) {
        for (Element element : ElementTraversal.stream(document).toList()) {
            if (element instanceof ExternalLinkDefinition definition) {
                externalDefinitions.putIfAbsent(definition.id(), definition);
            } else if (element instanceof LinkAlias alias) {
                aliases.putIfAbsent(alias.id(), alias.target());
            } else if (element instanceof Citation citation) {
                citation.options().id().ifPresent(citationIds::add);
            }
            if (element instanceof Customizable customizable && !(element instanceof Definition)) {
                customizable.options().id().ifPresent(internalIds::add);
            }
        }
        numberFootnotes(ElementTraversal.collect(document, FootnoteDefinition.class));
    }

    private void numberFootnotes(List<FootnoteDefinition> definitions) {
        Set<Integer> usedNumbers = new HashSet<>();
        for (FootnoteDefinition definition : definitions) {
            if (definition.label() instanceof NumericLabel numeric) usedNumbers.add(numeric.number());
        }
        int nextNumber = 1;
        for (FootnoteDefinition definition : definitions) {
            FootnoteLabel label = definition.label();
            if (label instanceof NumericLabel numeric) {
                numericFootnotes.putIfAbsent(numeric.number(),
                        new ResolvedFootnote("footnote-" + numeric.number(), String.valueOf(numeric.number())));
            } else if (label == AutoLabel.SYMBOL) {
                int index = symbolFootnotes.size();
                symbolFootnotes.add(new ResolvedFootnote("footnote-s" + (index + 1), symbol(index)));
            } else {
                while (usedNumbers.contains(nextNumber)) nextNumber++;
                usedNumbers.add(nextNumber);
                if (label instanceof AutonumberLabel named) {
                    namedFootnotes.putIfAbsent(ReferenceNames.toId(named.label()),
                            new ResolvedFootnote(ReferenceNames.toId(named.label()), String.valueOf(nextNumber)));
                } else {
                    autoNumberedFootnotes.add(new ResolvedFootnote("footnote-" + nextNumber, String.valueOf(nextNumber)));
                }
            }
        }
        for (ResolvedFootnote footnote : numericFootnotes.values()) internalIds.add(footnote.id());
        for (ResolvedFootnote footnote : namedFootnotes.values()) internalIds.add(footnote.id());
        for (ResolvedFootnote footnote : autoNumberedFootnotes) internalIds.add(footnote.id());
        for (ResolvedFootnote footnote : symbolFootnotes) internalIds.add(footnote.id());
    }

    static String symbol(int index) {
        return SYMBOLS[index % SYMBOLS.length].repeat(index / SYMBOLS.length + 1);
    }

    @Override
    public RewriteAction apply(Element element) {
        if (element instanceof FootnoteDefinition definition) {
            ResolvedFootnote resolved = definitionFootnote(definition.label());
            if (resolved == null) return RewriteAction.remove();
            Footnote footnote = new Footnote(resolved.label(), definition.content(),
                    definition.options().plus(Options.id(resolved.id())));
            return RewriteAction.replace(claim(footnote));
        }
        if (element instanceof Definition) return RewriteAction.remove();

        if (element instanceof LinkReference reference) return RewriteAction.replace(resolveLink(reference));
        if (element instanceof ImageReference reference) return RewriteAction.replace(resolveImage(reference));
        if (element instanceof FootnoteReference reference) return RewriteAction.replace(resolveFootnote(reference));
        if (element instanceof CitationReference reference) return RewriteAction.replace(resolveCitation(reference));

        if (element instanceof LinkTarget target && target.options().id().isPresent()) {
            Element claimed = claim(target);
            return claimed == target ? RewriteAction.unmatched() : RewriteAction.replace(claimed);
        }
        return RewriteAction.unmatched();
    }

    /**
     * Returns the target itself when its id is still free, an invalid element otherwise.
     */
    private Element claim(LinkTarget target) {
        String id = target.options().id().orElseThrow();
        if (claimedIds.add(id)) return target;

        SystemMessage message = new SystemMessage(MessageLevel.ERROR, "duplicate target id: " + id);
        LinkTarget fallback = target.withOptions(target.options().withoutId());
        if (fallback instanceof Block block) return new InvalidBlock(message, block);
        if (fallback instanceof Span span) return new InvalidSpan(message, span);
        throw new IllegalStateException("Link target is neither block nor span: " + target.getClass().getSimpleName());
    }

    private ResolvedFootnote definitionFootnote(FootnoteLabel label) {
        if (label instanceof NumericLabel numeric) return numericFootnotes.get(numeric.number());
        if (label instanceof AutonumberLabel named) return namedFootnotes.get(ReferenceNames.toId(named.label()));
        if (label == AutoLabel.SYMBOL) return symbolFootnotes.get(symbolDefinitions++);
        return autoNumberedFootnotes.get(autoNumberedDefinitions++);
    }

    private Span resolveFootnote(FootnoteReference reference) {
        ResolvedFootnote resolved = null;
        FootnoteLabel label = reference.label();
        if (label instanceof NumericLabel numeric) {
            resolved = numericFootnotes.get(numeric.number());
        } else if (label instanceof AutonumberLabel named) {
            resolved = namedFootnotes.get(ReferenceNames.toId(named.label()));
        } else if (label == AutoLabel.SYMBOL) {
            if (symbolReferences < symbolFootnotes.size()) resolved = symbolFootnotes.get(symbolReferences);
            symbolReferences++;
        } else if (autoNumberedReferences < autoNumberedFootnotes.size()) {
            resolved = autoNumberedFootnotes.get(autoNumberedReferences++);
        } else {
            autoNumberedReferences++;
        }
        if (resolved == null) {
            return InvalidSpan.error("unresolved footnote reference: " + reference.source(), reference.source());
        }
        return new FootnoteLink(resolved.id(), resolved.label(), reference.options());
    }

    private Span resolveCitation(CitationReference reference) {
        String id = ReferenceNames.toId(reference.label());
        if (!citationIds.contains(id)) {
            return InvalidSpan.error("unresolved citation reference: " + reference.label(), reference.source());
        }
        return new CitationLink(id, reference.label(), reference.options());
    }

    private Span resolveLink(LinkReference reference) {
        Resolution resolution = resolve(reference.id());
        if (resolution.external() != null) {
            ExternalLinkDefinition definition = resolution.external();
            return new ExternalLink(reference.content(), definition.url(), definition.title(), reference.options());
        }
        if (resolution.internalId() != null) {
            return new InternalLink(reference.content(), resolution.internalId(), null, reference.options());
        }
        return InvalidSpan.error(resolution.error(), reference.source());
    }

    private Span resolveImage(ImageReference reference) {
        Resolution resolution = resolve(reference.id());
        if (resolution.external() != null) {
            ExternalLinkDefinition definition = resolution.external();
            return new Image(reference.text(), definition.url(), definition.title(), reference.options());
        }
        String error = resolution.error() != null ? resolution.error() : "unresolved image reference: " + reference.id();
        return InvalidSpan.error(error, reference.source());
    }

    /**
     * Follows aliases until an external definition or an internal target is found.
     */
    private Resolution resolve(String id) {
        Set<String> visited = new HashSet<>();
        String current = id;
        while (visited.add(current)) {
            ExternalLinkDefinition definition = externalDefinitions.get(current);
            if (definition != null) return new Resolution(definition, null, null);
            String target = aliases.get(current);
            if (target == null) {
                if (internalIds.contains(current)) return new Resolution(null, current, null);
                return new Resolution(null, null, "unresolved link reference: " + id);
            }
            current = target;
        }
        return new Resolution(null, null, "circular link reference: " + id);
    }
}
