package org.dxworks.docframe.rewrite;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Customizable;
import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.model.Element;
import org.dxworks.docframe.model.ElementTraversal;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.block.Header;
import org.dxworks.docframe.model.block.Section;
import org.dxworks.docframe.parser.ReferenceNames;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups the top level blocks of a document into nested sections. A header opens a section
 * that ends before the next header of the same or a higher level.
 * <p>
 * Every section gets an id unique in the document, taken from its header where possible.
 */
public class SectionBuilder implements RewriteRule {

    private static final class OpenSection {
        final Header header;
        final String id;
        final List<Block> content = new ArrayList<>();

        OpenSection(Header header, String id) {
            this.header = header;
            this.id = id;
        }
    }

    @Override
    public RewriteAction apply(Element element) {
        if (!(element instanceof Document document)) return RewriteAction.unmatched();
        if (document.content().stream().noneMatch(Header.class::isInstance)) return RewriteAction.unmatched();
        return RewriteAction.replace(new Document(build(document)));
    }

    private List<Block> build(Document document) {
        Set<String> usedIds = takenIds(document);
        List<Block> result = new ArrayList<>();
        Deque<OpenSection> open = new ArrayDeque<>();

        for (Block block : document.content()) {
            if (block instanceof Header header) {
                while (!open.isEmpty() && open.peek().header.level() >= header.level()) {
                    close(open, result);
                }
                open.push(new OpenSection(header, uniqueId(baseId(header), usedIds)));
            } else if (open.isEmpty()) {
                result.add(block);
            } else {
                open.peek().content.add(block);
            }
        }
        while (!open.isEmpty()) {
            close(open, result);
        }
        return result;
    }

    private static void close(Deque<OpenSection> open, List<Block> result) {
        OpenSection closing = open.pop();
        Header header = closing.header;
        Section section = new Section(header.withOptions(header.options().withoutId()), closing.content,
                Options.id(closing.id));
        if (open.isEmpty()) {
            result.add(section);
        } else {
            open.peek().content.add(section);
        }
    }

    /**
     * Ids of all other elements. Header ids are left out, they move to the sections.
     */
    private static Set<String> takenIds(Document document) {
        Set<String> ids = new HashSet<>();
        for (Element element : ElementTraversal.stream(document).toList()) {
            if (element instanceof Customizable customizable && !(element instanceof Header)) {
                customizable.options().id().ifPresent(ids::add);
            }
        }
        return ids;
    }

    private static String baseId(Header header) {
        String id = header.options().id().orElseGet(() -> ReferenceNames.toId(ReferenceNames.flattenText(header.content())));
        return id.isEmpty() ? "section" : id;
    }

    private static String uniqueId(String base, Set<String> usedIds) {
        String id = base;
        for (int suffix = 1; !usedIds.add(id); suffix++) {
            id = base + "-" + suffix;
        }
        return id;
    }
}
