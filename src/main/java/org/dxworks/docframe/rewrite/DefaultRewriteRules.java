package org.dxworks.docframe.rewrite;

import org.dxworks.docframe.model.Document;

import java.util.List;

/**
 * The rules applied to every document after the rules of its markup dialect.
 */
public final class DefaultRewriteRules {

    private DefaultRewriteRules() {
        // utility class
    }

    public static List<RewriteRule> forDocument(Document document) {
        return List.of(new LinkResolver(document), new SectionBuilder());
    }
}
