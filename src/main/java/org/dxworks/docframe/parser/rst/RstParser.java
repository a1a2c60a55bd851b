package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.parser.MarkupParser;
import org.dxworks.docframe.parser.RawDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses reStructuredText. The resulting raw document carries {@link RstRewriteRules}.
 */
public class RstParser implements MarkupParser {

    private static final int TAB_STOP = 8;

    @Override
    public RawDocument parse(String source) {
        Document document = new Document(new RstBlockParsers().parseBlocks(preprocess(source)));
        return new RawDocument(document, List.of(RstRewriteRules.forDocument(document)));
    }

    /**
     * Splits the input into lines with tabs expanded and trailing whitespace removed.
     */
    static List<String> preprocess(String source) {
        String normalized = source.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = new ArrayList<>();
        for (String line : normalized.split("\n", -1)) {
            lines.add(expandTabs(line).stripTrailing());
        }
        return lines;
    }

    private static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) return line;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                do {
                    sb.append(' ');
                } while (sb.length() % TAB_STOP != 0);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
