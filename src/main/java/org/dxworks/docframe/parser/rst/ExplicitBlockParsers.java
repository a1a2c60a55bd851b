package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Block;
import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.block.Comment;
import org.dxworks.docframe.model.link.Citation;
import org.dxworks.docframe.model.link.ExternalLinkDefinition;
import org.dxworks.docframe.model.link.FootnoteDefinition;
import org.dxworks.docframe.model.link.Image;
import org.dxworks.docframe.model.link.InternalLinkTarget;
import org.dxworks.docframe.model.link.LinkAlias;
import org.dxworks.docframe.model.rst.CustomizedTextRole;
import org.dxworks.docframe.model.rst.SubstitutionDefinition;
import org.dxworks.docframe.model.span.SpanSequence;
import org.dxworks.docframe.model.span.Text;
import org.dxworks.docframe.parser.ReferenceNames;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.docframe.parser.rst.RstBlockParsers.invalid;

/**
 * Explicit markup blocks, starting with {@code ..}: hyperlink targets, footnotes, citations,
 * substitution definitions, directives and comments.
 */
class ExplicitBlockParsers {

    private static final String NAME = "[a-zA-Z0-9][-a-zA-Z0-9_.+]*";
    private static final Pattern FOOTNOTE_OR_CITATION = Pattern.compile("\\[([^\\]]+)\\](?: +(.*))?");
    private static final Pattern FOOTNOTE_LABEL = Pattern.compile("\\d{1,9}|#|#" + NAME + "|\\*");
    private static final Pattern CITATION_LABEL = Pattern.compile(NAME);
    private static final Pattern SUBSTITUTION = Pattern.compile("\\|([^|]+)\\| +(" + NAME + ")::(?: +(.*))?");
    private static final Pattern DIRECTIVE = Pattern.compile("(" + NAME + ")::(?: +(.*))?");
    private static final Pattern ROLE = Pattern.compile("(" + NAME + ")(?:\\((" + NAME + ")\\))?");
    private static final Pattern FIELD = Pattern.compile(":([a-zA-Z0-9_-]+):(?: +(.*))?");

    private final RstBlockParsers blocks;
    private final Map<String, Function<String, Span>> roles = new HashMap<>(TextRoles.standard());

    ExplicitBlockParsers(RstBlockParsers blocks) {
        this.blocks = blocks;
    }

    BlockMatch explicitBlock(List<String> lines, int pos) {
        String line = lines.get(pos);
        if (!line.equals("..") && !line.startsWith(".. ")) return null;

        String first = line.length() > 3 ? line.substring(3) : "";
        IndentedBlock rest = IndentedBlock.collect(lines, pos + 1, 1);
        List<String> body = rest == null ? List.of() : rest.dedented();
        int next = rest == null ? pos + 1 : rest.next();
        String source = String.join("\n", lines.subList(pos, next));
        return new BlockMatch(explicitBlock(first, body, source), next);
    }

    private Block explicitBlock(String first, List<String> body, String source) {
        if (first.startsWith("_")) return linkTarget(first.substring(1), body);
        if (first.startsWith("[")) return footnoteOrCitation(first, body);
        if (first.startsWith("|")) return substitutionDefinition(first, body, source);

        Matcher directive = DIRECTIVE.matcher(first);
        if (directive.matches()) {
            String name = directive.group(1).toLowerCase(Locale.ROOT);
            if (name.equals("role")) return roleDirective(nullToEmpty(directive.group(2)), body, source);
            return invalid("unknown directive: " + name, source);
        }
        List<String> comment = new ArrayList<>();
        if (!first.isBlank()) comment.add(first);
        comment.addAll(body);
        return new Comment(String.join("\n", comment).strip());
    }

    /**
     * {@code .. _name: url}, {@code .. _name: other_} or {@code .. _name:} for the element that follows.
     */
    private Block linkTarget(String target, List<String> body) {
        String name;
        String rest;
        if (target.startsWith("`")) {
            int end = target.indexOf("`:", 1);
            if (end < 0) return new Comment("_" + target);
            name = target.substring(1, end);
            rest = target.substring(end + 2);
        } else {
            int end = nameEnd(target);
            if (end < 0) return new Comment("_" + target);
            name = target.substring(0, end).replace("\\:", ":");
            rest = target.substring(end + 1);
        }
        String id = ReferenceNames.toId(name);
        if (id.isEmpty()) return new Comment("_" + target);

        StringBuilder url = new StringBuilder(rest.strip());
        body.forEach(line -> url.append(line.strip()));
        String value = url.toString();
        if (value.isEmpty()) return InternalLinkTarget.withId(id);
        if (value.endsWith("_") && !value.endsWith("\\_") && value.length() > 1) {
            String reference = value.substring(0, value.length() - 1);
            if (reference.startsWith("`") && reference.endsWith("`") && reference.length() > 1) {
                reference = reference.substring(1, reference.length() - 1);
            }
            return new LinkAlias(id, ReferenceNames.toId(reference));
        }
        return new ExternalLinkDefinition(id, value.replace("\\_", "_"));
    }

    /**
     * Index of the colon ending a target name, a colon followed by whitespace or the end of
     * the line that is not escaped.
     */
    private static int nameEnd(String target) {
        for (int i = 0; i < target.length(); i++) {
            char c = target.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == ':' && (i + 1 == target.length() || target.charAt(i + 1) == ' ')) {
                return i;
            }
        }
        return -1;
    }

    private Block footnoteOrCitation(String first, List<String> body) {
        Matcher matcher = FOOTNOTE_OR_CITATION.matcher(first);
        if (!matcher.matches()) return new Comment(first);
        String label = matcher.group(1);

        List<String> lines = new ArrayList<>();
        if (matcher.group(2) != null) lines.add(matcher.group(2));
        lines.addAll(body);
        List<Block> content = blocks.parseBlocks(lines);

        if (FOOTNOTE_LABEL.matcher(label).matches()) {
            return new FootnoteDefinition(RstSpanParsers.footnoteLabel(label), content);
        }
        if (CITATION_LABEL.matcher(label).matches()) {
            return new Citation(label, content, Options.id(ReferenceNames.toId(label)));
        }
        return new Comment(first);
    }

    private Block substitutionDefinition(String first, List<String> body, String source) {
        Matcher matcher = SUBSTITUTION.matcher(first);
        if (!matcher.matches()) return invalid("invalid substitution definition", source);
        String name = matcher.group(1);
        String directive = matcher.group(2).toLowerCase(Locale.ROOT);
        String argument = nullToEmpty(matcher.group(3));

        switch (directive) {
            case "replace" -> {
                List<String> lines = new ArrayList<>();
                if (!argument.isBlank()) lines.add(argument);
                lines.addAll(body);
                List<Span> spans = blocks.parseInline(String.join("\n", lines).strip());
                Span content = spans.size() == 1 ? spans.get(0) : new SpanSequence(spans);
                return new SubstitutionDefinition(name, content);
            }
            case "image" -> {
                StringBuilder url = new StringBuilder(argument.strip());
                Map<String, String> fields = new LinkedHashMap<>();
                for (String line : body) {
                    Matcher field = FIELD.matcher(line.strip());
                    if (field.matches()) {
                        fields.put(field.group(1), nullToEmpty(field.group(2)).strip());
                    } else if (fields.isEmpty()) {
                        url.append(line.strip());
                    }
                }
                if (url.length() == 0) return invalid("image without uri: |" + name + "|", source);
                String uri = url.toString();
                return new SubstitutionDefinition(name, new Image(fields.getOrDefault("alt", name), uri));
            }
            default -> {
                return invalid("unknown substitution directive: " + directive, source);
            }
        }
    }

    /**
     * {@code .. role:: name(parent)} with an optional {@code :class:} option. The role is known
     * to the rest of the document from here on.
     */
    private Block roleDirective(String argument, List<String> body, String source) {
        Matcher matcher = ROLE.matcher(argument.strip());
        if (!matcher.matches()) return invalid("invalid role definition: " + argument.strip(), source);
        String name = matcher.group(1).toLowerCase(Locale.ROOT);
        String parent = matcher.group(2);

        List<String> styles = List.of(name);
        for (String line : body) {
            Matcher field = FIELD.matcher(line.strip());
            if (field.matches() && field.group(1).equals("class") && field.group(2) != null) {
                styles = Arrays.asList(field.group(2).strip().split("\\s+"));
            }
        }
        Options options = Options.of(null, styles, null);

        Function<String, Span> role;
        if (parent == null) {
            role = text -> new Text(text, options);
        } else {
            Function<String, Span> base = roles.get(parent.toLowerCase(Locale.ROOT));
            if (base == null) return invalid("unknown text role: " + parent, source);
            role = text -> TextRoles.withOptions(base.apply(text), options);
        }
        roles.put(name, role);
        return new CustomizedTextRole(name, role);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
