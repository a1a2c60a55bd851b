package org.dxworks.docframe.parser.rst;

import org.dxworks.docframe.model.Options;
import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.link.AutoLabel;
import org.dxworks.docframe.model.link.AutonumberLabel;
import org.dxworks.docframe.model.link.CitationReference;
import org.dxworks.docframe.model.link.ExternalLink;
import org.dxworks.docframe.model.link.FootnoteLabel;
import org.dxworks.docframe.model.link.FootnoteReference;
import org.dxworks.docframe.model.link.InlineTarget;
import org.dxworks.docframe.model.link.LinkReference;
import org.dxworks.docframe.model.link.NumericLabel;
import org.dxworks.docframe.model.rst.InterpretedText;
import org.dxworks.docframe.model.rst.SubstitutionReference;
import org.dxworks.docframe.model.span.Emphasized;
import org.dxworks.docframe.model.span.Literal;
import org.dxworks.docframe.model.span.Strong;
import org.dxworks.docframe.model.span.Text;
import org.dxworks.docframe.parser.InlineParsers;
import org.dxworks.docframe.parser.InlineParsers.EndDelimiter;
import org.dxworks.docframe.parser.ReferenceNames;
import org.dxworks.docframe.parser.SpanMatch;
import org.dxworks.docframe.parser.SpanParser;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inline markup of reStructuredText.
 * <p>
 * Markup is only recognized at word boundaries: a start string has to be at the start of the
 * text or follow whitespace or an opening punctuation character and must not be followed by
 * whitespace, an end string must not follow whitespace and has to be followed by whitespace,
 * closing punctuation or the end of the text.
 */
public class RstSpanParsers {

    static final String DEFAULT_ROLE = "title-reference";

    private static final String START_PRECEDERS = "-:/'\"<([{";
    private static final String END_FOLLOWERS = "-.,:;!?\\/'\")]}>";

    private static final Pattern ROLE_NAME = Pattern.compile("[a-zA-Z0-9]+(?:[-_.+][a-zA-Z0-9]+)*");
    private static final Pattern FOOTNOTE_LABEL = Pattern.compile("\\d{1,9}|#|#[a-zA-Z0-9]+(?:[-_.+:][a-zA-Z0-9]+)*|\\*");
    private static final Pattern CITATION_LABEL = Pattern.compile("[a-zA-Z0-9]+(?:[-_.][a-zA-Z0-9]+)*");
    private static final Pattern EMBEDDED_URI = Pattern.compile("(?s)(.*?)\\s*<([^<>]+)>");

    private final Map<Character, SpanParser<String>> escapes = Map.of('\\', this::escapedText);
    private final Map<Character, SpanParser<Span>> parsers = Map.of(
            '*', this::strongOrEmphasis,
            '`', this::backtick,
            ':', this::rolePrefix,
            '|', this::substitutionReference,
            '[', this::footnoteOrCitationReference,
            '_', this::targetOrReference,
            '\\', this::escape);

    public List<Span> parse(String text) {
        return InlineParsers.parseSpans(text, parsers);
    }

    static boolean isStart(String source, int markupStart, int contentStart) {
        if (markupStart > 0) {
            char before = source.charAt(markupStart - 1);
            if (!Character.isWhitespace(before) && START_PRECEDERS.indexOf(before) < 0) return false;
        }
        return contentStart < source.length() && !Character.isWhitespace(source.charAt(contentStart));
    }

    static boolean isEndFollower(String source, int index) {
        if (index >= source.length()) return true;
        char after = source.charAt(index);
        return Character.isWhitespace(after) || END_FOLLOWERS.indexOf(after) >= 0;
    }

    static EndDelimiter endString(String delimiter, boolean checkFollower) {
        return (source, index) -> {
            if (!source.startsWith(delimiter, index)) return -1;
            if (Character.isWhitespace(source.charAt(index - 1))) return -1;
            if (checkFollower && !isEndFollower(source, index + delimiter.length())) return -1;
            return delimiter.length();
        };
    }

    private SpanMatch<Span> strongOrEmphasis(String source, int offset, CharSequence pending) {
        int markupStart = offset - 1;
        if (offset < source.length() && source.charAt(offset) == '*') {
            if (!isStart(source, markupStart, offset + 1)) return null;
            SpanMatch<String> text = InlineParsers.parseText(source, offset + 1, endString("**", true), escapes);
            return text == null ? null : SpanMatch.of(new Strong(List.of(new Text(text.element()))), text.end());
        }
        if (!isStart(source, markupStart, offset)) return null;
        SpanMatch<String> text = InlineParsers.parseText(source, offset, endString("*", true), escapes);
        return text == null ? null : SpanMatch.of(new Emphasized(List.of(new Text(text.element()))), text.end());
    }

    private SpanMatch<Span> backtick(String source, int offset, CharSequence pending) {
        int markupStart = offset - 1;
        if (offset < source.length() && source.charAt(offset) == '`') {
            if (!isStart(source, markupStart, offset + 1)) return null;
            SpanMatch<String> text = InlineParsers.parseText(source, offset + 1, endString("``", true), Map.of());
            return text == null ? null : SpanMatch.of(new Literal(text.element()), text.end());
        }
        if (!isStart(source, markupStart, offset)) return null;
        SpanMatch<String> text = InlineParsers.parseText(source, offset, endString("`", false), escapes);
        if (text == null) return null;

        String content = text.element();
        int end = text.end();
        if (source.startsWith("_", end) && !source.startsWith("__", end) && isEndFollower(source, end + 1)) {
            return SpanMatch.of(phraseReference(content, source.substring(markupStart, end + 1)), end + 1);
        }
        if (source.startsWith(":", end)) {
            Matcher role = ROLE_NAME.matcher(source).region(end + 1, source.length());
            if (role.lookingAt() && source.startsWith(":", role.end()) && isEndFollower(source, role.end() + 1)) {
                return SpanMatch.of(new InterpretedText(role.group(), content, source.substring(markupStart, role.end() + 1)),
                        role.end() + 1);
            }
        }
        if (!isEndFollower(source, end)) return null;
        return SpanMatch.of(new InterpretedText(DEFAULT_ROLE, content, source.substring(markupStart, end)), end);
    }

    private static Span phraseReference(String content, String source) {
        Matcher uri = EMBEDDED_URI.matcher(content);
        if (uri.matches()) {
            String name = uri.group(1).isEmpty() ? uri.group(2) : uri.group(1);
            return new ExternalLink(List.of(new Text(name)), uri.group(2).replaceAll("\\s", ""));
        }
        return new LinkReference(List.of(new Text(content)), ReferenceNames.toId(content), source);
    }

    private SpanMatch<Span> rolePrefix(String source, int offset, CharSequence pending) {
        int markupStart = offset - 1;
        if (!isStart(source, markupStart, offset)) return null;
        Matcher role = ROLE_NAME.matcher(source).region(offset, source.length());
        if (!role.lookingAt() || !source.startsWith(":`", role.end())) return null;
        int contentStart = role.end() + 2;
        if (contentStart >= source.length() || Character.isWhitespace(source.charAt(contentStart))) return null;
        SpanMatch<String> text = InlineParsers.parseText(source, contentStart, endString("`", true), escapes);
        if (text == null) return null;
        return SpanMatch.of(new InterpretedText(role.group(), text.element(), source.substring(markupStart, text.end())), text.end());
    }

    private SpanMatch<Span> substitutionReference(String source, int offset, CharSequence pending) {
        if (!isStart(source, offset - 1, offset)) return null;
        SpanMatch<String> name = InlineParsers.parseText(source, offset, endString("|", false), Map.of());
        if (name == null) return null;
        int end = name.end();
        // |name|_ is a substitution used as link text, the link part is dropped
        if (source.startsWith("_", end) && isEndFollower(source, end + 1)) end++;
        if (!isEndFollower(source, end)) return null;
        return SpanMatch.of(new SubstitutionReference(name.element()), end);
    }

    private SpanMatch<Span> footnoteOrCitationReference(String source, int offset, CharSequence pending) {
        if (offset >= 2 && !Character.isWhitespace(source.charAt(offset - 2))
                && START_PRECEDERS.indexOf(source.charAt(offset - 2)) < 0) return null;
        int close = offset;
        while (close < source.length() && isLabelChar(source.charAt(close))) close++;
        if (!source.startsWith("]_", close) || !isEndFollower(source, close + 2)) return null;

        String label = source.substring(offset, close);
        String markup = source.substring(offset - 1, close + 2);
        if (FOOTNOTE_LABEL.matcher(label).matches()) {
            return SpanMatch.of(new FootnoteReference(footnoteLabel(label), markup), close + 2);
        }
        if (CITATION_LABEL.matcher(label).matches()) {
            return SpanMatch.of(new CitationReference(label, markup), close + 2);
        }
        return null;
    }

    /**
     * The characters footnote and citation labels are made of, the scan for the closing
     * bracket stops at any other.
     */
    private static boolean isLabelChar(char c) {
        return c < 128 && (Character.isLetterOrDigit(c) || "#*-_.+:".indexOf(c) >= 0);
    }

    static FootnoteLabel footnoteLabel(String label) {
        if (label.equals("#")) return AutoLabel.NUMBER;
        if (label.equals("*")) return AutoLabel.SYMBOL;
        if (label.startsWith("#")) return new AutonumberLabel(label.substring(1));
        return new NumericLabel(Integer.parseInt(label));
    }

    private SpanMatch<Span> targetOrReference(String source, int offset, CharSequence pending) {
        if (offset < source.length() && source.charAt(offset) == '`') {
            return inlineTarget(source, offset);
        }
        return simpleReference(source, offset, pending);
    }

    private SpanMatch<Span> inlineTarget(String source, int offset) {
        if (!isStart(source, offset - 1, offset + 1)) return null;
        SpanMatch<String> text = InlineParsers.parseText(source, offset + 1, endString("`", true), escapes);
        if (text == null) return null;
        String content = text.element();
        String id = ReferenceNames.toId(content);
        return SpanMatch.of(new InlineTarget(content, id.isEmpty() ? Options.NONE : Options.id(id)), text.end());
    }

    /**
     * {@code name_}: the name is taken from the end of the pending text.
     */
    private SpanMatch<Span> simpleReference(String source, int offset, CharSequence pending) {
        if (source.startsWith("_", offset) || !isEndFollower(source, offset)) return null;
        int start = pending.length();
        while (start > 0 && isNameChar(pending, start - 1)) {
            start--;
        }
        // names start and end with an alphanumeric character
        while (start < pending.length() && !Character.isLetterOrDigit(pending.charAt(start))) {
            start++;
        }
        if (start == pending.length() || !Character.isLetterOrDigit(pending.charAt(pending.length() - 1))) return null;
        if (start > 0) {
            char before = pending.charAt(start - 1);
            if (!Character.isWhitespace(before) && START_PRECEDERS.indexOf(before) < 0) return null;
        }
        String name = pending.subSequence(start, pending.length()).toString();
        LinkReference reference = new LinkReference(List.of(new Text(name)), ReferenceNames.toId(name), name + "_");
        return new SpanMatch<>(reference, offset, name.length());
    }

    private static boolean isNameChar(CharSequence text, int index) {
        char c = text.charAt(index);
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' || c == '+';
    }

    private SpanMatch<Span> escape(String source, int offset, CharSequence pending) {
        SpanMatch<String> escaped = escapedText(source, offset, pending);
        return escaped == null ? null : SpanMatch.of(new Text(escaped.element()), escaped.end());
    }

    /**
     * A backslash escapes the next character, an escaped whitespace character disappears.
     */
    private SpanMatch<String> escapedText(String source, int offset, CharSequence pending) {
        if (offset >= source.length()) return null;
        char c = source.charAt(offset);
        return SpanMatch.of(Character.isWhitespace(c) ? "" : String.valueOf(c), offset + 1);
    }
}
