package org.dxworks.docframe.parser;

import org.dxworks.docframe.model.Span;
import org.dxworks.docframe.model.span.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the output of the inline engine: plain text runs and parsed elements.
 *
 * @param <E> the element kind
 * @param <R> the kind of the final result
 */
public abstract class ResultBuilder<E, R> {

    protected final StringBuilder pending = new StringBuilder();

    public void addText(CharSequence text) {
        pending.append(text);
    }

    public void addText(char c) {
        pending.append(c);
    }

    public CharSequence pending() {
        return pending;
    }

    /**
     * Drops characters from the end of the pending text, when an element claimed them.
     */
    public void dropPending(int count) {
        if (count > pending.length()) {
            throw new IllegalStateException("Cannot drop " + count + " characters, only " + pending.length() + " pending");
        }
        pending.setLength(pending.length() - count);
    }

    public abstract void add(E element);

    public abstract R result();

    /**
     * Builds a list of spans, adjacent text without options is merged into one {@link Text}.
     */
    public static class SpanBuilder extends ResultBuilder<Span, List<Span>> {

        private final List<Span> spans = new ArrayList<>();

        @Override
        public void add(Span element) {
            if (element instanceof Text text && text.options().isEmpty()) {
                pending.append(text.content());
                return;
            }
            flush();
            spans.add(element);
        }

        private void flush() {
            if (pending.length() == 0) return;
            spans.add(new Text(pending.toString()));
            pending.setLength(0);
        }

        @Override
        public List<Span> result() {
            flush();
            return List.copyOf(spans);
        }

        /**
         * Merges adjacent {@link Text} spans without options of an already built list.
         */
        public static List<Span> mergeAdjacentText(List<Span> spans) {
            SpanBuilder builder = new SpanBuilder();
            spans.forEach(builder::add);
            return builder.result();
        }
    }

    public static class TextBuilder extends ResultBuilder<String, String> {

        @Override
        public void add(String element) {
            pending.append(element);
        }

        @Override
        public String result() {
            return pending.toString();
        }
    }
}
