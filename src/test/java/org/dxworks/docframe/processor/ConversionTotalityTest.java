package org.dxworks.docframe.processor;

import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.InputFormat;
import org.dxworks.docframe.OutputFormat;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Random and deeply nested markup has to convert without failing, and the words of inline
 * markup have to survive into the output, as content or as the fallback of invalid markup.
 */
public class ConversionTotalityTest {

    private static final DocframeConfig DEFAULTS = DocframeConfig.with(null, "", 50);
    private static final int RUNS = 300;

    private static final String[] RST_INLINE = {"*", "**", "`", "``", "|", "_", "__", "[", "]", "\\", " ", ":", "<", ">", "#", "."};
    private static final String[] MARKDOWN_INLINE = {"*", "**", "`", "_", "[", "]", "](x)", "!", "\\", " ", "#", "."};

    private static final String[] RST_LINE_STARTS = {"", "", "", "* ", "- ", "1. ", "#. ", "(a) ", "| ", ".. ", ".. _",
            ".. [1] ", ".. [#] ", ".. |", ":f: ", "-x  ", "--opt=ARG  ", "    ", "  ", ">>> ", "=====  =====", "+----+",
            "| x  |", "-----", "::", "term"};
    private static final String[] MARKDOWN_LINE_STARTS = {"", "", "", "# ", "## ", "> ", "- ", "* ", "1. ", "    ", "```",
            "| a | b |", "|---|---|", "---", "***", "[w]: ", "<div>", "===", "  "};

    private static String convert(InputFormat format, String input, OutputFormat outputFormat) {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        try {
            new DocframeProcessor(format, "t", DEFAULTS).render(input, outputFormat, stream);
        } catch (RuntimeException e) {
            fail("Conversion failed for input:\n" + input, e);
        }
        return stream.toString(StandardCharsets.UTF_8);
    }

    private static String inlineLine(Random random, String[] tokens, List<String> words) {
        StringBuilder line = new StringBuilder(word(words));
        int length = 1 + random.nextInt(15);
        for (int i = 0; i < length; i++) {
            if (random.nextInt(3) == 0) {
                line.append(word(words));
            } else {
                line.append(tokens[random.nextInt(tokens.length)]);
            }
        }
        return line.toString();
    }

    private static String word(List<String> words) {
        String word = "w" + (1000 + words.size());
        words.add(word);
        return word;
    }

    private static String document(Random random, String[] lineStarts, String[] tokens) {
        StringBuilder document = new StringBuilder();
        List<String> words = new ArrayList<>();
        int lines = 1 + random.nextInt(12);
        for (int i = 0; i < lines; i++) {
            if (random.nextInt(4) == 0) {
                document.append('\n');
                continue;
            }
            document.append(" ".repeat(random.nextInt(3) == 0 ? random.nextInt(6) : 0))
                    .append(lineStarts[random.nextInt(lineStarts.length)])
                    .append(inlineLine(random, tokens, words))
                    .append('\n');
        }
        return document.toString();
    }

    private static void assertWordsKept(String input, String output, List<String> words) {
        for (String word : words) {
            assertTrue(output.contains(word), () -> word + " is missing from the output of:\n" + input + "\n" + output);
        }
    }

    @Test
    void convert_RandomRstInlineMarkupKeepsEveryWord() {
        for (int seed = 0; seed < RUNS; seed++) {
            Random random = new Random(seed);
            List<String> words = new ArrayList<>();
            String input = inlineLine(random, RST_INLINE, words) + "\n";

            String output = convert(InputFormat.RESTRUCTURED_TEXT, input, OutputFormat.DOCBOOK);

            assertWordsKept(input, output, words);
        }
    }

    @Test
    void convert_RandomMarkdownInlineMarkupKeepsEveryWord() {
        for (int seed = 0; seed < RUNS; seed++) {
            Random random = new Random(seed);
            List<String> words = new ArrayList<>();
            String input = inlineLine(random, MARKDOWN_INLINE, words) + "\n";

            String output = convert(InputFormat.MARKDOWN, input, OutputFormat.DOCBOOK);

            assertWordsKept(input, output, words);
        }
    }

    @Test
    void convert_RandomRstDocuments() {
        for (int seed = 0; seed < RUNS; seed++) {
            String input = document(new Random(seed), RST_LINE_STARTS, RST_INLINE);

            assertTrue(convert(InputFormat.RESTRUCTURED_TEXT, input, OutputFormat.DOCBOOK).endsWith("</article>\n"));
            convert(InputFormat.RESTRUCTURED_TEXT, input, OutputFormat.PRETTY_PRINT);
        }
    }

    @Test
    void convert_RandomMarkdownDocuments() {
        for (int seed = 0; seed < RUNS; seed++) {
            String input = document(new Random(seed), MARKDOWN_LINE_STARTS, MARKDOWN_INLINE);

            assertTrue(convert(InputFormat.MARKDOWN, input, OutputFormat.DOCBOOK).endsWith("</article>\n"));
            convert(InputFormat.MARKDOWN, input, OutputFormat.PRETTY_PRINT);
        }
    }

    @Test
    void convert_DeeplyNestedRst() {
        StringBuilder quotes = new StringBuilder();
        StringBuilder lineBlocks = new StringBuilder();
        for (int level = 0; level < 300; level++) {
            quotes.append(" ".repeat(level)).append("q").append(level).append("\n\n");
            lineBlocks.append("| ").append(" ".repeat(level)).append("l").append(level).append('\n');
        }
        List<String> inputs = List.of(
                "- ".repeat(4000) + "deep\n",
                "1. ".repeat(3000) + "deep\n",
                quotes + "deep\n",
                lineBlocks + "\ndeep\n");

        for (String input : inputs) {
            String output = convert(InputFormat.RESTRUCTURED_TEXT, input, OutputFormat.DOCBOOK);
            assertTrue(output.contains("deep"), input);
            convert(InputFormat.RESTRUCTURED_TEXT, input, OutputFormat.PRETTY_PRINT);
        }
        String output = convert(InputFormat.RESTRUCTURED_TEXT, lineBlocks.toString(), OutputFormat.DOCBOOK);
        assertTrue(output.contains("l0") && output.contains("l299"));
    }

    @Test
    void convert_DeeplyNestedMarkdown() {
        List<String> inputs = List.of(
                "> ".repeat(5000) + "deep\n",
                "- ".repeat(5000) + "deep\n",
                "1. ".repeat(3000) + "deep\n");

        for (String input : inputs) {
            String output = convert(InputFormat.MARKDOWN, input, OutputFormat.DOCBOOK);
            assertTrue(output.contains("deep"), input);
            convert(InputFormat.MARKDOWN, input, OutputFormat.PRETTY_PRINT);
        }
    }
}
