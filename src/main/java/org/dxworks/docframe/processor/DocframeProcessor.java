package org.dxworks.docframe.processor;

import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.InputFormat;
import org.dxworks.docframe.OutputFormat;
import org.dxworks.docframe.model.Document;
import org.dxworks.docframe.parser.MarkupParser;
import org.dxworks.docframe.parser.markdown.MarkdownParser;
import org.dxworks.docframe.parser.rst.RstParser;
import org.dxworks.docframe.render.DocBookRenderer;
import org.dxworks.docframe.render.PrettyPrintRenderer;
import org.dxworks.docframe.render.Renderer;
import org.dxworks.docframe.rewrite.RewriteEngine;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Parses Markdown or reStructuredText, resolves the document and renders it as DocBook or as
 * a structural dump. Every call works on its own parser and renderer state.
 */
public class DocframeProcessor implements MarkupProcessor {

    private final InputFormat inputFormat;
    private final String title;
    private final DocframeConfig config;

    public DocframeProcessor(InputFormat inputFormat, String title, DocframeConfig config) {
        this.inputFormat = inputFormat;
        this.title = title;
        this.config = config;
    }

    /**
     * Parses and rewrites the input.
     *
     * @throws ConversionException if the input format is handled by an external processor
     */
    public Document parse(String inputText) {
        return RewriteEngine.rewrite(parser().parse(inputText));
    }

    private MarkupParser parser() {
        return switch (inputFormat) {
            case MARKDOWN -> new MarkdownParser();
            case RESTRUCTURED_TEXT -> new RstParser();
            case ASCIIDOC -> throw new ConversionException("AsciiDoc input is not supported");
        };
    }

    @Override
    public void render(String inputText, OutputFormat outputFormat, OutputStream stream) {
        if (outputFormat == OutputFormat.HTML || outputFormat == OutputFormat.PDF) {
            throw new ConversionException(outputFormat.getName() + " output is not supported");
        }
        Document document = parse(inputText);
        try {
            Writer writer = new OutputStreamWriter(stream, StandardCharsets.UTF_8);
            if (outputFormat == OutputFormat.DOCBOOK) {
                new Renderer<>(docBook()).render(document, writer);
            } else {
                new Renderer<>(new PrettyPrintRenderer(config.getMaxTextWidth())).render(document, writer);
            }
            writer.write('\n');
            writer.flush();
        } catch (IOException | UncheckedIOException e) {
            throw new ConversionException("Failed to write " + outputFormat.getName() + " output", e);
        }
    }

    private DocBookRenderer docBook() {
        DocBookRenderer renderer = new DocBookRenderer().withTitle(title != null ? title : config.getDefaultTitle());
        return config.getMessageLevel().map(renderer::withMessageLevel).orElse(renderer);
    }
}
