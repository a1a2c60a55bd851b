package org.dxworks.docframe.processor;

import org.dxworks.docframe.OutputFormat;

import java.io.OutputStream;

public interface MarkupProcessor {

    /**
     * Converts the input text and writes the result to the stream. The stream is flushed
     * but not closed.
     *
     * @throws ConversionException if the output format is not supported or writing fails
     */
    void render(String inputText, OutputFormat outputFormat, OutputStream stream);
}
