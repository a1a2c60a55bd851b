package org.dxworks.docframe.parser.rst;

import org.approvaltests.Approvals;
import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.InputFormat;
import org.dxworks.docframe.OutputFormat;
import org.dxworks.docframe.processor.DocframeProcessor;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

public class RstConvertApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/rst/";

    @Test
    void convert_Guide_DocBook() throws IOException {
        verify("guide.rst", OutputFormat.DOCBOOK);
    }

    @Test
    void convert_Guide_PrettyPrint() throws IOException {
        verify("guide.rst", OutputFormat.PRETTY_PRINT);
    }

    private static void verify(String fileName, OutputFormat outputFormat) throws IOException {
        String input = Files.readString(Paths.get(SAMPLES_BASE_PATH + fileName), StandardCharsets.UTF_8);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        new DocframeProcessor(InputFormat.RESTRUCTURED_TEXT, "guide", DocframeConfig.with(null, "", 50))
                .render(input, outputFormat, output);
        Approvals.verify(output.toString(StandardCharsets.UTF_8));
    }
}
