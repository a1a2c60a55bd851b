package org.dxworks.docframe;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class FormatDetectorTest {

    @Test
    void detectInputFormat() {
        assertEquals(Optional.of(InputFormat.MARKDOWN), FormatDetector.detectInputFormat(Paths.get("docs/README.md")));
        assertEquals(Optional.of(InputFormat.RESTRUCTURED_TEXT), FormatDetector.detectInputFormat(Paths.get("index.RST")));
        assertEquals(Optional.of(InputFormat.ASCIIDOC), FormatDetector.detectInputFormat(Paths.get("book.adoc")));
        assertEquals(Optional.empty(), FormatDetector.detectInputFormat(Paths.get("notes.txt")));
    }

    @Test
    void detectOutputFormat() {
        assertEquals(Optional.of(OutputFormat.DOCBOOK), FormatDetector.detectOutputFormat(Paths.get("out.xml")));
        assertEquals(Optional.of(OutputFormat.PRETTY_PRINT), FormatDetector.detectOutputFormat(Paths.get("tree.txt")));
        assertEquals(Optional.of(OutputFormat.HTML), FormatDetector.detectOutputFormat(Paths.get("site.html")));
        assertEquals(Optional.empty(), FormatDetector.detectOutputFormat(Paths.get("out")));
    }

    @Test
    void formatsByName() {
        assertEquals(Optional.of(InputFormat.RESTRUCTURED_TEXT), InputFormat.fromName("rst"));
        assertEquals(Optional.of(OutputFormat.PRETTY_PRINT), OutputFormat.fromName("dump"));
        assertEquals(Optional.of(OutputFormat.PRETTY_PRINT), OutputFormat.fromName("pretty_print"));
        assertEquals(Optional.empty(), OutputFormat.fromName("epub"));
    }
}
