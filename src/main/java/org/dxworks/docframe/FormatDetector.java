package org.dxworks.docframe;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class FormatDetector {

    public static Optional<InputFormat> detectInputFormat(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);

        if (fileName.endsWith(".md") || fileName.endsWith(".markdown")) {
            return Optional.of(InputFormat.MARKDOWN);
        } else if (fileName.endsWith(".rst") || fileName.endsWith(".rest")) {
            return Optional.of(InputFormat.RESTRUCTURED_TEXT);
        } else if (fileName.endsWith(".adoc") || fileName.endsWith(".asciidoc")) {
            return Optional.of(InputFormat.ASCIIDOC);
        }

        return Optional.empty();
    }

    public static Optional<OutputFormat> detectOutputFormat(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);

        if (fileName.endsWith(".xml") || fileName.endsWith(".docbook")) {
            return Optional.of(OutputFormat.DOCBOOK);
        } else if (fileName.endsWith(".html") || fileName.endsWith(".htm")) {
            return Optional.of(OutputFormat.HTML);
        } else if (fileName.endsWith(".pdf")) {
            return Optional.of(OutputFormat.PDF);
        } else if (fileName.endsWith(".txt") || fileName.endsWith(".dump")) {
            return Optional.of(OutputFormat.PRETTY_PRINT);
        }

        return Optional.empty();
    }
}
