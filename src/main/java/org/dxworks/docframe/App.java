package org.dxworks.docframe;

import org.dxworks.docframe.processor.ConversionException;
import org.dxworks.docframe.processor.DocframeProcessor;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class App {

    static final int EXIT_CONVERSION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            return EXIT_USAGE;
        }

        for (Path input : arguments.inputs) {
            if (!Files.isRegularFile(input)) {
                System.err.println("Error: Input file does not exist: " + input);
                return EXIT_CONVERSION_FAILED;
            }
        }

        DocframeConfig config = DocframeConfig.load();
        InputFormat inputFormat = arguments.inputFormat != null
                ? arguments.inputFormat
                : FormatDetector.detectInputFormat(arguments.inputs.get(0)).orElse(InputFormat.MARKDOWN);
        OutputFormat outputFormat = arguments.outputFormat != null
                ? arguments.outputFormat
                : (arguments.output != null
                        ? FormatDetector.detectOutputFormat(arguments.output).orElse(OutputFormat.DOCBOOK)
                        : OutputFormat.DOCBOOK);
        String title = arguments.title != null
                ? arguments.title
                : arguments.inputs.get(0).getFileName().toString();

        try {
            String inputText = readInputs(arguments.inputs);
            DocframeProcessor processor = new DocframeProcessor(inputFormat, title, config);
            if (arguments.output == null) {
                processor.render(inputText, outputFormat, System.out);
            } else {
                if (arguments.output.toAbsolutePath().getParent() != null) {
                    Files.createDirectories(arguments.output.toAbsolutePath().getParent());
                }
                System.err.println("Converting " + arguments.inputs.size() + " " + inputFormat.getName()
                        + " file(s) to " + outputFormat.getName());
                try (OutputStream stream = Files.newOutputStream(arguments.output)) {
                    processor.render(inputText, outputFormat, stream);
                }
                System.err.println("Output written to: " + arguments.output.toAbsolutePath());
            }
            return 0;
        } catch (IOException | ConversionException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONVERSION_FAILED;
        }
    }

    /**
     * Reads the inputs as UTF-8 without byte order mark, joined by an empty line.
     */
    static String readInputs(List<Path> inputs) throws IOException {
        List<String> texts = new ArrayList<>();
        for (Path input : inputs) {
            String text = Files.readString(input, StandardCharsets.UTF_8);
            if (text.startsWith("\uFEFF")) {
                text = text.substring(1);
            }
            texts.add(text);
        }
        return String.join("\n\n", texts);
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar docframe.jar [--from FORMAT] [--to FORMAT] [--title TITLE] [-o OUTPUT] INPUT...");
        System.err.println("  --from:  Input format: markdown, rst, asciidoc (default: from the first input's extension)");
        System.err.println("  --to:    Output format: docbook, dump, html, pdf (default: from the output's extension, else docbook)");
        System.err.println("  --title: Document title (default: the first input's file name)");
        System.err.println("  -o:      Output file (default: standard output)");
    }

    static final class Arguments {
        InputFormat inputFormat;
        OutputFormat outputFormat;
        String title;
        Path output;
        final List<Path> inputs = new ArrayList<>();

        static Arguments parse(String[] args) {
            Arguments arguments = new Arguments();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--from" -> {
                        String value = value(args, ++i, arg);
                        arguments.inputFormat = InputFormat.fromName(value)
                                .orElseThrow(() -> new IllegalArgumentException("Unknown input format: " + value));
                    }
                    case "--to" -> {
                        String value = value(args, ++i, arg);
                        arguments.outputFormat = OutputFormat.fromName(value)
                                .orElseThrow(() -> new IllegalArgumentException("Unknown output format: " + value));
                    }
                    case "--title" -> arguments.title = value(args, ++i, arg);
                    case "-o" -> arguments.output = Paths.get(value(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + arg);
                        arguments.inputs.add(Paths.get(arg));
                    }
                }
            }
            if (arguments.inputs.isEmpty()) {
                throw new IllegalArgumentException("No input file given");
            }
            return arguments;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) throw new IllegalArgumentException("Missing value for " + option);
            return args[index];
        }
    }
}
