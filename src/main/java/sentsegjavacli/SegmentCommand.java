package sentsegjavacli;

import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;
import sentsegjava.SentenceSegmenter;

import java.io.*;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Subcommand for splitting text into sentences.
 *
 * <p>Without {@code --input-file} and {@code --output-file} it runs interactively, one
 * line of standard input at a time. With an input file, the file is segmented line by
 * line. With only an output file, standard input is segmented as a single text.
 * Sentences are written joined by CRLF.</p>
 */
@Command(name = "segment", description = "\033[1;34mSplit text into sentences using SentsegJava\033[0m", mixinStandardHelpOptions = true)
public class SegmentCommand implements Callable<Integer> {

    static final String CRLF = "\r\n";

    @Spec
    private CommandSpec spec;

    @Option(names = "--list-languages", description = "List all supported languages")
    private boolean listLanguages;

    @Option(names = {"-f", "--input-file"}, paramLabel = "<file>", description = "Input file (default: stdin)")
    private File input;

    @Option(names = {"-o", "--output-file"}, paramLabel = "<file>", description = "Output file (default: stdout)")
    private File output;

    @Option(names = {"-l", "--language"}, paramLabel = "<lang>", defaultValue = "en", description = "Language code (default: ${DEFAULT-VALUE})")
    private String language;

    @Option(names = {"-i", "--interactive"}, description = "Interactive mode, one line at a time (default when no file is given)")
    private boolean interactive;

    @Option(names = {"--in-enc"}, paramLabel = "<encoding>", defaultValue = "UTF-8", description = "Input encoding")
    private String inEncoding;

    @Option(names = {"--out-enc"}, paramLabel = "<encoding>", defaultValue = "UTF-8", description = "Output encoding")
    private String outEncoding;

    @Option(names = {"-v", "--verbose"}, description = "Log language data loading and fallback resolution")
    private boolean verbose;

    private static final Logger LOGGER = Logger.getLogger(SegmentCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (listLanguages) {
            out.println("Available SentsegJava languages:");
            SentenceSegmenter.getSupportedLanguages().forEach(code -> out.println("  " + code));
            out.flush();
            return 0;
        }

        boolean usesFiles = input != null || output != null;
        if (interactive && usesFiles) {
            throw new ParameterException(spec.commandLine(),
                    "Interactive mode is not available when `--input-file` or `--output-file` is passed");
        }

        if (verbose) {
            SentenceSegmenter.setVerboseLogging(true);
        }

        try {
            SentenceSegmenter segmenter = new SentenceSegmenter(language);
            Charset inputCharset = Charset.forName(inEncoding);
            Charset outputCharset = Charset.forName(outEncoding);

            if (!usesFiles) {
                runInteractive(segmenter, inputCharset, outputCharset, err);
                return 0;
            }

            String result;
            if (input != null) {
                String inputText = Files.readString(input.toPath(), inputCharset);
                result = segmentLines(segmenter, inputText, output != null && System.console() != null
                        ? new ConsoleProgressBar(40, System.err) : null);
            } else {
                String inputText = new String(System.in.readAllBytes(), inputCharset);
                result = joinSentences(segmenter.segment(inputText));
            }

            if (output != null) {
                Files.writeString(output.toPath(), result, outputCharset);
            } else {
                writeStdout(result, outputCharset);
            }

            if (System.console() != null) {
                String inFrom = (input != null) ? input.getPath() : "<stdin>";
                String outTo = (output != null) ? output.getPath() : "stdout";
                err.println(BLUE + "Segmentation completed (" + language + "): " + inFrom + " → " + outTo + RESET);
            }
            return 0;

        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during segmentation", e);
            err.println("❌ Exception occurred: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private void runInteractive(SentenceSegmenter segmenter, Charset inputCharset,
                                Charset outputCharset, PrintWriter err) throws IOException {
        if (System.console() != null) {
            err.println("Language: " + segmenter.getLanguage().languageCode()
                    + ". Enter text line by line, <Ctrl+D> (Unix) <Ctrl-Z> (Windows) to quit:");
            err.flush();
        }
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, inputCharset));
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.trim().isEmpty()) {
                continue;
            }
            writeStdout(joinSentences(segmenter.segment(line)), outputCharset);
        }
    }

    private static void writeStdout(String text, Charset charset) throws IOException {
        System.out.write(text.getBytes(charset));
        System.out.flush();
    }

    /**
     * Segments every line of the text separately. Each line's sentences are followed by
     * CRLF, so blank input lines stay blank.
     */
    static String segmentLines(SentenceSegmenter segmenter, String text, ConsoleProgressBar progress) {
        List<String> lines = text.lines().collect(Collectors.toList());
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            sb.append(joinSentences(segmenter.segment(lines.get(i))));
            if (progress != null) {
                progress.update(i + 1, lines.size());
            }
        }
        return sb.toString();
    }

    static String joinSentences(List<String> sentences) {
        return String.join(CRLF, sentences) + CRLF;
    }
}
