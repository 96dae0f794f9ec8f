package org.keywordtree.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.keywordtree.lines.Connector;
import org.keywordtree.lines.LineFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the numbers of the lines of a file in which all, or any, of the given keywords occur.
 */
public class KeywordLinesMain {

    private static final Logger logger = LoggerFactory.getLogger(KeywordLinesMain.class);

    public static final String HELP_OPTION = "help";
    public static final String USAGE = "keyword-lines [-h] <file> <true|false> <and|or> <keyword>...";

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_IO_ERROR = 2;

    private static final int MIN_ARGUMENTS = 4;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        Options options = new Options();
        Arguments arguments;
        try {
            arguments = parseCli(options, args);
        } catch (ParseException | IllegalArgumentException e) {
            printUsage(e.getMessage(), options, out);
            return EXIT_USAGE;
        }
        if (arguments == null) {
            printUsage(null, options, out);
            return EXIT_USAGE;
        }

        LineFinder lineFinder = new LineFinder(arguments.keywords, arguments.caseSensitive, arguments.connector);
        try {
            List<Integer> lineNumbers = lineFinder.findLines(arguments.file);
            out.println(lineNumbers);
            return EXIT_OK;
        } catch (IOException e) {
            logger.debug("Failed to read {}", arguments.file, e);
            err.println("Failed to read " + arguments.file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    /**
     * Parses the command line.
     *
     * @return the parsed arguments, or {@code null} if help was requested
     * @throws ParseException if the arguments are missing or malformed
     */
    public static Arguments parseCli(Options options, String[] args) throws ParseException {
        options.addOption("h", HELP_OPTION, false, "Show help message and exit");
        CommandLineParser parser = new DefaultParser();
        CommandLine commandLine = parser.parse(options, args);
        if (commandLine.hasOption(HELP_OPTION)) {
            return null;
        }
        List<String> positional = commandLine.getArgList();
        if (positional.size() < MIN_ARGUMENTS) {
            throw new ParseException("Expected a file, a case sensitivity flag, a connector and at least one keyword");
        }
        String caseSensitive = positional.get(1);
        if (!"true".equals(caseSensitive) && !"false".equals(caseSensitive)) {
            throw new ParseException("Case sensitivity must be 'true' or 'false', got '" + caseSensitive + "'");
        }
        return new Arguments(Paths.get(positional.get(0)), Boolean.parseBoolean(caseSensitive),
                Connector.fromString(positional.get(2)), positional.subList(3, positional.size()));
    }

    public static void printUsage(String errorMessage, Options options, PrintStream out) {
        if (errorMessage != null) {
            out.println(errorMessage);
            out.println();
        }
        PrintWriter writer = new PrintWriter(out);
        HelpFormatter helpFormatter = new HelpFormatter();
        helpFormatter.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE,
                "Prints the 1-based numbers of the lines of <file> containing all (and) or any (or) of the keywords."
                        + " <true|false> selects case sensitive matching.",
                options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    public static class Arguments {
        private final Path file;
        private final boolean caseSensitive;
        private final Connector connector;
        private final List<String> keywords;

        public Arguments(Path file, boolean caseSensitive, Connector connector, List<String> keywords) {
            this.file = file;
            this.caseSensitive = caseSensitive;
            this.connector = connector;
            this.keywords = keywords;
        }

        public Path getFile() {
            return file;
        }

        public boolean isCaseSensitive() {
            return caseSensitive;
        }

        public Connector getConnector() {
            return connector;
        }

        public List<String> getKeywords() {
            return keywords;
        }
    }
}
