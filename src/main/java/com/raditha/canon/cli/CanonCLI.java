package com.raditha.canon.cli;

import com.raditha.canon.config.CanonConfig;
import com.raditha.canon.config.CanonSettings;
import com.raditha.canon.diff.Edit;
import com.raditha.canon.diff.Patch;
import com.raditha.canon.document.CanonicalWriter;
import com.raditha.canon.document.Document;
import com.raditha.canon.exceptions.CanonException;
import com.raditha.canon.format.FormatGrammar;
import com.raditha.canon.format.FormatGrammars;
import com.raditha.canon.patch.EditFailure;
import com.raditha.canon.preview.TextDiffPreview;
import com.raditha.canon.workflow.Projection;
import com.raditha.canon.workflow.ProjectionWorkflow;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line interface for canonical normalization and edit projection.
 * <p>
 * Usage:
 * java -jar canon.jar [options] normalize|compare|apply|check ...
 * <p>
 * Configuration priority: CLI arguments > canon.yml > defaults
 * <p>
 * Exit codes: 0 success, 1 error or differences found by {@code compare}, 2 configuration
 * error, 3 I/O error.
 */
@Command(name = "canon", mixinStandardHelpOptions = true, version = "canon v1.0.0",
        description = "Canonical normalization of YAML and JSON with format-preserving edits",
        subcommands = {
                CanonCLI.NormalizeCommand.class,
                CanonCLI.CompareCommand.class,
                CanonCLI.ApplyCommand.class,
                CanonCLI.CheckCommand.class})
public class CanonCLI implements Callable<Integer> {

    static final int OK = 0;
    static final int DIFFERENT = 1;

    // Global Options
    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--preset", description = "Rule preset: default, strict, lenient or tekton",
            paramLabel = "<name>")
    private String preset;

    @Option(names = "--mode", description = "Transaction mode: all-or-nothing or best-effort",
            paramLabel = "<mode>")
    private String mode;

    @Spec
    private CommandSpec spec;

    /**
     * Without a subcommand, print usage.
     */
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return OK;
    }

    CanonConfig config() throws IOException {
        return CanonSettings.loadConfig(configFile, preset, mode);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * The command line with the error handling and exit codes of the tool.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new CanonCLI());

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof CanonException canon) {
                commandLine.getErr().println("Error at " + canon.getLocation() + ": " + ex.getMessage());
                return 1;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    static String read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("File not found: " + file);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    static FormatGrammar grammarFor(Path file, String format) {
        return format != null ? FormatGrammars.forName(format) : FormatGrammars.forPath(file);
    }

    /**
     * Print the canonical view of a document.
     */
    @Command(name = "normalize", mixinStandardHelpOptions = true,
            description = "Print the canonical view of a document")
    static class NormalizeCommand implements Callable<Integer> {

        @ParentCommand
        private CanonCLI parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Document to normalize", paramLabel = "<file>")
        private Path file;

        @Option(names = "--input-format", description = "Input format, when the extension does not tell",
                paramLabel = "<format>")
        private String inputFormat;

        @Option(names = {"-f", "--format"}, description = "Output format: yaml or json (default: input format)",
                paramLabel = "<format>", converter = OutputFormatConverter.class)
        private OutputFormat format;

        @Option(names = {"-o", "--output"}, description = "Write to a file instead of standard output",
                paramLabel = "<path>")
        private Path output;

        @Override
        public Integer call() throws IOException {
            Document document = Document.parse(read(file), grammarFor(file, inputFormat), parent.config());
            String target = format != null ? format.toCliString() : document.grammar().name();
            String text = new CanonicalWriter(document.rules()).write(document.tree(), target);
            if (output != null) {
                Files.writeString(output, text, StandardCharsets.UTF_8);
            } else {
                spec.commandLine().getOut().print(text);
                spec.commandLine().getOut().flush();
            }
            return OK;
        }
    }

    /**
     * Compare the meaning of two documents.
     */
    @Command(name = "compare", mixinStandardHelpOptions = true,
            description = "Compare two documents after normalization; exit code 1 when they differ")
    static class CompareCommand implements Callable<Integer> {

        @ParentCommand
        private CanonCLI parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "First document", paramLabel = "<left>")
        private Path left;

        @Parameters(index = "1", description = "Second document", paramLabel = "<right>")
        private Path right;

        @Option(names = {"-q", "--quiet"}, description = "Only set the exit code")
        private boolean quiet;

        @Override
        public Integer call() throws IOException {
            ProjectionWorkflow workflow = new ProjectionWorkflow(parent.config());
            Patch patch = workflow.compare(read(left), grammarFor(left, null), read(right), grammarFor(right, null));
            PrintWriter out = spec.commandLine().getOut();
            if (patch.isEmpty()) {
                if (!quiet) {
                    out.println("Documents are equivalent");
                }
                out.flush();
                return OK;
            }
            if (!quiet) {
                out.printf("Documents differ: %d edits%n", patch.size());
                for (Edit edit : patch.edits()) {
                    out.println("  " + edit);
                }
            }
            out.flush();
            return DIFFERENT;
        }
    }

    /**
     * Project the edits of a canonical view onto the original document.
     */
    @Command(name = "apply", mixinStandardHelpOptions = true,
            description = "Write the changes of an edited canonical view into the original document")
    static class ApplyCommand implements Callable<Integer> {

        @ParentCommand
        private CanonCLI parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Original document", paramLabel = "<original>")
        private Path original;

        @Parameters(index = "1", description = "Edited canonical view", paramLabel = "<edited>")
        private Path edited;

        @Option(names = {"-i", "--in-place"}, description = "Overwrite the original document")
        private boolean inPlace;

        @Option(names = "--diff", description = "Print a unified diff instead of the patched text")
        private boolean diff;

        @Override
        public Integer call() throws IOException {
            ProjectionWorkflow workflow = new ProjectionWorkflow(parent.config());
            String originalText = read(original);
            Projection projection = workflow.projectEdits(originalText, grammarFor(original, null), read(edited),
                    grammarFor(edited, null));
            PrintWriter out = spec.commandLine().getOut();
            for (EditFailure failure : projection.failures()) {
                spec.commandLine().getErr().println("Skipped " + failure);
            }
            if (diff) {
                out.println(new TextDiffPreview().unifiedDiff(original.getFileName().toString(), originalText,
                        projection.text()));
            } else if (!inPlace) {
                out.print(projection.text());
            }
            if (inPlace && projection.hasChanges()) {
                Files.writeString(original, projection.text(), StandardCharsets.UTF_8);
            }
            out.flush();
            return projection.failures().isEmpty() ? OK : DIFFERENT;
        }
    }

    /**
     * Check that a document parses, normalizes and reproduces its own text.
     */
    @Command(name = "check", mixinStandardHelpOptions = true,
            description = "Verify that a document parses and round-trips byte for byte")
    static class CheckCommand implements Callable<Integer> {

        @ParentCommand
        private CanonCLI parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Document to check", paramLabel = "<file>")
        private Path file;

        @Override
        public Integer call() throws IOException {
            CanonConfig config = parent.config().withVerifyRoundTrip(true);
            Document document = Document.parse(read(file), grammarFor(file, null), config);
            spec.commandLine().getOut().printf("%s: OK (%d syntax nodes, %d semantic nodes)%n", file,
                    document.cst().size(), document.tree().size());
            spec.commandLine().getOut().flush();
            return OK;
        }
    }

    /**
     * Custom converter for OutputFormat enum to handle CLI string values.
     */
    public static class OutputFormatConverter implements ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) throws Exception {
            return OutputFormat.fromString(value);
        }
    }
}
