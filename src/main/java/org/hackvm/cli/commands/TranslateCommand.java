package org.hackvm.cli.commands;

import com.typesafe.config.ConfigException;
import org.hackvm.cli.CommandLineInterface;
import org.hackvm.translator.TranslatorOptions;
import org.hackvm.translator.VmTranslator;
import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;
import org.hackvm.translator.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "translate",
        mixinStandardHelpOptions = true,
        description = "Translates a VM file into a Hack assembly file.")
public class TranslateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranslateCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_TRANSLATION_ERROR = 1;
    /** Also used for unexpected failures. */
    public static final int EXIT_IO_ERROR = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", description = "The VM file to translate.")
    private File input;

    @Option(names = {"-o", "--output"}, description = "The assembly file to write (default: input with the configured extension).")
    private File output;

    @Option(names = "--no-comments", description = "Do not echo VM instructions as comments.")
    private boolean noComments;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (!input.isFile()) {
            log.error("Input file not found: {}", input.getAbsolutePath());
            return EXIT_IO_ERROR;
        }

        final TranslatorOptions options;
        try {
            options = resolveOptions();
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_IO_ERROR;
        }

        Path outputPath = output != null ? output.toPath() : defaultOutput(input.toPath(), options.outputExtension());
        try (VmTranslator translator = VmTranslator.forFiles(input.toPath(), outputPath, options)) {
            translator.translate();
            long warnings = translator.getDiagnostics().count(Diagnostic.Type.WARNING);
            if (warnings > 0) {
                log.debug("Diagnostics for {}:\n{}", input.getName(), translator.getDiagnostics().summary());
            }
            translator.close();
            PrintWriter out = spec.commandLine().getOut();
            out.printf("Translated %s -> %s (%d instructions, %d warnings)%n",
                    input.getName(), outputPath, translator.getTranslatedCount(), warnings);
            out.flush();
            return EXIT_OK;
        } catch (TranslationException e) {
            if (e.getErrorCode() == TranslatorErrorCode.FILE_IO) {
                log.error("I/O error: {}", e.getMessage());
                return EXIT_IO_ERROR;
            }
            log.error("Translation error [{}]: {}", e.getErrorCode(), e.getMessage());
            return EXIT_TRANSLATION_ERROR;
        }
    }

    private TranslatorOptions resolveOptions() {
        TranslatorOptions options = TranslatorOptions.fromConfig(parent.getConfig());
        return noComments ? options.withEchoComments(false) : options;
    }

    /**
     * Derives the output file from the input by replacing its extension.
     *
     * @param input The VM file.
     * @param extension The extension of the output, including the dot.
     * @return The output file next to the input.
     */
    static Path defaultOutput(Path input, String extension) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + extension);
    }
}
