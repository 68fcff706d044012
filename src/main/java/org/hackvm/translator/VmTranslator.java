package org.hackvm.translator;

import org.hackvm.translator.api.SourceInfo;
import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;
import org.hackvm.translator.backend.emit.AssemblyProgram;
import org.hackvm.translator.backend.emit.CodeWriter;
import org.hackvm.translator.backend.emit.OutputSink;
import org.hackvm.translator.diagnostics.DiagnosticsEngine;
import org.hackvm.translator.frontend.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

/**
 * Drives the translation of one VM program: pulls classified instructions from the
 * {@link Parser}, dispatches them to the {@link CodeWriter} and, on {@link #close()},
 * writes the finished program to the {@link OutputSink} in a single scoped write.
 * <p>
 * Lifecycle: {@code IDLE -> RUNNING -> CLOSED}. A translation error moves the translator
 * to {@code FAILED}; closing a failed translator never touches the output sink, so a
 * failed run produces no output. It is not thread-safe.
 */
public class VmTranslator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(VmTranslator.class);

    /**
     * The states of a translator.
     */
    public enum State {
        /** Created, nothing translated yet. */
        IDLE,
        /** At least one instruction has been translated. */
        RUNNING,
        /** A translation error aborted the run. */
        FAILED,
        /** The program has been written, or the failed run has been discarded. Terminal. */
        CLOSED
    }

    private final Parser parser;
    private final CodeWriter codeWriter;
    private final OutputSink sink;
    private final DiagnosticsEngine diagnostics;
    private State state = State.IDLE;
    private int translatedCount = 0;

    /**
     * Creates a translator from already constructed collaborators.
     *
     * @param parser The instruction source.
     * @param codeWriter The code generator.
     * @param sink Where the program is written on {@link #close()}.
     * @param diagnostics Collects warnings about untranslated commands and the error that aborted a run.
     */
    public VmTranslator(Parser parser, CodeWriter codeWriter, OutputSink sink, DiagnosticsEngine diagnostics) {
        this.parser = parser;
        this.codeWriter = codeWriter;
        this.sink = sink;
        this.diagnostics = diagnostics;
    }

    /**
     * Creates a translator from a VM file to an assembly file.
     *
     * @param input The VM file.
     * @param output The assembly file, created or truncated on {@link #close()}.
     * @param options The translation settings.
     * @return The translator.
     * @throws TranslationException with {@link TranslatorErrorCode#FILE_IO} if the input cannot be read.
     */
    public static VmTranslator forFiles(Path input, Path output, TranslatorOptions options) throws TranslationException {
        return new VmTranslator(Parser.fromFile(input), new CodeWriter(options), OutputSink.toFile(output), new DiagnosticsEngine());
    }

    /**
     * Translates every remaining instruction.
     *
     * @throws TranslationException at the first instruction that cannot be parsed or translated.
     * @throws IllegalStateException if the translator is closed or has failed before.
     */
    public void translate() throws TranslationException {
        if (state == State.CLOSED || state == State.FAILED) {
            throw new IllegalStateException("Cannot translate in state " + state);
        }
        state = State.RUNNING;
        try {
            while (parser.hasMoreLines()) {
                parser.advance();
                translateCurrent();
            }
        } catch (TranslationException e) {
            state = State.FAILED;
            SourceInfo source = e.getSourceInfo() != null ? e.getSourceInfo() : new SourceInfo(parser.getFileName(), 0, "");
            diagnostics.reportError(e.getMessage(), source);
            throw e;
        }
        LOG.debug("Translated {} of {} instructions from {}", translatedCount, parser.instructionCount(), parser.getFileName());
    }

    private void translateCurrent() throws TranslationException {
        SourceInfo source = parser.currentSource();
        LOG.trace("Translating {}", source);
        boolean translated;
        try {
            translated = switch (parser.commandType()) {
                case ARITHMETIC -> {
                    codeWriter.writeArithmetic(parser.arg1());
                    yield true;
                }
                case PUSH, POP -> {
                    codeWriter.writePushPop(parser.commandType(), parser.arg1(), parser.arg2());
                    yield true;
                }
                case LABEL, GOTO, IF, FUNCTION, RETURN, CALL -> {
                    reportUntranslated(source);
                    yield false;
                }
            };
        } catch (TranslationException e) {
            throw e.at(source);
        }
        if (translated) {
            translatedCount++;
        }
    }

    private void reportUntranslated(SourceInfo source) {
        String message = String.format("Command '%s' (%s) is not translated yet", source.lineContent(), parser.commandType());
        diagnostics.reportWarning(message, source);
        LOG.warn("{}:{}: {}", source.fileName(), source.lineNumber(), message);
    }

    /**
     * Appends the halting epilogue and writes the whole program to the sink: the sink is
     * opened once, every block is written in order, and the writer is closed.
     * <p>
     * Closing twice is a no-op. Closing after a failed {@link #translate()} discards the
     * program without opening the sink.
     *
     * @throws TranslationException with {@link TranslatorErrorCode#FILE_IO} if the output cannot be written.
     */
    @Override
    public void close() throws TranslationException {
        if (state == State.CLOSED) {
            LOG.debug("Translator for {} already closed", parser.getFileName());
            return;
        }
        if (state == State.FAILED) {
            state = State.CLOSED;
            LOG.debug("Discarding output of failed translation of {}", parser.getFileName());
            return;
        }
        state = State.CLOSED;
        AssemblyProgram program = codeWriter.finish();
        try (Writer writer = sink.open()) {
            program.writeTo(writer);
        } catch (IOException e) {
            throw new TranslationException(TranslatorErrorCode.FILE_IO, "Cannot write translated program: " + e.getMessage(), e);
        }
        LOG.info("Translated {}: {} instructions, {} blocks written", parser.getFileName(), translatedCount, program.blocks().size());
    }

    public State getState() {
        return state;
    }

    /**
     * @return The number of instructions that produced a block.
     */
    public int getTranslatedCount() {
        return translatedCount;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    public AssemblyProgram getProgram() {
        return codeWriter.getProgram();
    }
}
