package org.hackvm.translator.frontend.parser;

import org.hackvm.translator.api.SourceInfo;
import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The Parser reads a VM program and breaks each instruction into its parts.
 * <p>
 * The whole input is materialized on construction: comments and blank lines are
 * dropped and the remaining instructions keep their original order. The parser is
 * then advanced one instruction at a time; after every {@link #advance()} the
 * accessors describe the current instruction. It is not thread-safe.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    /** The nine stack operators, kept in sync with the code writer's operator table. */
    static final Set<String> ARITHMETIC_COMMANDS = Set.of("add", "sub", "neg", "eq", "gt", "lt", "and", "or", "not");

    private final String fileName;
    private final List<SourceLine> lines;
    private int nextIndex = 0;
    private SourceLine currentLine;
    private ParsedCommand current;

    /**
     * Creates a parser over lines that are already in memory.
     *
     * @param rawLines The raw input lines, including comments and blank lines.
     * @param fileName The logical name of the input, used in diagnostics.
     */
    public Parser(List<String> rawLines, String fileName) {
        this.fileName = fileName;
        List<SourceLine> retained = new ArrayList<>();
        for (int i = 0; i < rawLines.size(); i++) {
            String text = SourceLine.strip(rawLines.get(i));
            if (!text.isEmpty()) {
                retained.add(new SourceLine(i + 1, text));
            }
        }
        this.lines = Collections.unmodifiableList(retained);
        LOG.debug("Loaded {} instructions from {} ({} raw lines)", lines.size(), fileName, rawLines.size());
    }

    /**
     * Creates a parser that reads the whole content of the given reader.
     * The reader is consumed but not closed.
     *
     * @param reader The input.
     * @param fileName The logical name of the input, used in diagnostics.
     * @throws TranslationException with {@link TranslatorErrorCode#FILE_IO} if the input cannot be read.
     */
    public Parser(BufferedReader reader, String fileName) throws TranslationException {
        this(readAll(reader, fileName), fileName);
    }

    /**
     * Creates a parser for a VM file.
     *
     * @param file The file to read (UTF-8).
     * @return A parser positioned before the first instruction.
     * @throws TranslationException with {@link TranslatorErrorCode#FILE_IO} if the file cannot be read.
     */
    public static Parser fromFile(Path file) throws TranslationException {
        try {
            return new Parser(Files.readAllLines(file, StandardCharsets.UTF_8), file.getFileName().toString());
        } catch (IOException e) {
            throw new TranslationException(TranslatorErrorCode.FILE_IO, "Cannot read input file " + file, e);
        }
    }

    private static List<String> readAll(BufferedReader reader, String fileName) throws TranslationException {
        List<String> raw = new ArrayList<>();
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                raw.add(line);
            }
        } catch (IOException e) {
            throw new TranslationException(TranslatorErrorCode.FILE_IO, "Cannot read input " + fileName, e);
        }
        return raw;
    }

    /**
     * @return {@code true} while an unconsumed instruction exists.
     */
    public boolean hasMoreLines() {
        return nextIndex < lines.size();
    }

    /**
     * Moves to the next instruction and classifies it.
     *
     * @throws TranslationException with {@link TranslatorErrorCode#EXHAUSTED_INPUT} if no instruction is left,
     *         or with a classification error code if the instruction is malformed.
     */
    public void advance() throws TranslationException {
        if (!hasMoreLines()) {
            throw new TranslationException(TranslatorErrorCode.EXHAUSTED_INPUT,
                    "No more instructions in " + fileName + " to advance to");
        }
        SourceLine line = lines.get(nextIndex++);
        currentLine = line;
        current = null;
        try {
            current = parse(line.text());
        } catch (TranslationException e) {
            throw e.at(currentSource());
        }
        LOG.trace("{}:{} -> {}", fileName, line.lineNumber(), current);
    }

    /**
     * Classifies an instruction by its first token.
     *
     * @param firstToken The command token.
     * @return The command class.
     * @throws TranslationException with {@link TranslatorErrorCode#MALFORMED_INSTRUCTION} if the token is unknown.
     */
    public static CommandType classify(String firstToken) throws TranslationException {
        if (ARITHMETIC_COMMANDS.contains(firstToken)) {
            return CommandType.ARITHMETIC;
        }
        if (firstToken.startsWith("(")) {
            return CommandType.LABEL;
        }
        return switch (firstToken) {
            case "push" -> CommandType.PUSH;
            case "pop" -> CommandType.POP;
            case "goto" -> CommandType.GOTO;
            case "if-goto" -> CommandType.IF;
            case "function" -> CommandType.FUNCTION;
            case "return" -> CommandType.RETURN;
            case "call" -> CommandType.CALL;
            default -> throw new TranslationException(TranslatorErrorCode.MALFORMED_INSTRUCTION,
                    "Unknown command '" + firstToken + "'");
        };
    }

    static ParsedCommand parse(String text) throws TranslationException {
        String[] tokens = text.split("\\s+");
        CommandType type = classify(tokens[0]);
        if (tokens.length < type.requiredTokens()) {
            throw new TranslationException(TranslatorErrorCode.INSUFFICIENT_TOKENS,
                    String.format("'%s' needs %d tokens but has %d", tokens[0], type.requiredTokens(), tokens.length));
        }
        return switch (type) {
            case ARITHMETIC, RETURN -> new ParsedCommand(type, tokens[0], null);
            case LABEL -> new ParsedCommand(type, labelName(tokens[0]), null);
            case GOTO, IF -> new ParsedCommand(type, tokens[1], null);
            case PUSH, POP, FUNCTION, CALL -> new ParsedCommand(type, tokens[1], parseIndex(tokens[2]));
        };
    }

    private static String labelName(String token) throws TranslationException {
        if (token.length() < 3 || !token.endsWith(")")) {
            throw new TranslationException(TranslatorErrorCode.MALFORMED_INSTRUCTION,
                    "Malformed label '" + token + "'");
        }
        return token.substring(1, token.length() - 1);
    }

    private static int parseIndex(String token) throws TranslationException {
        if (token.isEmpty() || !token.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new TranslationException(TranslatorErrorCode.INVALID_INDEX,
                    "Index '" + token + "' is not a non-negative decimal integer");
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new TranslationException(TranslatorErrorCode.INVALID_INDEX, "Index '" + token + "' is too large", e);
        }
    }

    /**
     * @return The class of the current instruction.
     * @throws IllegalStateException if {@link #advance()} has not succeeded yet.
     */
    public CommandType commandType() {
        return requireCurrent().type();
    }

    /**
     * @return The first argument of the current instruction (see {@link ParsedCommand#arg1()}).
     * @throws IllegalStateException if {@link #advance()} has not succeeded yet.
     */
    public String arg1() {
        return requireCurrent().arg1();
    }

    /**
     * @return The integer argument of the current push/pop/function/call instruction.
     * @throws IllegalStateException if {@link #advance()} has not succeeded yet or the command has no index.
     */
    public int arg2() {
        ParsedCommand command = requireCurrent();
        if (!command.hasArg2()) {
            throw new IllegalStateException("Command " + command.type() + " has no second argument");
        }
        return command.arg2();
    }

    /**
     * @return The whole parsed form of the current instruction.
     */
    public ParsedCommand current() {
        return requireCurrent();
    }

    /**
     * @return The position of the current instruction, or {@code null} before the first {@link #advance()}.
     */
    public SourceInfo currentSource() {
        return currentLine == null ? null : new SourceInfo(fileName, currentLine.lineNumber(), currentLine.text());
    }

    /**
     * @return The number of retained instructions in the input.
     */
    public int instructionCount() {
        return lines.size();
    }

    public String getFileName() {
        return fileName;
    }

    private ParsedCommand requireCurrent() {
        if (current == null) {
            throw new IllegalStateException("No current instruction: advance() has not succeeded yet");
        }
        return current;
    }
}
