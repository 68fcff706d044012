package org.hackvm.translator.backend.emit;

import org.hackvm.translator.TranslatorOptions;
import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;
import org.hackvm.translator.backend.segment.MemorySegment;
import org.hackvm.translator.backend.segment.SegmentBase;
import org.hackvm.translator.frontend.parser.CommandType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The CodeWriter generates Hack assembly for classified VM operations and accumulates
 * it into an {@link AssemblyProgram}, one {@link Block} per call.
 * <p>
 * Every operation is validated completely before its block is built, so a failing
 * call never leaves a partial block behind. Comparison labels are numbered by a counter
 * owned by this instance. It is not thread-safe.
 */
public class CodeWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CodeWriter.class);

    /** Scratch register for the effective address of a pointer-indirect pop. */
    static final String ADDRESS_SCRATCH = "R13";

    private final TranslatorOptions options;
    private final AssemblyProgram program = new AssemblyProgram();
    private int comparisonLabelCounter = 0;

    /**
     * Creates a writer with the default options.
     */
    public CodeWriter() {
        this(TranslatorOptions.DEFAULTS);
    }

    /**
     * Creates a writer and seeds the program with the stack pointer initialization.
     *
     * @param options The translation settings.
     */
    public CodeWriter(TranslatorOptions options) {
        this.options = options;
        List<String> asm = new ArrayList<>();
        asm.add("@" + options.stackBase());
        asm.add("D=A");
        asm.add("@SP");
        asm.add("M=D");
        append("initialize stack pointer", asm);
    }

    /**
     * Emits the block for one arithmetic or logical stack operation.
     *
     * @param command The operator token, e.g. {@code add}.
     * @throws TranslationException with {@link TranslatorErrorCode#INVALID_OPERATOR} if the token is unknown.
     */
    public void writeArithmetic(String command) throws TranslationException {
        ensureOpen();
        ArithmeticOperator op = ArithmeticOperator.fromToken(command);
        List<String> asm = new ArrayList<>();
        switch (op.kind()) {
            case BINARY -> {
                popToD(asm);
                asm.add("A=A-1");
                asm.add("M=" + op.fragment());
            }
            case UNARY -> {
                asm.add("@SP");
                asm.add("A=M-1");
                asm.add("M=" + op.fragment());
            }
            case COMPARISON -> writeComparison(op, asm);
        }
        append(op.token(), asm);
    }

    private void writeComparison(ArithmeticOperator op, List<String> asm) {
        int n = comparisonLabelCounter++;
        String trueLabel = op.name() + "_TRUE_" + n;
        String endLabel = op.name() + "_END_" + n;

        popToD(asm);
        asm.add("@SP");
        asm.add("AM=M-1");
        asm.add("D=M-D");
        // A still addresses the left operand's slot: assume false there
        asm.add("M=0");
        asm.add("@" + trueLabel);
        asm.add("D;" + op.fragment());
        asm.add("@" + endLabel);
        asm.add("0;JMP");
        asm.add("(" + trueLabel + ")");
        asm.add("@SP");
        asm.add("A=M");
        asm.add("M=-1");
        asm.add("(" + endLabel + ")");
        asm.add("@SP");
        asm.add("M=M+1");
    }

    /**
     * Emits the block for a push or pop.
     *
     * @param command {@link CommandType#PUSH} or {@link CommandType#POP}.
     * @param segment The VM segment name.
     * @param index The slot index within the segment.
     * @throws TranslationException if the segment is unknown, the index is out of range,
     *         or the operation is a pop into {@code constant}.
     * @throws IllegalArgumentException if {@code command} is neither push nor pop.
     */
    public void writePushPop(CommandType command, String segment, int index) throws TranslationException {
        if (command != CommandType.PUSH && command != CommandType.POP) {
            throw new IllegalArgumentException("Not a push or pop: " + command);
        }
        ensureOpen();
        MemorySegment seg = MemorySegment.resolve(segment);
        seg.checkIndex(index);
        boolean push = command == CommandType.PUSH;

        List<String> asm = new ArrayList<>();
        if (seg.isConstant()) {
            if (!push) {
                throw new TranslationException(TranslatorErrorCode.INVALID_SEGMENT_OPERATION,
                        "Cannot pop into segment 'constant'");
            }
            asm.add("@" + index);
            asm.add("D=A");
            pushD(asm);
        } else if (seg.base() instanceof SegmentBase.FixedAbsolute fixed) {
            if (push) {
                asm.add("@" + fixed.addressOf(index));
                asm.add("D=M");
                pushD(asm);
            } else {
                popToD(asm);
                asm.add("@" + fixed.addressOf(index));
                asm.add("M=D");
            }
        } else if (seg.base() instanceof SegmentBase.PointerIndirect pointer) {
            asm.add("@" + index);
            asm.add("D=A");
            asm.add("@" + pointer.register());
            if (push) {
                asm.add("A=D+M");
                asm.add("D=M");
                pushD(asm);
            } else {
                asm.add("D=D+M");
                asm.add("@" + ADDRESS_SCRATCH);
                asm.add("M=D");
                popToD(asm);
                asm.add("@" + ADDRESS_SCRATCH);
                asm.add("A=M");
                asm.add("M=D");
            }
        }
        append((push ? "push " : "pop ") + seg.vmName() + " " + index, asm);
    }

    /**
     * Appends the halting epilogue exactly once and freezes the program.
     * Further calls return the same program without changing it.
     *
     * @return The finished program.
     */
    public AssemblyProgram finish() {
        if (!program.isFinished()) {
            String halt = options.haltLabel();
            append("halt", List.of("(" + halt + ")", "@" + halt, "0;JMP"));
            program.finish();
            LOG.debug("Finished program with {} blocks and {} comparisons", program.blocks().size(), comparisonLabelCounter);
        }
        return program;
    }

    /**
     * @return The program built so far.
     */
    public AssemblyProgram getProgram() {
        return program;
    }

    /**
     * @return The number of comparisons emitted, which is also the next label number.
     */
    public int getComparisonLabelCounter() {
        return comparisonLabelCounter;
    }

    private void ensureOpen() {
        if (program.isFinished()) {
            throw new IllegalStateException("The program has already been finished");
        }
    }

    private void append(String comment, List<String> asm) {
        program.append(new Block(options.echoComments() ? comment : null, asm));
    }

    private static void popToD(List<String> asm) {
        asm.add("@SP");
        asm.add("AM=M-1");
        asm.add("D=M");
    }

    private static void pushD(List<String> asm) {
        asm.add("@SP");
        asm.add("A=M");
        asm.add("M=D");
        asm.add("@SP");
        asm.add("M=M+1");
    }
}
