package org.hackvm.translator.backend.segment;

import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The static segment table: every VM memory segment with its base and valid index range.
 */
public enum MemorySegment {
    /** Virtual segment of literals; never stored. */
    CONSTANT("constant", null, 32767),
    LOCAL("local", new SegmentBase.PointerIndirect("LCL"), 32767),
    ARGUMENT("argument", new SegmentBase.PointerIndirect("ARG"), 32767),
    THIS("this", new SegmentBase.PointerIndirect("THIS"), 32767),
    THAT("that", new SegmentBase.PointerIndirect("THAT"), 32767),
    /** RAM[5..12]. */
    TEMP("temp", new SegmentBase.FixedAbsolute(5), 7),
    /** RAM[3..4], aliasing THIS and THAT. */
    POINTER("pointer", new SegmentBase.FixedAbsolute(3), 1),
    /** RAM[16..255]. */
    STATIC("static", new SegmentBase.FixedAbsolute(16), 239);

    private static final Map<String, MemorySegment> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MemorySegment::vmName, Function.identity()));

    private final String vmName;
    private final SegmentBase base;
    private final int maxIndex;

    MemorySegment(String vmName, SegmentBase base, int maxIndex) {
        this.vmName = vmName;
        this.base = base;
        this.maxIndex = maxIndex;
    }

    /**
     * Resolves a segment by the name used in VM code.
     *
     * @param name The segment name, e.g. {@code local}.
     * @return The segment.
     * @throws TranslationException with {@link TranslatorErrorCode#UNKNOWN_SEGMENT} if the name is not mapped.
     */
    public static MemorySegment resolve(String name) throws TranslationException {
        MemorySegment segment = BY_NAME.get(name);
        if (segment == null) {
            throw new TranslationException(TranslatorErrorCode.UNKNOWN_SEGMENT, "Unknown segment '" + name + "'");
        }
        return segment;
    }

    /**
     * Checks that an index addresses a slot of this segment.
     *
     * @param index The index to check.
     * @throws TranslationException with {@link TranslatorErrorCode#INVALID_INDEX} if it is out of range.
     */
    public void checkIndex(int index) throws TranslationException {
        if (index < 0 || index > maxIndex) {
            throw new TranslationException(TranslatorErrorCode.INVALID_INDEX,
                    String.format("Index %d is outside segment '%s' (0..%d)", index, vmName, maxIndex));
        }
    }

    public String vmName() {
        return vmName;
    }

    /**
     * @return The base of this segment, {@code null} for {@link #CONSTANT}.
     */
    public SegmentBase base() {
        return base;
    }

    public int maxIndex() {
        return maxIndex;
    }

    public boolean isConstant() {
        return this == CONSTANT;
    }
}
