package org.hackvm.translator.backend.segment;

/**
 * Where the base address of a memory segment comes from.
 * <p>
 * A segment is either mapped to a fixed RAM address, in which case its slots are
 * addressed directly, or its base is held in a pointer register, in which case every
 * access goes through that register first.
 */
public sealed interface SegmentBase permits SegmentBase.FixedAbsolute, SegmentBase.PointerIndirect {

    /**
     * A segment whose slot {@code i} lives at RAM address {@code address + i}.
     *
     * @param address The fixed base address.
     */
    record FixedAbsolute(int address) implements SegmentBase {
        public int addressOf(int index) {
            return address + index;
        }
    }

    /**
     * A segment whose slot {@code i} lives at {@code RAM[register] + i}.
     *
     * @param register The symbol of the register holding the base address, e.g. {@code LCL}.
     */
    record PointerIndirect(String register) implements SegmentBase {}
}
