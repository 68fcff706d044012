package org.hackvm.translator.backend.emit;

import java.util.ArrayList;
import java.util.List;

/**
 * The Hack instructions produced for exactly one VM instruction, or for the synthetic
 * prologue and epilogue.
 *
 * @param comment The echo comment written before the instructions, {@code null} for none.
 * @param instructions The instructions in emission order.
 */
public record Block(String comment, List<String> instructions) {

    public Block {
        instructions = List.copyOf(instructions);
    }

    /**
     * @return The output lines of this block, the echo comment first.
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>(instructions.size() + 1);
        if (comment != null) {
            lines.add("// " + comment);
        }
        lines.addAll(instructions);
        return lines;
    }
}
