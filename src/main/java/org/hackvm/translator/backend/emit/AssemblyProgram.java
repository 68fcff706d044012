package org.hackvm.translator.backend.emit;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered sequence of {@link Block}s that makes up the translated program.
 * <p>
 * Blocks can only be appended until the program is finished; afterwards it is immutable.
 */
public final class AssemblyProgram {

    private final List<Block> blocks = new ArrayList<>();
    private boolean finished = false;

    void append(Block block) {
        if (finished) {
            throw new IllegalStateException("Cannot append to a finished program");
        }
        blocks.add(block);
    }

    void finish() {
        finished = true;
    }

    public boolean isFinished() {
        return finished;
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * @return All output lines in program order.
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        for (Block block : blocks) {
            lines.addAll(block.lines());
        }
        return lines;
    }

    /**
     * Writes every line of the program, each terminated by {@code \n}.
     * The writer is flushed but not closed.
     *
     * @param writer The target.
     * @throws IOException if writing fails.
     */
    public void writeTo(Writer writer) throws IOException {
        for (Block block : blocks) {
            for (String line : block.lines()) {
                writer.write(line);
                writer.write('\n');
            }
        }
        writer.flush();
    }
}
