package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single-entry piece of the function that has been structured so far.
 */
public final class Region {
    /**
     * The block control enters the region through, or null for a region not built from blocks.
     */
    public final @Nullable BasicBlock head;
    public final int startOffset;
    public final Set<BasicBlock> blocks = new LinkedHashSet<>();
    public Sequence body;
    public Exit exit;
    /**
     * The label gotos to this region use, once one has been requested.
     */
    public @Nullable String label;
    /**
     * Whether the first block of the region starts with a {@code LOOP} instruction.
     */
    public boolean loopMarker;
    boolean alive = true;

    Region(@Nullable BasicBlock head, int startOffset, Sequence body, Exit exit) {
        this.head = head;
        this.startOffset = startOffset;
        if (head != null) blocks.add(head);
        this.body = body;
        this.exit = exit;
    }

    public boolean isAlive() {
        return alive;
    }

    /**
     * @return The label of this region, creating it if necessary.
     */
    public String requireLabel() {
        if (label == null) label = "L" + startOffset;
        return label;
    }

    /**
     * @return The body, wrapped in a labeled block if gotos target this region.
     */
    public StructuredNode labeledBody() {
        return label == null ? body : new StructuredNode.Block(label, body);
    }

    @Override
    public String toString() {
        return "region@" + startOffset;
    }
}
