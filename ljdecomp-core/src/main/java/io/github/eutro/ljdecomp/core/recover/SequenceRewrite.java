package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import io.github.eutro.ljdecomp.core.tree.Trees;

import java.util.ArrayList;
import java.util.List;

/**
 * A rewrite applied to the statements of every sequence in a function.
 */
abstract class SequenceRewrite {
    /**
     * @param fn The function.
     * @return Whether anything changed.
     */
    boolean run(StructuredFunction fn) {
        List<Sequence> sequences = new ArrayList<>();
        Trees.forEachNode(fn.root, node -> {
            if (node.kind() == StructuredNode.Kind.SEQUENCE) sequences.add((Sequence) node);
        });
        boolean changed = false;
        for (Sequence seq : sequences) {
            changed |= rewrite(fn, seq);
        }
        return changed;
    }

    abstract boolean rewrite(StructuredFunction fn, Sequence seq);
}
