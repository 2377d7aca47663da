package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.tree.Conditions;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.If;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.While;

/**
 * {@code while true do if c then break end ... end} is {@code while not c do ... end}.
 */
final class WhileConditionIdiom extends SequenceRewrite {
    @Override
    boolean rewrite(StructuredFunction fn, Sequence seq) {
        boolean changed = false;
        for (StructuredNode node : seq.nodes) {
            if (!(node instanceof While)) continue;
            While loop = (While) node;
            if (!Conditions.isTrue(loop.cond) || loop.body.isEmpty()) continue;
            StructuredNode first = loop.body.nodes.get(0);
            if (!(first instanceof If)) continue;
            If test = (If) first;
            if (test.orElse != null && !test.orElse.isEmpty()
                    || test.then.nodes.size() != 1
                    || test.then.nodes.get(0).kind() != StructuredNode.Kind.BREAK) {
                continue;
            }
            loop.cond = Conditions.not(test.cond);
            loop.body.nodes.remove(0);
            changed = true;
        }
        return changed;
    }
}
