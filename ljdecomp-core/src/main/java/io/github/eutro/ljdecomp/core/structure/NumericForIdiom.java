package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;

import java.util.List;

/**
 * {@code for i = start, limit, step do ... end}: an entry region ending in {@code FORI}
 * into the loop, and a latch ending in {@code FORL} with the same base register.
 */
public class NumericForIdiom implements LoopIdiom {
    public static final NumericForIdiom INSTANCE = new NumericForIdiom();

    @Override
    public String name() {
        return "numeric for";
    }

    @Override
    public boolean apply(LoopScope scope) {
        Region latch = null;
        for (Region region : scope.members) {
            if (region.exit.kind == Exit.Kind.FOR_LOOP && scope.isBackToHeader(region.exit.targets[0])) {
                latch = region;
                break;
            }
        }
        if (latch == null) return false;
        Target exit = latch.exit.targets[1];
        if (!exit.isRegion() || !scope.isExit(exit)) return false;
        int base = latch.exit.base;

        List<Region> entries = scope.entries();
        if (entries.size() != 1) return false;
        Region prep = entries.get(0);
        if (prep.exit.kind != Exit.Kind.FOR_PREP
                || prep.exit.base != base
                || !prep.exit.targets[0].equals(Target.region(scope.header))
                || !prep.exit.targets[1].equals(exit)) {
            return false;
        }

        Region follow = exit.region;
        latch.exit = Exit.jump(Target.CONTINUE);
        scope.convertExits(follow, null, -1);
        scope.reduce(null);
        Sequence body = scope.body(Target.region(scope.header), null);

        int pc = prep.exit.pc;
        StructuredNode loop = new StructuredNode.NumericFor(
                new Expr.Register(base + 3, scope.header.startOffset),
                new Expr.Register(base, pc),
                new Expr.Register(base + 1, pc),
                new Expr.Register(base + 2, pc),
                body);
        scope.collapse(prep, loop, LoopScope.exitTo(follow));
        return true;
    }
}
