package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@code for k, v in gen, state, ctl do ... end}: an entry region jumping to a header
 * that calls the iterator ({@code ITERC}/{@code ITERN}) and loops while its first result
 * is not nil ({@code ITERL}).
 */
public class GenericForIdiom implements LoopIdiom {
    public static final GenericForIdiom INSTANCE = new GenericForIdiom();

    @Override
    public String name() {
        return "generic for";
    }

    @Override
    public boolean apply(LoopScope scope) {
        Region header = scope.header;
        if (header.exit.kind != Exit.Kind.ITER_LOOP) return false;
        Target bodyEntry = header.exit.targets[0];
        Target exit = header.exit.targets[1];
        if (!exit.isRegion() || !scope.isExit(exit)) return false;
        if (bodyEntry.isRegion() ? scope.isExit(bodyEntry) : !scope.isBackToHeader(bodyEntry)) return false;

        List<Region> entries = scope.entries();
        if (entries.size() != 1) return false;
        Region entry = entries.get(0);
        if (entry.exit.kind != Exit.Kind.JUMP) return false;

        if (header.body.nodes.size() != 1 || !(header.body.nodes.get(0) instanceof ExprStatement)) return false;
        ExprStatement iterCall = (ExprStatement) header.body.nodes.get(0);
        if (iterCall.values.size() != 1 || !(iterCall.values.get(0) instanceof Expr.Call)) return false;

        int base = header.exit.base;
        int bodyStart = bodyEntry.isRegion() ? bodyEntry.region.startOffset : header.startOffset;
        List<Expr> variables = new ArrayList<>();
        for (Expr target : iterCall.targets) {
            if (!(target instanceof Expr.Register)) return false;
            variables.add(new Expr.Register(((Expr.Register) target).slot, bodyStart));
        }
        int pc = iterCall.pc;
        List<Expr> iterators = Arrays.asList(
                new Expr.Register(base - 3, pc),
                new Expr.Register(base - 2, pc),
                new Expr.Register(base - 1, pc));

        Region follow = exit.region;
        header.body = new Sequence();
        header.exit = Exit.jump(Target.CONTINUE);
        scope.convertExits(follow, null, -1);
        scope.reduce(header);
        Sequence body = scope.body(bodyEntry.isRegion() ? bodyEntry : Target.CONTINUE, header);

        StructuredNode loop = new StructuredNode.GenericFor(variables, iterators, body);
        scope.collapse(entry, loop, LoopScope.exitTo(follow));
        return true;
    }
}
