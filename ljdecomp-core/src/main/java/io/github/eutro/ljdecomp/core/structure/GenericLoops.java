package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.tree.Conditions;
import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Classifies and structures loops that no {@link LoopIdiom} matched.
 */
final class GenericLoops {
    private static final Logger LOG = LoggerFactory.getLogger(GenericLoops.class);

    private GenericLoops() {
    }

    static final class Shape {
        final LoopKind kind;
        /**
         * The region whose test controls the loop, and the index of its exiting edge.
         */
        final @Nullable Region control;
        final int controlIndex;
        final @Nullable Region follow;

        Shape(LoopKind kind, @Nullable Region control, int controlIndex, @Nullable Region follow) {
            this.kind = kind;
            this.control = control;
            this.controlIndex = controlIndex;
            this.follow = follow;
        }
    }

    /**
     * Classify a loop without changing it.
     *
     * @param scope The loop.
     * @return Its shape.
     */
    static Shape classify(LoopScope scope) {
        Region header = scope.header;
        if (!header.loopMarker && header.exit.kind == Exit.Kind.COND) {
            int exiting = -1;
            int exits = 0;
            for (int i = 0; i < 2; i++) {
                if (isRegionExit(scope, header.exit.targets[i])) {
                    exiting = i;
                    exits++;
                }
            }
            if (exits == 1) {
                Target stay = header.exit.targets[1 - exiting];
                if (stay.isRegion() || scope.isBackToHeader(stay)) {
                    return new Shape(LoopKind.WHILE, header, exiting, header.exit.targets[exiting].region);
                }
            }
        }

        Region latch = null;
        int latchIndex = -1;
        for (Region region : scope.members) {
            Exit exit = region.exit;
            if (exit.kind != Exit.Kind.COND) continue;
            for (int i = 0; i < 2; i++) {
                if (isRegionExit(scope, exit.targets[i]) && scope.isBackToHeader(exit.targets[1 - i])
                        && (latch == null || region.startOffset > latch.startOffset)) {
                    latch = region;
                    latchIndex = i;
                }
            }
        }
        if (latch != null) {
            return new Shape(LoopKind.REPEAT, latch, latchIndex, latch.exit.targets[latchIndex].region);
        }

        Map<Region, Integer> counts = new HashMap<>();
        for (Region region : scope.members) {
            for (Target target : region.exit.targets) {
                if (isRegionExit(scope, target)) counts.merge(target.region, 1, Integer::sum);
            }
        }
        Region follow = null;
        for (Map.Entry<Region, Integer> entry : counts.entrySet()) {
            if (follow == null
                    || entry.getValue() > counts.get(follow)
                    || entry.getValue().equals(counts.get(follow)) && entry.getKey().startOffset < follow.startOffset) {
                follow = entry.getKey();
            }
        }
        return new Shape(LoopKind.INFINITE, null, -1, follow);
    }

    private static boolean isRegionExit(LoopScope scope, Target target) {
        return target.isRegion() && scope.isExit(target);
    }

    static void structure(LoopScope scope) {
        Shape shape = classify(scope);
        LOG.debug("{} is a {} loop", scope.loop, shape.kind);
        switch (shape.kind) {
            case WHILE:
                structureWhile(scope, shape);
                break;
            case REPEAT:
                structureRepeat(scope, shape);
                break;
            default:
                structureInfinite(scope, shape);
                break;
        }
    }

    private static void structureWhile(LoopScope scope, Shape shape) {
        Region header = scope.header;
        scope.convertExits(shape.follow, header, shape.controlIndex);
        scope.reduce(header);

        Exit test = header.exit;
        int stayIndex = 1 - shape.controlIndex;
        Expr cond = Objects.requireNonNull(test.cond);
        Expr whileCond = stayIndex == 0 ? cond : Conditions.not(cond);
        Sequence body = scope.body(test.targets[stayIndex], header);

        StructuredNode loop;
        if (header.body.isEmpty()) {
            loop = new StructuredNode.While(whileCond, body);
        } else {
            Sequence full = new Sequence(header.body);
            full.append(new StructuredNode.If(Conditions.not(whileCond), new Sequence(new StructuredNode.Break()), null));
            full.append(body);
            loop = new StructuredNode.While(Expr.Constant.of(true), full);
        }
        scope.collapse(header, loop, LoopScope.exitTo(shape.follow));
    }

    private static void structureRepeat(LoopScope scope, Shape shape) {
        Region latch = Objects.requireNonNull(shape.control);
        Expr cond = Objects.requireNonNull(latch.exit.cond);
        Expr until = shape.controlIndex == 0 ? cond : Conditions.not(cond);
        latch.exit = Exit.jump(Target.CONTINUE);
        scope.convertExits(shape.follow, null, -1);
        scope.reduce(null);

        Sequence body = scope.body(Target.region(scope.header), null);
        scope.collapse(scope.header, new StructuredNode.RepeatUntil(body, until), LoopScope.exitTo(shape.follow));
    }

    private static void structureInfinite(LoopScope scope, Shape shape) {
        scope.convertExits(shape.follow, null, -1);
        scope.reduce(null);

        Sequence body = scope.body(Target.region(scope.header), null);
        scope.collapse(scope.header, new StructuredNode.While(Expr.Constant.of(true), body), LoopScope.exitTo(shape.follow));
    }
}
