package io.github.eutro.ljdecomp.core.passes.opts;

import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ext.LuaExts;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.ir.Function;
import io.github.eutro.ljdecomp.core.passes.InPlaceIRPass;
import io.github.eutro.ljdecomp.core.util.GraphWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Removes blocks unreachable from the entry, reporting each removed block as
 * {@link DiagnosticKind#UNREACHABLE_CODE} to the function's {@link LuaExts#CONTEXT}, if it has one.
 */
public class EliminateDeadBlocks implements InPlaceIRPass<Function> {
    private static final Logger LOG = LoggerFactory.getLogger(EliminateDeadBlocks.class);

    public static final EliminateDeadBlocks INSTANCE = new EliminateDeadBlocks();

    @Override
    public void runInPlace(Function func) {
        Set<BasicBlock> live = new HashSet<>(GraphWalker.blockWalker(func).preOrder().toList());
        if (live.size() == func.blocks.size()) return;

        DecompileContext ctx = func.getNullable(LuaExts.CONTEXT);
        for (BasicBlock block : func.blocks) {
            if (live.contains(block)) continue;
            LOG.debug("{}: pruning unreachable block {}", func.source, block.toTargetString());
            if (ctx != null) {
                ctx.report(DiagnosticKind.UNREACHABLE_CODE,
                        "instructions [" + block.startOffset + ", " + block.endOffset + ") are unreachable",
                        block.startOffset);
            }
        }
        func.blocks.retainAll(live);
        func.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
    }
}
