package io.github.eutro.ljdecomp.core.cfg;

import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ext.MetadataState;
import io.github.eutro.ljdecomp.core.ir.Function;
import io.github.eutro.ljdecomp.core.passes.IRPass;
import io.github.eutro.ljdecomp.core.passes.opts.EliminateDeadBlocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prunes unreachable blocks, then computes predecessors, dominators, loops
 * and liveness. Instructions are left untouched.
 */
public class NormalizeCfg implements IRPass<Function, ControlFlowGraph> {
    private static final Logger LOG = LoggerFactory.getLogger(NormalizeCfg.class);

    public static final NormalizeCfg INSTANCE = new NormalizeCfg();

    @Override
    public ControlFlowGraph run(Function func) {
        EliminateDeadBlocks.INSTANCE.run(func);
        func.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(func,
                MetadataState.PREDS,
                MetadataState.DOMS,
                MetadataState.LOOPS,
                MetadataState.LIVE_DATA);
        ControlFlowGraph cfg = new ControlFlowGraph(func);
        if (!cfg.isComplete()) throw new IllegalStateException("metadata missing after normalization");
        LOG.debug("{}: {} blocks, {} loops", func.source, func.blocks.size(), cfg.loops().size());
        return cfg;
    }
}
