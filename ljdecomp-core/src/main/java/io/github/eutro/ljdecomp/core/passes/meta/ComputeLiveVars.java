package io.github.eutro.ljdecomp.core.passes.meta;

import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ext.CommonExts.LiveData;
import io.github.eutro.ljdecomp.core.ext.MetadataState;
import io.github.eutro.ljdecomp.core.ir.*;
import io.github.eutro.ljdecomp.core.passes.InPlaceIRPass;

import java.util.*;

/**
 * Computes the register {@link CommonExts#LIVE_DATA} of each block.
 * Constants and {@code MULTRES} are not tracked.
 */
public class ComputeLiveVars implements InPlaceIRPass<Function> {
    public static final ComputeLiveVars INSTANCE = new ComputeLiveVars();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);

        for (BasicBlock block : func.blocks) {
            LiveData data = new LiveData();
            block.attachExt(CommonExts.LIVE_DATA, data);
            for (Effect effect : block.getEffects()) {
                use(data, effect.insn());
                for (Var var : effect.getAssignsTo()) {
                    if (var.isRegister()) data.kill.add(var);
                }
            }
            use(data, block.getControl().insn());
            data.liveIn.addAll(data.gen);
        }

        Set<BasicBlock> workQueue = new LinkedHashSet<>();
        for (ListIterator<BasicBlock> li = func.blocks.listIterator(func.blocks.size()); li.hasPrevious(); ) {
            workQueue.add(li.previous());
        }
        while (!workQueue.isEmpty()) {
            Iterator<BasicBlock> iterator = workQueue.iterator();
            BasicBlock next = iterator.next();
            iterator.remove();
            LiveData data = next.getExtOrThrow(CommonExts.LIVE_DATA);
            boolean changed = false;
            for (BasicBlock succ : next.getControl().targets) {
                for (Var varIn : succ.getExtOrThrow(CommonExts.LIVE_DATA).liveIn) {
                    if (data.liveOut.add(varIn) && !data.kill.contains(varIn)) {
                        changed |= data.liveIn.add(varIn);
                    }
                }
            }
            if (changed) {
                workQueue.addAll(next.getExtOrThrow(CommonExts.PREDS));
            }
        }

        ms.validate(MetadataState.LIVE_DATA);
    }

    private static void use(LiveData data, Insn insn) {
        for (Var arg : insn.args()) {
            if (arg.isRegister() && !data.kill.contains(arg)) data.gen.add(arg);
        }
    }
}
