package io.github.eutro.ljdecomp.core.ext;

import io.github.eutro.ljdecomp.core.ir.*;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Exts that describe the shape of the IR itself, independent of the bytecode it came from.
 */
public class CommonExts {
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    public static final Ext<BasicBlock> IDOM = Ext.create(BasicBlock.class, "IDOM");
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");
    public static final Ext<List<BasicBlock>> DOM_CHILDREN = Ext.create(List.class, "DOM_CHILDREN");
    /**
     * Position of a block in a depth-first preorder of the dominator tree, with the
     * {@link #DOM_EXIT exit} number giving the end of its subtree. Used for constant-time dominance checks.
     */
    public static final Ext<Integer> DOM_ENTER = Ext.create(Integer.class, "DOM_ENTER");
    public static final Ext<Integer> DOM_EXIT = Ext.create(Integer.class, "DOM_EXIT");

    public static final Ext<Object> CONSTANT_VALUE = Ext.create(Object.class, "CONSTANT_VALUE");

    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    public static final Ext<LiveData> LIVE_DATA = Ext.create(LiveData.class, "LIVE_DATA");

    /**
     * Per-block register liveness.
     */
    public static class LiveData {
        public final Set<Var>
                gen = new HashSet<>(),
                kill = new HashSet<>(),
                liveIn = new LinkedHashSet<>(),
                liveOut = new HashSet<>();
    }
}
