package io.github.eutro.ljdecomp.core.ext;

import io.github.eutro.ljdecomp.core.ir.Function;
import io.github.eutro.ljdecomp.core.passes.IRPass;
import io.github.eutro.ljdecomp.core.passes.meta.ComputeDoms;
import io.github.eutro.ljdecomp.core.passes.meta.ComputeLiveVars;
import io.github.eutro.ljdecomp.core.passes.meta.ComputeLoops;
import io.github.eutro.ljdecomp.core.passes.meta.ComputePreds;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which derived facts about a {@link Function} are currently up to date.
 */
public class MetadataState {
    /**
     * A kind of derived metadata.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Metadata that knows which in-place passes recompute it.
     *
     * @param <T> The IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalStateException(pass + " is not in-place");
                pass.run(t);
            }
        }
    }

    public static final ComputableMetaKind<Function>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            DOMS = new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE),
            LOOPS = new ComputableMetaKind<>("LOOPS", ComputeLoops.INSTANCE),
            LIVE_DATA = new ComputableMetaKind<>("LIVE_DATA", ComputeLiveVars.INSTANCE);

    private final BitSet valid = new BitSet();

    public boolean isValid(MetaKind kind) {
        return valid.get(kind.id);
    }

    /**
     * Recompute each of the given kinds that is not currently valid, in order.
     *
     * @param t     The IR.
     * @param first The first kind.
     * @param rest  More kinds.
     * @param <T>   The IR type.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... rest) {
        ensureOne(t, first);
        for (ComputableMetaKind<T> kind : rest) {
            ensureOne(t, kind);
        }
    }

    private <T> void ensureOne(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            valid.set(kind.id);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            valid.clear(kind.id);
        }
    }

    /**
     * Invalidate everything derived from the block graph.
     */
    public void graphChanged() {
        invalidate(PREDS, DOMS, LOOPS);
        varsChanged();
    }

    /**
     * Invalidate everything derived from variable reads and writes.
     */
    public void varsChanged() {
        invalidate(LIVE_DATA);
    }
}
