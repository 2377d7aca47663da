package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * The structured tree of one function, as expression recovery rewrites it.
 */
public final class StructuredFunction {
    public final BytecodeFunction source;
    public Sequence root;
    public final @Nullable DecompileContext context;
    /**
     * The parameter names, once the registers are named.
     */
    public List<String> parameters = Collections.emptyList();

    public StructuredFunction(BytecodeFunction source, Sequence root, @Nullable DecompileContext context) {
        this.source = source;
        this.root = root;
        this.context = context;
    }

    void report(DiagnosticKind kind, String message, Integer... offsets) {
        if (context != null) context.report(kind, message, offsets);
    }

    @Override
    public String toString() {
        return source + ":\n" + root;
    }
}
