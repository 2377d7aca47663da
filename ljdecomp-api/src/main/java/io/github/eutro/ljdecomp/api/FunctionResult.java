package io.github.eutro.ljdecomp.api;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.diag.Diagnostic;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome for one function of a dump.
 */
public final class FunctionResult {
    public final BytecodeFunction function;
    /**
     * The decompiled body, or null if the function failed; its diagnostics say why.
     */
    public final @Nullable StructuredNode.Sequence tree;
    public final List<String> parameters;
    public final List<Diagnostic> diagnostics;

    public FunctionResult(
            BytecodeFunction function,
            @Nullable StructuredNode.Sequence tree,
            List<String> parameters,
            List<Diagnostic> diagnostics
    ) {
        this.function = function;
        this.tree = tree;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public boolean isSuccess() {
        return tree != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(function).append('(').append(String.join(", ", parameters));
        if (function.isVararg()) sb.append(parameters.isEmpty() ? "..." : ", ...");
        sb.append(')');
        for (Diagnostic diagnostic : diagnostics) {
            sb.append("\n-- ").append(diagnostic);
        }
        sb.append('\n').append(tree == null ? "-- no tree" : tree.toString());
        return sb.toString();
    }
}
