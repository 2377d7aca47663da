package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.bc.VariableInfo;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.GenericFor;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.NumericFor;
import io.github.eutro.ljdecomp.core.tree.Trees;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Replaces every register with the local it names.
 */
final class Materializer {
    private final SlotNames names;
    private final StructuredFunction fn;
    private final BitSet reported = new BitSet();

    Materializer(SlotNames names, StructuredFunction fn) {
        this.names = names;
        this.fn = fn;
    }

    void run() {
        Trees.forEachNode(fn.root, this::materialize);
        List<String> parameters = new ArrayList<>(fn.source.numParams);
        for (int slot = 0; slot < fn.source.numParams; slot++) {
            VariableInfo variable = names.variableAt(slot, 0);
            parameters.add(variable == null ? SlotNames.syntheticName(slot) : variable.name);
        }
        fn.parameters = parameters;
    }

    private void materialize(StructuredNode node) {
        switch (node.kind()) {
            case EXPR_STATEMENT: {
                ExprStatement stmt = (ExprStatement) node;
                List<Expr> targets = new ArrayList<>(stmt.targets.size());
                for (Expr target : stmt.targets) {
                    targets.add(target instanceof Expr.Index ? target : name(target));
                }
                stmt.targets = targets;
                break;
            }
            case NUMERIC_FOR:
                ((NumericFor) node).variable = name(((NumericFor) node).variable);
                break;
            case GENERIC_FOR: {
                GenericFor loop = (GenericFor) node;
                List<Expr> variables = new ArrayList<>(loop.variables.size());
                for (Expr variable : loop.variables) {
                    variables.add(name(variable));
                }
                loop.variables = variables;
                break;
            }
            default:
                break;
        }
        node.rewriteExprs(e -> e.rewrite(this::name));
    }

    private Expr name(Expr expr) {
        if (!(expr instanceof Expr.Register)) return expr;
        Expr.Register reg = (Expr.Register) expr;
        VariableInfo variable = names.resolve(reg);
        if (variable != null) return new Expr.Local(variable.name, reg.slot);
        if (names.hasDebugInfo() && !reported.get(reg.slot)) {
            reported.set(reg.slot);
            fn.report(DiagnosticKind.UNRESOLVED_DEBUG_NAME,
                    "no debug name for slot " + reg.slot + " at " + reg.pc,
                    reg.pc);
        }
        return new Expr.Local(SlotNames.syntheticName(reg.slot), reg.slot);
    }
}
