package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.bc.Primitive;
import io.github.eutro.ljdecomp.core.bc.VariableInfo;
import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.*;
import io.github.eutro.ljdecomp.core.tree.Trees;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Decides where each local is declared.
 * <p>
 * A debug variable is declared by the statement that computes its initial value. Anything else,
 * including slots without debug names, is declared in the innermost sequence enclosing all of its
 * uses, outside any loop it carries a value around.
 * <p>
 * A goto may not jump into the scope of a local, so in a sequence of labeled blocks every local
 * declared from the first goto or label onwards is declared once before it instead.
 */
final class LocalDeclarations {
    private final SlotNames names;
    private final Set<Object> declared = new HashSet<>();

    LocalDeclarations(SlotNames names) {
        this.names = names;
    }

    void run(StructuredFunction fn) {
        declareInitialized(fn.root);
        declareEnclosing(fn);
        mergeAdjacent(fn.root);
        hoistAboveLabels(fn.root);
    }

    /**
     * @return The debug variable, or the slot number when there is none, or null for parameters.
     */
    private @Nullable Object binding(Expr.Register reg) {
        VariableInfo variable = names.resolve(reg);
        if (variable != null) {
            return variable.startPc == 0 && names.isParameter(variable.slot) ? null : variable;
        }
        return names.isParameter(reg.slot) ? null : (Object) reg.slot;
    }

    private void declareInitialized(Sequence seq) {
        for (int i = 0; i < seq.nodes.size(); i++) {
            StructuredNode node = seq.nodes.get(i);
            switch (node.kind()) {
                case EXPR_STATEMENT:
                    if (declareAt(seq, i, (ExprStatement) node)) i++;
                    break;
                case NUMERIC_FOR:
                    markLoopVariable(((NumericFor) node).variable);
                    break;
                case GENERIC_FOR:
                    for (Expr variable : ((GenericFor) node).variables) {
                        markLoopVariable(variable);
                    }
                    break;
                default:
                    break;
            }
            for (StructuredNode child : node.children()) {
                declareInitialized((Sequence) child);
            }
        }
    }

    private void markLoopVariable(Expr variable) {
        if (!(variable instanceof Expr.Register)) return;
        VariableInfo info = names.resolve((Expr.Register) variable);
        if (info != null) declared.add(info);
    }

    /**
     * @return Whether a declaration was inserted before the statement.
     */
    private boolean declareAt(Sequence seq, int index, ExprStatement stmt) {
        if (stmt.spread || stmt.localDeclaration) return false;
        List<Expr> initialized = new ArrayList<>();
        List<VariableInfo> variables = new ArrayList<>();
        boolean all = true;
        for (Expr target : stmt.targets) {
            VariableInfo variable = target instanceof Expr.Register
                    ? names.initializedBy((Expr.Register) target)
                    : null;
            if (variable == null || declared.contains(variable) || variables.contains(variable)) {
                all = false;
            } else {
                initialized.add(target);
                variables.add(variable);
            }
        }
        if (variables.isEmpty()) return false;
        declared.addAll(variables);
        if (all) {
            stmt.localDeclaration = true;
            if (allNil(stmt.values)) stmt.values = new ArrayList<>();
            return false;
        }
        ExprStatement declaration = new ExprStatement(initialized, Collections.emptyList(), stmt.pc);
        declaration.localDeclaration = true;
        seq.nodes.add(index, declaration);
        return true;
    }

    private static boolean allNil(List<Expr> values) {
        if (values.isEmpty()) return false;
        for (Expr value : values) {
            if (!(value instanceof Expr.Constant) || ((Expr.Constant) value).value != Primitive.NIL) return false;
        }
        return true;
    }

    private static final class Frame {
        final Sequence seq;
        final int index;

        Frame(Sequence seq, int index) {
            this.seq = seq;
            this.index = index;
        }

        boolean same(Frame other) {
            return seq == other.seq && index == other.index;
        }
    }

    private static final class Uses {
        final int slot;
        final List<List<Frame>> paths = new ArrayList<>();

        Uses(int slot) {
            this.slot = slot;
        }
    }

    private void declareEnclosing(StructuredFunction fn) {
        Map<Object, Uses> uses = new LinkedHashMap<>();
        collectUses(fn.root, new ArrayList<>(), new HashSet<>(), uses);
        TreeLiveness liveness = TreeLiveness.compute(fn.root);

        Map<Sequence, List<Frame>> declarations = new IdentityHashMap<>();
        Map<Frame, List<Object>> bindingsAt = new IdentityHashMap<>();
        for (Map.Entry<Object, Uses> entry : uses.entrySet()) {
            if (declared.contains(entry.getKey())) continue;
            List<Frame> path = enclosing(entry.getValue().paths);
            int depth = path.size() - 1;
            while (depth > 0
                    && path.get(depth - 1).seq.nodes.get(path.get(depth - 1).index).isLoop()
                    && liveness.liveIn(path.get(depth).seq).get(entry.getValue().slot)) {
                depth--;
            }
            Frame at = path.get(depth);
            declarations.computeIfAbsent(at.seq, k -> new ArrayList<>()).add(at);
            bindingsAt.computeIfAbsent(at, k -> new ArrayList<>()).add(entry.getKey());
        }

        for (List<Frame> frames : declarations.values()) {
            frames.sort((a, b) -> Integer.compare(b.index, a.index));
            for (Frame frame : frames) {
                for (Object binding : bindingsAt.get(frame)) {
                    declare(frame.seq, frame.index, binding, uses.get(binding).slot);
                }
            }
        }
    }

    private void declare(Sequence seq, int index, Object binding, int slot) {
        StructuredNode node = seq.nodes.get(index);
        ExprStatement stmt = Statements.single(node);
        if (stmt != null
                && stmt.targets.get(0) instanceof Expr.Register
                && Objects.equals(binding((Expr.Register) stmt.targets.get(0)), binding)
                && Statements.countReads(stmt.values.get(0), slot) == 0) {
            stmt.localDeclaration = true;
            return;
        }
        String name = binding instanceof VariableInfo
                ? ((VariableInfo) binding).name
                : SlotNames.syntheticName(slot);
        ExprStatement declaration = new ExprStatement(
                Collections.singletonList(new Expr.Local(name, slot)),
                Collections.emptyList(),
                stmt == null ? -1 : stmt.pc);
        declaration.localDeclaration = true;
        seq.nodes.add(index, declaration);
    }

    private static List<Frame> enclosing(List<List<Frame>> paths) {
        List<Frame> first = paths.get(0);
        int common = 0;
        outer:
        while (common < first.size()) {
            for (List<Frame> path : paths) {
                if (path.size() <= common || !path.get(common).same(first.get(common))) break outer;
            }
            common++;
        }
        List<Frame> result = new ArrayList<>(first.subList(0, Math.min(common, first.size())));
        boolean sameSeq = common < first.size();
        int lowest = Integer.MAX_VALUE;
        for (List<Frame> path : paths) {
            if (path.size() <= common || path.get(common).seq != first.get(common).seq) {
                sameSeq = false;
                break;
            }
            lowest = Math.min(lowest, path.get(common).index);
        }
        if (sameSeq) {
            result.add(new Frame(first.get(common).seq, lowest));
        } else if (result.isEmpty()) {
            result.add(first.get(0));
        }
        return result;
    }

    private void collectUses(Sequence seq, List<Frame> path, Set<Object> loopBound, Map<Object, Uses> uses) {
        for (int i = 0; i < seq.nodes.size(); i++) {
            StructuredNode node = seq.nodes.get(i);
            List<Frame> here = new ArrayList<>(path);
            here.add(new Frame(seq, i));
            List<Expr> exprs = new ArrayList<>(node.exprs());
            if (node instanceof ExprStatement) {
                for (Expr target : ((ExprStatement) node).targets) {
                    if (!(target instanceof Expr.Index)) exprs.add(target);
                }
            }
            for (Expr expr : exprs) {
                expr.forEach(e -> {
                    if (!(e instanceof Expr.Register)) return;
                    Object binding = binding((Expr.Register) e);
                    if (binding == null || loopBound.contains(binding)) return;
                    uses.computeIfAbsent(binding, k -> new Uses(((Expr.Register) e).slot)).paths.add(here);
                });
            }
            Set<Object> inner = loopBound;
            if (node instanceof NumericFor || node instanceof GenericFor) {
                inner = new HashSet<>(loopBound);
                List<Expr> variables = node instanceof NumericFor
                        ? Collections.singletonList(((NumericFor) node).variable)
                        : ((GenericFor) node).variables;
                for (Expr variable : variables) {
                    if (variable instanceof Expr.Register) {
                        Object binding = binding((Expr.Register) variable);
                        if (binding != null) inner.add(binding);
                    }
                }
            }
            for (StructuredNode child : node.children()) {
                collectUses((Sequence) child, here, inner, uses);
            }
        }
    }

    private void mergeAdjacent(Sequence seq) {
        for (int i = 0; i + 1 < seq.nodes.size(); i++) {
            if (mergeable(seq.nodes.get(i), seq.nodes.get(i + 1))) {
                ExprStatement first = (ExprStatement) seq.nodes.get(i);
                ExprStatement second = (ExprStatement) seq.nodes.remove(i + 1);
                first.targets.addAll(second.targets);
                first.values.addAll(second.values);
                i--;
            }
        }
        for (StructuredNode node : seq.nodes) {
            for (StructuredNode child : node.children()) {
                mergeAdjacent((Sequence) child);
            }
        }
    }

    private boolean mergeable(StructuredNode a, StructuredNode b) {
        if (!(a instanceof ExprStatement) || !(b instanceof ExprStatement)) return false;
        ExprStatement first = (ExprStatement) a, second = (ExprStatement) b;
        if (!first.localDeclaration || !second.localDeclaration
                || first.targets.size() != first.values.size()
                || second.targets.size() != second.values.size()) {
            return false;
        }
        int start = -1;
        List<Expr> targets = new ArrayList<>(first.targets);
        targets.addAll(second.targets);
        for (Expr target : targets) {
            if (!(target instanceof Expr.Register)) return false;
            VariableInfo variable = names.resolve((Expr.Register) target);
            if (variable == null || start >= 0 && variable.startPc != start) return false;
            start = variable.startPc;
        }
        for (Expr target : first.targets) {
            int slot = ((Expr.Register) target).slot;
            for (Expr value : second.values) {
                if (Statements.countReads(value, slot) != 0) return false;
            }
        }
        return true;
    }

    private void hoistAboveLabels(Sequence seq) {
        hoistNested(seq);
        boolean labeled = false;
        int first = -1;
        for (int i = 0; i < seq.nodes.size(); i++) {
            StructuredNode node = seq.nodes.get(i);
            if (node.kind() == StructuredNode.Kind.BLOCK) labeled = true;
            if (first < 0 && (node.kind() == StructuredNode.Kind.BLOCK || containsGoto(node))) first = i;
        }
        if (!labeled) return;

        List<Expr> hoisted = new ArrayList<>();
        List<Object> keys = new ArrayList<>();
        int pc = undeclare(seq, first, hoisted, keys);
        if (hoisted.isEmpty()) return;
        ExprStatement declaration = new ExprStatement(hoisted, new ArrayList<>(), pc);
        declaration.localDeclaration = true;
        seq.nodes.add(first, declaration);
    }

    /**
     * Process the sequences nested in statements; labeled block bodies share the scope of their parent.
     */
    private void hoistNested(Sequence seq) {
        for (StructuredNode node : seq.nodes) {
            if (node.kind() == StructuredNode.Kind.BLOCK) {
                hoistNested(((Block) node).body);
                continue;
            }
            for (StructuredNode child : node.children()) {
                hoistAboveLabels((Sequence) child);
            }
        }
    }

    /**
     * Turn the declarations of a sequence and of the labeled blocks in it into plain assignments.
     *
     * @return The offset of the first declaration, or -1.
     */
    private int undeclare(Sequence seq, int from, List<Expr> hoisted, List<Object> keys) {
        int pc = -1;
        for (int i = from; i < seq.nodes.size(); i++) {
            StructuredNode node = seq.nodes.get(i);
            if (node.kind() == StructuredNode.Kind.BLOCK) {
                int inner = undeclare(((Block) node).body, 0, hoisted, keys);
                if (pc < 0) pc = inner;
                continue;
            }
            if (!(node instanceof ExprStatement) || !((ExprStatement) node).localDeclaration) continue;
            ExprStatement stmt = (ExprStatement) node;
            for (Expr target : stmt.targets) {
                Object key = target instanceof Expr.Register
                        ? binding((Expr.Register) target)
                        : target instanceof Expr.Local ? ((Expr.Local) target).name : target;
                // parameters are already in scope
                if (key != null && !keys.contains(key)) {
                    keys.add(key);
                    hoisted.add(target);
                }
            }
            if (pc < 0) pc = stmt.pc;
            stmt.localDeclaration = false;
            if (stmt.values.isEmpty()) seq.nodes.remove(i--);
        }
        return pc;
    }

    private static boolean containsGoto(StructuredNode node) {
        boolean[] found = {false};
        Trees.forEachNode(node, n -> {
            if (n.kind() == StructuredNode.Kind.GOTO) found[0] = true;
        });
        return found[0];
    }
}
