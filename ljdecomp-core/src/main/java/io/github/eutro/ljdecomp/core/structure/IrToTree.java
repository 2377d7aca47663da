package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.bc.Primitive;
import io.github.eutro.ljdecomp.core.bc.TableConstant;
import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ext.LuaExts;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.ir.Control;
import io.github.eutro.ljdecomp.core.ir.Effect;
import io.github.eutro.ljdecomp.core.ir.Var;
import io.github.eutro.ljdecomp.core.ops.*;
import io.github.eutro.ljdecomp.core.tree.BinOp;
import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Return;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import io.github.eutro.ljdecomp.core.tree.UnOp;

import java.util.*;
import java.util.function.Function;

/**
 * Turns the straight-line content of blocks into statements over raw registers.
 */
final class IrToTree {
    private final BytecodeFunction source;

    IrToTree(BytecodeFunction source) {
        this.source = source;
    }

    private static int pcOf(Effect effect) {
        Integer pc = effect.getNullable(LuaExts.PC);
        return pc == null ? -1 : pc;
    }

    private static int pcOf(Control ctrl) {
        Integer pc = ctrl.getNullable(LuaExts.PC);
        return pc == null ? -1 : pc;
    }

    Expr read(Var var, int pc) {
        switch (var.kind) {
            case REGISTER:
                return new Expr.Register(var.slot, pc);
            case CONSTANT:
                return constant(var.getExtOrThrow(CommonExts.CONSTANT_VALUE));
            default:
                return new Expr.MultRes();
        }
    }

    private List<Expr> reads(List<Var> vars, int pc) {
        List<Expr> exprs = new ArrayList<>(vars.size());
        for (Var var : vars) {
            exprs.add(read(var, pc));
        }
        return exprs;
    }

    static Expr constant(Object value) {
        if (value instanceof TableConstant) return table((TableConstant) value);
        return new Expr.Constant(value);
    }

    /**
     * Convert a template to a constructor. Trailing nils of the array part only
     * reserve space for values stored after the table is created.
     */
    static Expr.TableConstructor table(TableConstant template) {
        List<Expr.TableConstructor.Entry> entries = new ArrayList<>();
        List<Object> array = template.array;
        int end = array.size();
        while (end > 1 && array.get(end - 1) == Primitive.NIL) end--;
        if (!array.isEmpty() && array.get(0) != Primitive.NIL) {
            entries.add(new Expr.TableConstructor.Entry(new Expr.Constant(0), constant(array.get(0))));
        }
        for (int i = 1; i < end; i++) {
            entries.add(new Expr.TableConstructor.Entry(null, constant(array.get(i))));
        }
        for (Map.Entry<Object, Object> entry : template.hash.entrySet()) {
            if (entry.getValue() == Primitive.NIL) continue;
            entries.add(new Expr.TableConstructor.Entry(constant(entry.getKey()), constant(entry.getValue())));
        }
        return new Expr.TableConstructor(entries);
    }

    Sequence body(BasicBlock bb) {
        Sequence seq = new Sequence();
        for (Effect effect : bb.getEffects()) {
            seq.append(statement(effect));
        }
        return seq;
    }

    private ExprStatement statement(Effect effect) {
        int pc = pcOf(effect);
        Op op = effect.insn().op;
        OpKey key = op.key;
        List<Expr> args = reads(effect.insn().args(), pc);
        List<Expr> targets = reads(effect.getAssignsTo(), pc);
        Expr value;
        if (key == CommonOps.IDENTITY) {
            return new ExprStatement(targets, args, pc);
        } else if (key == CommonOps.CONST) {
            value = constant(CommonOps.CONST.cast(op).arg);
        } else if (key == LuaOps.ARITH) {
            value = new Expr.Binary(LuaOps.ARITH.cast(op).arg, args.get(0), args.get(1));
        } else if (key == LuaOps.UNARY) {
            value = new Expr.Unary(LuaOps.UNARY.cast(op).arg, args.get(0));
        } else if (key == LuaOps.CONCAT) {
            value = args.get(args.size() - 1);
            for (int i = args.size() - 2; i >= 0; i--) {
                value = new Expr.Binary(BinOp.CONCAT, args.get(i), value);
            }
        } else if (key == LuaOps.UGET) {
            value = upvalue(LuaOps.UGET.cast(op).arg);
        } else if (key == LuaOps.USET) {
            return ExprStatement.assign(upvalue(LuaOps.USET.cast(op).arg), args.get(0), pc);
        } else if (key == LuaOps.GGET) {
            value = new Expr.Global(LuaOps.GGET.cast(op).arg);
        } else if (key == LuaOps.GSET) {
            return ExprStatement.assign(new Expr.Global(LuaOps.GSET.cast(op).arg), args.get(0), pc);
        } else if (key == LuaOps.INDEX) {
            value = new Expr.Index(args.get(0), args.get(1));
        } else if (key == LuaOps.NEWINDEX) {
            return ExprStatement.assign(new Expr.Index(args.get(0), args.get(1)), args.get(2), pc);
        } else if (key == LuaOps.NEW_TABLE) {
            value = table(LuaOps.NEW_TABLE.cast(op).arg);
        } else if (key == LuaOps.CLOSURE) {
            value = new Expr.Closure(LuaOps.CLOSURE.cast(op).arg);
        } else if (key == LuaOps.CALL) {
            value = new Expr.Call(args.get(0), args.subList(1, args.size()), false);
        } else if (key == LuaOps.VARARG) {
            value = new Expr.Vararg();
        } else if (key == LuaOps.SET_LIST) {
            Expr slot = new Expr.Index(args.get(0), new Expr.Constant(LuaOps.SET_LIST.cast(op).arg));
            ExprStatement store = ExprStatement.assign(slot, args.get(1), pc);
            store.spread = true;
            return store;
        } else {
            throw new IllegalStateException("cannot convert " + effect);
        }
        return new ExprStatement(targets, Collections.singletonList(value), pc);
    }

    private Expr upvalue(int index) {
        String name = source.upvalueName(index);
        return new Expr.Upvalue(index, name == null ? "upvalue" + index : name);
    }

    /**
     * Convert a block's terminator, appending a return to the body if it is one.
     *
     * @param bb     The block.
     * @param body   The block's converted body.
     * @param target Where each successor block goes.
     * @return The exit.
     */
    Exit exit(BasicBlock bb, Sequence body, Function<BasicBlock, Target> target) {
        Control ctrl = bb.getControl();
        int pc = pcOf(ctrl);
        Op op = ctrl.insn().op;
        List<BasicBlock> targets = ctrl.targets;
        if (op.key == CommonOps.RETURN) {
            body.append(new Return(reads(ctrl.insn().args(), pc), pc));
            return Exit.terminal();
        } else if (op.key == CommonOps.BR) {
            return Exit.jump(target.apply(targets.get(0)));
        } else if (op.key == LuaOps.COND) {
            return Exit.cond(condition(LuaOps.COND.cast(op).arg, reads(ctrl.insn().args(), pc)),
                    target.apply(targets.get(0)),
                    target.apply(targets.get(1)));
        } else if (op.key == LuaOps.FOR_PREP) {
            return Exit.loop(Exit.Kind.FOR_PREP, LuaOps.FOR_PREP.cast(op).arg, pc,
                    target.apply(targets.get(0)), target.apply(targets.get(1)));
        } else if (op.key == LuaOps.FOR_LOOP) {
            return Exit.loop(Exit.Kind.FOR_LOOP, LuaOps.FOR_LOOP.cast(op).arg, pc,
                    target.apply(targets.get(0)), target.apply(targets.get(1)));
        } else if (op.key == LuaOps.ITER_LOOP) {
            return Exit.loop(Exit.Kind.ITER_LOOP, LuaOps.ITER_LOOP.cast(op).arg, pc,
                    target.apply(targets.get(0)), target.apply(targets.get(1)));
        }
        throw new IllegalStateException("cannot convert " + ctrl);
    }

    static Expr condition(Cond cond, List<Expr> args) {
        switch (cond) {
            case TRUTHY:
                return args.get(0);
            case FALSY:
                return new Expr.Unary(UnOp.NOT, args.get(0));
            default:
                return new Expr.Binary(Objects.requireNonNull(cond.op), args.get(0), args.get(1));
        }
    }
}
