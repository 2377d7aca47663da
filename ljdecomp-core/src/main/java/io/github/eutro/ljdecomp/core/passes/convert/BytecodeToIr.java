package io.github.eutro.ljdecomp.core.passes.convert;

import io.github.eutro.ljdecomp.core.bc.*;
import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.MalformedBytecodeException;
import io.github.eutro.ljdecomp.core.diag.UnsupportedOpcodeException;
import io.github.eutro.ljdecomp.core.ext.LuaExts;
import io.github.eutro.ljdecomp.core.ir.*;
import io.github.eutro.ljdecomp.core.ops.CommonOps;
import io.github.eutro.ljdecomp.core.ops.Cond;
import io.github.eutro.ljdecomp.core.ops.LuaOps;
import io.github.eutro.ljdecomp.core.passes.IRPass;
import io.github.eutro.ljdecomp.core.tree.BinOp;
import io.github.eutro.ljdecomp.core.tree.UnOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Lowers the instructions of a {@link BytecodeFunction} into IR.
 * <p>
 * Blocks start at offset 0, at every jump target and after every terminator.
 * A comparison or test and the {@link Opcode#JMP} following it become one
 * {@link LuaOps#COND} control; a jump to the {@code JMP} of such a pair is malformed.
 */
public class BytecodeToIr implements IRPass<BytecodeFunction, Function> {
    private static final Logger LOG = LoggerFactory.getLogger(BytecodeToIr.class);
    private static final TableConstant EMPTY_TABLE = new TableConstant(Collections.emptyList(), Collections.emptyMap());

    private final DecompileContext ctx;

    public BytecodeToIr(DecompileContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public Function run(BytecodeFunction bf) {
        List<Instruction> insns = bf.getInstructions();
        int n = insns.size();
        if (n == 0) throw MalformedBytecodeException.atInstruction(0, "at least one instruction");

        BitSet leaders = new BitSet(n);
        BitSet fused = new BitSet(n);
        leaders.set(0);
        for (Instruction insn : insns) {
            int pc = insn.pc;
            Opcode op = insn.opcode;
            if (op.isCondition()) {
                if (pc + 1 >= n || insns.get(pc + 1).opcode != Opcode.JMP) {
                    throw MalformedBytecodeException.atInstruction(pc, "JMP after " + op);
                }
                fused.set(pc + 1);
                leaders.set(insns.get(pc + 1).jumpTarget());
                leaders.set(Math.min(pc + 2, n));
            } else if (isBranch(op)) {
                leaders.set(insn.jumpTarget());
                leaders.set(Math.min(pc + 1, n));
            } else if (isExit(op)) {
                leaders.set(Math.min(pc + 1, n));
            }
        }
        for (int pc = fused.nextSetBit(0); pc >= 0; pc = fused.nextSetBit(pc + 1)) {
            if (leaders.get(pc)) {
                throw MalformedBytecodeException.atInstruction(pc, "no jump into the middle of a compare-and-branch pair");
            }
        }

        Function func = new Function(bf);
        func.attachExt(LuaExts.CONTEXT, ctx);
        Map<Integer, BasicBlock> blocks = new HashMap<>();
        for (int pc = leaders.nextSetBit(0); pc >= 0 && pc < n; pc = leaders.nextSetBit(pc + 1)) {
            BasicBlock bb = func.newBb(pc);
            int end = leaders.nextSetBit(pc + 1);
            bb.endOffset = end < 0 ? n : Math.min(end, n);
            blocks.put(pc, bb);
        }

        Lowerer lowerer = new Lowerer(func, bf, insns, blocks);
        for (BasicBlock bb : func.blocks) {
            lowerer.lowerBlock(bb);
        }
        LOG.debug("{}: lowered {} instructions into {} blocks", bf, n, func.blocks.size());
        return func;
    }

    private static boolean isBranch(Opcode op) {
        switch (op) {
            case JMP:
            case UCLO:
            case ISNEXT:
            case FORI:
            case JFORI:
            case FORL:
            case IFORL:
            case ITERL:
            case IITERL:
                return true;
            default:
                return false;
        }
    }

    private static boolean isExit(Opcode op) {
        switch (op) {
            case RET:
            case RET0:
            case RET1:
            case RETM:
            case CALLT:
            case CALLMT:
                return true;
            default:
                return false;
        }
    }

    private final class Lowerer {
        final Function func;
        final BytecodeFunction bf;
        final List<Instruction> insns;
        final Map<Integer, BasicBlock> blocks;
        final IRBuilder ib;
        final int frameShift;

        Lowerer(Function func, BytecodeFunction bf, List<Instruction> insns, Map<Integer, BasicBlock> blocks) {
            this.func = func;
            this.bf = bf;
            this.insns = insns;
            this.blocks = blocks;
            this.ib = new IRBuilder(func, func.blocks.get(0));
            this.frameShift = bf.twoSlotFrames ? 1 : 0;
        }

        Var r(int slot) {
            return func.register(slot);
        }

        Var k(Object value) {
            return func.constant(value);
        }

        List<Var> range(int from, int toExclusive) {
            List<Var> vars = new ArrayList<>();
            for (int i = from; i < toExclusive; i++) {
                vars.add(r(i));
            }
            return vars;
        }

        BasicBlock block(int pc) {
            BasicBlock bb = blocks.get(pc);
            if (bb == null) {
                throw MalformedBytecodeException.atInstruction(pc, "control to stay inside the function");
            }
            return bb;
        }

        void lowerBlock(BasicBlock bb) {
            ib.setBlock(bb);
            for (int pc = bb.startOffset; pc < bb.endOffset; pc++) {
                Instruction insn = insns.get(pc);
                ib.at(pc);
                if (insn.opcode.isCondition()) {
                    lowerCondition(insn, insns.get(pc + 1));
                    return;
                }
                if (lower(insn, pc == bb.startOffset)) return;
            }
            ib.insertCtrl(Control.br(block(bb.endOffset)));
        }

        void lowerCondition(Instruction insn, Instruction jmp) {
            BasicBlock taken = block(jmp.jumpTarget());
            BasicBlock fallthrough = block(insn.pc + 2);
            Cond cond;
            List<Var> args;
            switch (insn.opcode) {
                case ISLT:
                    cond = Cond.LT;
                    args = Arrays.asList(r(insn.a), r(insn.d));
                    break;
                case ISGE:
                    cond = Cond.GE;
                    args = Arrays.asList(r(insn.a), r(insn.d));
                    break;
                case ISLE:
                    cond = Cond.LE;
                    args = Arrays.asList(r(insn.a), r(insn.d));
                    break;
                case ISGT:
                    cond = Cond.GT;
                    args = Arrays.asList(r(insn.a), r(insn.d));
                    break;
                case ISEQV:
                case ISNEV:
                    cond = insn.opcode == Opcode.ISEQV ? Cond.EQ : Cond.NE;
                    args = Arrays.asList(r(insn.a), r(insn.d));
                    break;
                case ISEQS:
                case ISNES:
                    cond = insn.opcode == Opcode.ISEQS ? Cond.EQ : Cond.NE;
                    args = Arrays.asList(r(insn.a), k(bf.gcConstant(insn.d)));
                    break;
                case ISEQN:
                case ISNEN:
                    cond = insn.opcode == Opcode.ISEQN ? Cond.EQ : Cond.NE;
                    args = Arrays.asList(r(insn.a), k(bf.numConstant(insn.d)));
                    break;
                case ISEQP:
                case ISNEP:
                    cond = insn.opcode == Opcode.ISEQP ? Cond.EQ : Cond.NE;
                    args = Arrays.asList(r(insn.a), k(Primitive.values()[insn.d]));
                    break;
                case IST:
                    cond = Cond.TRUTHY;
                    args = Collections.singletonList(r(insn.d));
                    break;
                case ISF:
                    cond = Cond.FALSY;
                    args = Collections.singletonList(r(insn.d));
                    break;
                case ISTC:
                case ISFC:
                    // the copy into A is emitted before the test, on both paths
                    ib.insert(CommonOps.IDENTITY.create().insn(r(insn.d)), r(insn.a));
                    cond = insn.opcode == Opcode.ISTC ? Cond.TRUTHY : Cond.FALSY;
                    args = Collections.singletonList(r(insn.a));
                    break;
                default:
                    throw new IllegalStateException(insn.opcode + " is not a condition");
            }
            ib.insertCtrl(LuaOps.COND.create(cond).insn(args).jumpsTo(taken, fallthrough));
        }

        /**
         * Lower one instruction that is not half of a compare-and-branch pair.
         *
         * @return Whether the instruction ended the block.
         */
        boolean lower(Instruction insn, boolean first) {
            int a = insn.a, b = insn.b, c = insn.c, d = insn.d, pc = insn.pc;
            if (insn.opcode.isJitOnly()) {
                throw new UnsupportedOpcodeException(ctx.version.number(insn.opcode), pc,
                        insn.opcode + " only appears in JIT-compiled or native functions");
            }
            switch (insn.opcode) {
                case ISTYPE:
                case ISNUM:
                    return false;

                case MOV:
                    ib.insert(CommonOps.IDENTITY.create().insn(r(d)), r(a));
                    return false;
                case NOT:
                    unary(a, UnOp.NOT, d);
                    return false;
                case UNM:
                    unary(a, UnOp.NEG, d);
                    return false;
                case LEN:
                    unary(a, UnOp.LEN, d);
                    return false;

                case ADDVN:
                case SUBVN:
                case MULVN:
                case DIVVN:
                case MODVN:
                    arith(a, arithOp(insn.opcode), r(b), k(bf.numConstant(c)));
                    return false;
                case ADDNV:
                case SUBNV:
                case MULNV:
                case DIVNV:
                case MODNV:
                    arith(a, arithOp(insn.opcode), k(bf.numConstant(c)), r(b));
                    return false;
                case ADDVV:
                case SUBVV:
                case MULVV:
                case DIVVV:
                case MODVV:
                case POW:
                    arith(a, arithOp(insn.opcode), r(b), r(c));
                    return false;
                case CAT:
                    ib.insert(LuaOps.CONCAT.create().insn(range(b, c + 1)), r(a));
                    return false;

                case KSTR:
                case KCDATA:
                    ib.insert(CommonOps.constant(bf.gcConstant(d)), r(a));
                    return false;
                case KSHORT:
                    ib.insert(CommonOps.constant(insn.lits()), r(a));
                    return false;
                case KNUM:
                    ib.insert(CommonOps.constant(bf.numConstant(d)), r(a));
                    return false;
                case KPRI:
                    ib.insert(CommonOps.constant(Primitive.values()[d]), r(a));
                    return false;
                case KNIL:
                    ib.insert(CommonOps.constant(Primitive.NIL), range(a, d + 1));
                    return false;

                case UGET:
                    ib.insert(LuaOps.UGET.create(d).insn(), r(a));
                    return false;
                case USETV:
                    ib.insert(LuaOps.USET.create(a).insn(r(d)));
                    return false;
                case USETS:
                    ib.insert(LuaOps.USET.create(a).insn(k(bf.gcConstant(d))));
                    return false;
                case USETN:
                    ib.insert(LuaOps.USET.create(a).insn(k(bf.numConstant(d))));
                    return false;
                case USETP:
                    ib.insert(LuaOps.USET.create(a).insn(k(Primitive.values()[d])));
                    return false;

                case FNEW:
                    ib.insert(LuaOps.CLOSURE.create((BytecodeFunction) bf.gcConstant(d)).insn(), r(a));
                    return false;
                case TNEW:
                    ib.insert(LuaOps.NEW_TABLE.create(EMPTY_TABLE).insn(), r(a));
                    return false;
                case TDUP:
                    ib.insert(LuaOps.NEW_TABLE.create((TableConstant) bf.gcConstant(d)).insn(), r(a));
                    return false;
                case GGET:
                    ib.insert(LuaOps.GGET.create((String) bf.gcConstant(d)).insn(), r(a));
                    return false;
                case GSET:
                    ib.insert(LuaOps.GSET.create((String) bf.gcConstant(d)).insn(r(a)));
                    return false;

                case TGETV:
                case TGETR:
                    index(a, r(b), r(c));
                    return false;
                case TGETS:
                    index(a, r(b), k(bf.gcConstant(c)));
                    return false;
                case TGETB:
                    index(a, r(b), k(c));
                    return false;
                case TSETV:
                case TSETR:
                    newIndex(r(b), r(c), a);
                    return false;
                case TSETS:
                    newIndex(r(b), k(bf.gcConstant(c)), a);
                    return false;
                case TSETB:
                    newIndex(r(b), k(c), a);
                    return false;
                case TSETM:
                    ib.insert(LuaOps.SET_LIST.create(setListStart(bf.numConstant(d))).insn(r(a - 1), func.multres()));
                    return false;

                case CALLM:
                    call(a, b, args(a, c, true));
                    return false;
                case CALL:
                    call(a, b, args(a, c - 1, false));
                    return false;
                case CALLMT:
                    tailCall(a, args(a, d, true));
                    return true;
                case CALLT:
                    tailCall(a, args(a, d - 1, false));
                    return true;
                case ITERC:
                case ITERN:
                    ib.insert(LuaOps.CALL.create().insn(r(a - 3), r(a - 2), r(a - 1)), range(a, a + b - 1));
                    return false;
                case VARG:
                    ib.insert(LuaOps.VARARG.create().insn(), results(a, b));
                    return false;

                case RETM: {
                    List<Var> values = range(a, a + d);
                    values.add(func.multres());
                    ib.insertCtrl(CommonOps.RETURN.create().insn(values).jumpsTo());
                    return true;
                }
                case RET:
                    ib.insertCtrl(CommonOps.RETURN.create().insn(range(a, a + d - 1)).jumpsTo());
                    return true;
                case RET0:
                    ib.insertCtrl(CommonOps.RETURN.create().insn().jumpsTo());
                    return true;
                case RET1:
                    ib.insertCtrl(CommonOps.RETURN.create().insn(r(a)).jumpsTo());
                    return true;

                case JMP:
                case UCLO:
                case ISNEXT:
                    ib.insertCtrl(Control.br(block(insn.jumpTarget())));
                    return true;
                case FORI:
                case JFORI:
                    ib.insertCtrl(LuaOps.FOR_PREP.create(a).insn(r(a), r(a + 1), r(a + 2))
                            .jumpsTo(block(pc + 1), block(insn.jumpTarget())));
                    return true;
                case FORL:
                case IFORL:
                    ib.insertCtrl(LuaOps.FOR_LOOP.create(a).insn()
                            .jumpsTo(block(insn.jumpTarget()), block(pc + 1)));
                    return true;
                case ITERL:
                case IITERL:
                    ib.insertCtrl(LuaOps.ITER_LOOP.create(a).insn()
                            .jumpsTo(block(insn.jumpTarget()), block(pc + 1)));
                    return true;
                case LOOP:
                case ILOOP:
                    if (first) ib.getBlock().attachExt(LuaExts.LOOP_MARKER, pc);
                    return false;

                default:
                    throw new IllegalStateException("unhandled opcode " + insn.opcode);
            }
        }

        void unary(int dst, UnOp op, int src) {
            ib.insert(LuaOps.UNARY.create(op).insn(r(src)), r(dst));
        }

        void arith(int dst, BinOp op, Var lhs, Var rhs) {
            ib.insert(LuaOps.ARITH.create(op).insn(lhs, rhs), r(dst));
        }

        void index(int dst, Var table, Var key) {
            ib.insert(LuaOps.INDEX.create().insn(table, key), r(dst));
        }

        void newIndex(Var table, Var key, int src) {
            ib.insert(LuaOps.NEWINDEX.create().insn(table, key, r(src)));
        }

        List<Var> args(int base, int fixed, boolean multres) {
            List<Var> args = new ArrayList<>();
            args.add(r(base));
            int first = base + 1 + frameShift;
            args.addAll(range(first, first + fixed));
            if (multres) args.add(func.multres());
            return args;
        }

        List<Var> results(int base, int b) {
            return b == 0 ? Collections.singletonList(func.multres()) : range(base, base + b - 1);
        }

        void call(int base, int b, List<Var> args) {
            ib.insert(LuaOps.CALL.create().insn(args), results(base, b));
        }

        void tailCall(int base, List<Var> args) {
            ib.insert(LuaOps.CALL.create().insn(args), func.multres());
            ib.insertCtrl(CommonOps.RETURN.create().insn(func.multres()).jumpsTo());
        }
    }

    private static int setListStart(Object constant) {
        if (constant instanceof Double) {
            // biased integer, the index is in the low word
            return (int) Double.doubleToRawLongBits((Double) constant);
        }
        return ((Number) constant).intValue();
    }

    private static BinOp arithOp(Opcode op) {
        switch (op) {
            case ADDVN:
            case ADDNV:
            case ADDVV:
                return BinOp.ADD;
            case SUBVN:
            case SUBNV:
            case SUBVV:
                return BinOp.SUB;
            case MULVN:
            case MULNV:
            case MULVV:
                return BinOp.MUL;
            case DIVVN:
            case DIVNV:
            case DIVVV:
                return BinOp.DIV;
            case MODVN:
            case MODNV:
            case MODVV:
                return BinOp.MOD;
            case POW:
                return BinOp.POW;
            default:
                throw new IllegalArgumentException(op + " is not arithmetic");
        }
    }
}
