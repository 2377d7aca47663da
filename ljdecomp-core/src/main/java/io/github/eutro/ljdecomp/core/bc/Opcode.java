package io.github.eutro.ljdecomp.core.bc;

import static io.github.eutro.ljdecomp.core.bc.OperandMode.*;

/**
 * Every LuaJIT opcode, in LuaJIT 2.1 numbering order, with its operand modes.
 * <p>
 * An opcode with a {@link OperandMode#NONE NONE} B mode has a 16 bit D operand,
 * whose mode is {@link #cdMode}; otherwise it has B and C operands.
 *
 * @see FormatVersion#opcode(int)
 */
public enum Opcode {
    ISLT(VAR, NONE, VAR),
    ISGE(VAR, NONE, VAR),
    ISLE(VAR, NONE, VAR),
    ISGT(VAR, NONE, VAR),
    ISEQV(VAR, NONE, VAR),
    ISNEV(VAR, NONE, VAR),
    ISEQS(VAR, NONE, STR),
    ISNES(VAR, NONE, STR),
    ISEQN(VAR, NONE, NUM),
    ISNEN(VAR, NONE, NUM),
    ISEQP(VAR, NONE, PRI),
    ISNEP(VAR, NONE, PRI),
    ISTC(DST, NONE, VAR),
    ISFC(DST, NONE, VAR),
    IST(NONE, NONE, VAR),
    ISF(NONE, NONE, VAR),
    ISTYPE(VAR, NONE, LIT, true),
    ISNUM(VAR, NONE, LIT, true),
    MOV(DST, NONE, VAR),
    NOT(DST, NONE, VAR),
    UNM(DST, NONE, VAR),
    LEN(DST, NONE, VAR),
    ADDVN(DST, VAR, NUM),
    SUBVN(DST, VAR, NUM),
    MULVN(DST, VAR, NUM),
    DIVVN(DST, VAR, NUM),
    MODVN(DST, VAR, NUM),
    ADDNV(DST, VAR, NUM),
    SUBNV(DST, VAR, NUM),
    MULNV(DST, VAR, NUM),
    DIVNV(DST, VAR, NUM),
    MODNV(DST, VAR, NUM),
    ADDVV(DST, VAR, VAR),
    SUBVV(DST, VAR, VAR),
    MULVV(DST, VAR, VAR),
    DIVVV(DST, VAR, VAR),
    MODVV(DST, VAR, VAR),
    POW(DST, VAR, VAR),
    CAT(DST, RBASE, RBASE),
    KSTR(DST, NONE, STR),
    KCDATA(DST, NONE, CDATA),
    KSHORT(DST, NONE, LITS),
    KNUM(DST, NONE, NUM),
    KPRI(DST, NONE, PRI),
    KNIL(BASE, NONE, BASE),
    UGET(DST, NONE, UV),
    USETV(UV, NONE, VAR),
    USETS(UV, NONE, STR),
    USETN(UV, NONE, NUM),
    USETP(UV, NONE, PRI),
    UCLO(RBASE, NONE, JUMP),
    FNEW(DST, NONE, FUNC),
    TNEW(DST, NONE, LIT),
    TDUP(DST, NONE, TAB),
    GGET(DST, NONE, STR),
    GSET(VAR, NONE, STR),
    TGETV(DST, VAR, VAR),
    TGETS(DST, VAR, STR),
    TGETB(DST, VAR, LIT),
    TGETR(DST, VAR, VAR, true),
    TSETV(VAR, VAR, VAR),
    TSETS(VAR, VAR, STR),
    TSETB(VAR, VAR, LIT),
    TSETM(BASE, NONE, NUM),
    TSETR(VAR, VAR, VAR, true),
    CALLM(BASE, LIT, LIT),
    CALL(BASE, LIT, LIT),
    CALLMT(BASE, NONE, LIT),
    CALLT(BASE, NONE, LIT),
    ITERC(BASE, LIT, LIT),
    ITERN(BASE, LIT, LIT),
    VARG(BASE, LIT, LIT),
    ISNEXT(BASE, NONE, JUMP),
    RETM(BASE, NONE, LIT),
    RET(RBASE, NONE, LIT),
    RET0(RBASE, NONE, LIT),
    RET1(RBASE, NONE, LIT),
    FORI(BASE, NONE, JUMP),
    JFORI(BASE, NONE, JUMP),
    FORL(BASE, NONE, JUMP),
    IFORL(BASE, NONE, JUMP),
    JFORL(BASE, NONE, LIT),
    ITERL(BASE, NONE, JUMP),
    IITERL(BASE, NONE, JUMP),
    JITERL(BASE, NONE, LIT),
    LOOP(RBASE, NONE, JUMP),
    ILOOP(RBASE, NONE, JUMP),
    JLOOP(RBASE, NONE, LIT),
    JMP(RBASE, NONE, JUMP),
    FUNCF(RBASE, NONE, NONE),
    IFUNCF(RBASE, NONE, NONE),
    JFUNCF(RBASE, NONE, LIT),
    FUNCV(RBASE, NONE, NONE),
    IFUNCV(RBASE, NONE, NONE),
    JFUNCV(RBASE, NONE, LIT),
    FUNCC(RBASE, NONE, NONE),
    FUNCCW(RBASE, NONE, NONE);

    public final OperandMode aMode;
    public final OperandMode bMode;
    public final OperandMode cdMode;
    /**
     * Whether this opcode only exists from LuaJIT 2.1 on.
     */
    public final boolean only21;

    Opcode(OperandMode aMode, OperandMode bMode, OperandMode cdMode, boolean only21) {
        this.aMode = aMode;
        this.bMode = bMode;
        this.cdMode = cdMode;
        this.only21 = only21;
    }

    Opcode(OperandMode aMode, OperandMode bMode, OperandMode cdMode) {
        this(aMode, bMode, cdMode, false);
    }

    public boolean hasD() {
        return bMode == NONE;
    }

    /**
     * Whether this is a comparison or test that must be followed by a {@link #JMP}.
     *
     * @return Whether the instruction is half of a compare-and-branch pair.
     */
    public boolean isCondition() {
        return ordinal() <= ISF.ordinal();
    }

    /**
     * Whether this opcode is produced by the JIT rather than the parser, and
     * refers to a trace rather than to bytecode.
     *
     * @return Whether the opcode cannot appear in a decompilable dump.
     */
    public boolean isJitOnly() {
        switch (this) {
            case JFORL:
            case JITERL:
            case JLOOP:
            case FUNCF:
            case IFUNCF:
            case JFUNCF:
            case FUNCV:
            case IFUNCV:
            case JFUNCV:
            case FUNCC:
            case FUNCCW:
                return true;
            default:
                return false;
        }
    }
}
