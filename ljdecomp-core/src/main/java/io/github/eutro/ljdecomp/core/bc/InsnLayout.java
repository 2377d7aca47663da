package io.github.eutro.ljdecomp.core.bc;

/**
 * Bit positions of the fields of a 32 bit instruction word.
 */
public final class InsnLayout {
    /**
     * {@code B:8 C:8 A:8 OP:8} from most to least significant, with D overlapping B and C.
     */
    public static final InsnLayout STANDARD = new InsnLayout(0, 8, 8, 24, 16, 16);

    private final int opShift, aShift, aBits, bShift, cShift, dShift;

    private InsnLayout(int opShift, int aShift, int aBits, int bShift, int cShift, int dShift) {
        this.opShift = opShift;
        this.aShift = aShift;
        this.aBits = aBits;
        this.bShift = bShift;
        this.cShift = cShift;
        this.dShift = dShift;
    }

    public int op(int word) {
        return (word >>> opShift) & 0xff;
    }

    public int a(int word) {
        return (word >>> aShift) & ((1 << aBits) - 1);
    }

    public int b(int word) {
        return (word >>> bShift) & 0xff;
    }

    public int c(int word) {
        return (word >>> cShift) & 0xff;
    }

    public int d(int word) {
        return (word >>> dShift) & 0xffff;
    }

    /**
     * Pack fields into a word, the inverse of the accessors.
     *
     * @param op The opcode number.
     * @param a  The A operand.
     * @param b  The B operand.
     * @param c  The C operand.
     * @return The word.
     */
    public int encodeABC(int op, int a, int b, int c) {
        return (op << opShift) | (a << aShift) | (b << bShift) | (c << cShift);
    }

    public int encodeAD(int op, int a, int d) {
        return (op << opShift) | (a << aShift) | (d << dShift);
    }
}
