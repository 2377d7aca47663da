package io.github.eutro.ljdecomp.core.bc;

/**
 * Header and prototype flag bits.
 */
public final class DumpFlags {
    private DumpFlags() {
    }

    public static final int BE = 0x01;
    public static final int STRIP = 0x02;
    public static final int FFI = 0x04;
    /** Two-slot frame info, LuaJIT 2.1 in GC64 mode. */
    public static final int FR2 = 0x08;

    public static final int PROTO_CHILD = 0x01;
    public static final int PROTO_VARARG = 0x02;
    public static final int PROTO_FFI = 0x04;
    public static final int PROTO_NOJIT = 0x08;
    public static final int PROTO_ILOOP = 0x10;
}
