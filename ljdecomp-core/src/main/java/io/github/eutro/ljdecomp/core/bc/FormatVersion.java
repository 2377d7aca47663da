package io.github.eutro.ljdecomp.core.bc;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The bytecode dump formats that can be read.
 * <p>
 * The format must be chosen by the caller; the dump header is only checked against it.
 */
public enum FormatVersion {
    /**
     * LuaJIT 2.0.x, dump version 1.
     */
    LUAJIT_2_0(1, DumpFlags.BE | DumpFlags.STRIP | DumpFlags.FFI, false),
    /**
     * LuaJIT 2.1, dump version 2, with {@code ISTYPE}, {@code ISNUM},
     * {@code TGETR} and {@code TSETR} inserted into the opcode numbering.
     */
    LUAJIT_2_1(2, DumpFlags.BE | DumpFlags.STRIP | DumpFlags.FFI | DumpFlags.FR2, true),
    ;

    /**
     * The version byte following the magic in the dump header.
     */
    public final int dumpVersion;
    /**
     * The header flags this version may set.
     */
    public final int knownFlags;
    /**
     * How instruction words split into fields. Both versions use {@code B:8 C:8 A:8 OP:8}, with D over B and C.
     */
    public final InsnLayout layout = InsnLayout.STANDARD;
    private final Opcode[] byNumber;
    private final Map<Opcode, Integer> numbers = new EnumMap<>(Opcode.class);

    FormatVersion(int dumpVersion, int knownFlags, boolean has21Opcodes) {
        this.dumpVersion = dumpVersion;
        this.knownFlags = knownFlags;
        List<Opcode> order = new ArrayList<>();
        for (Opcode opcode : Opcode.values()) {
            if (has21Opcodes || !opcode.only21) {
                order.add(opcode);
            }
        }
        byNumber = order.toArray(new Opcode[0]);
        for (int i = 0; i < byNumber.length; i++) {
            numbers.put(byNumber[i], i);
        }
    }

    /**
     * Look up an opcode by number.
     *
     * @param number The opcode byte of an instruction.
     * @return The opcode, or null if this version has no such opcode.
     */
    public @Nullable Opcode opcode(int number) {
        return number >= 0 && number < byNumber.length ? byNumber[number] : null;
    }

    /**
     * Get the number of an opcode in this version.
     *
     * @param opcode The opcode.
     * @return Its number.
     * @throws IllegalArgumentException If this version does not have the opcode.
     */
    public int number(Opcode opcode) {
        Integer n = numbers.get(opcode);
        if (n == null) throw new IllegalArgumentException(opcode + " does not exist in " + this);
        return n;
    }

    /**
     * Find the version with a given header version byte.
     *
     * @param dumpVersion The version byte.
     * @return The version, or null.
     */
    public static @Nullable FormatVersion forDumpVersion(int dumpVersion) {
        for (FormatVersion version : values()) {
            if (version.dumpVersion == dumpVersion) return version;
        }
        return null;
    }
}
