package io.github.eutro.ljdecomp.core.bc;

import java.util.Objects;

/**
 * An FFI cdata constant: a 64 bit integer literal ({@code 1LL}, {@code 1ULL}) or an imaginary number ({@code 1i}).
 */
public final class CDataConstant {
    public enum Kind {
        INT64("LL"),
        UINT64("ULL"),
        COMPLEX("i"),
        ;

        public final String suffix;

        Kind(String suffix) {
            this.suffix = suffix;
        }
    }

    public final Kind kind;
    /**
     * The integer bits, for {@link Kind#INT64} and {@link Kind#UINT64}.
     */
    public final long bits;
    public final double real, imaginary;

    private CDataConstant(Kind kind, long bits, double real, double imaginary) {
        this.kind = kind;
        this.bits = bits;
        this.real = real;
        this.imaginary = imaginary;
    }

    public static CDataConstant integer(boolean unsigned, long bits) {
        return new CDataConstant(unsigned ? Kind.UINT64 : Kind.INT64, bits, 0, 0);
    }

    public static CDataConstant complex(double real, double imaginary) {
        return new CDataConstant(Kind.COMPLEX, 0, real, imaginary);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CDataConstant)) return false;
        CDataConstant that = (CDataConstant) o;
        return kind == that.kind && bits == that.bits
                && Double.compare(real, that.real) == 0
                && Double.compare(imaginary, that.imaginary) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bits, real, imaginary);
    }

    @Override
    public String toString() {
        switch (kind) {
            case INT64:
                return bits + kind.suffix;
            case UINT64:
                return Long.toUnsignedString(bits) + kind.suffix;
            default:
                return imaginary + kind.suffix;
        }
    }
}
