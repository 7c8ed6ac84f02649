package net.littleredcomputer.alu;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Longs;

import java.util.Objects;

/**
 * The right-hand side of a binary instruction: either a literal or a register,
 * resolved against a state at evaluation time.
 */
public final class Operand {
    private final Register register;  // null for literals
    private final long value;

    private Operand(Register register, long value) {
        this.register = register;
        this.value = value;
    }

    public static Operand literal(long value) { return new Operand(null, value); }

    public static Operand of(Register register) {
        return new Operand(Preconditions.checkNotNull(register), 0);
    }

    /**
     * @param word an integer literal or a register name
     * @return the parsed operand
     */
    public static Operand parse(String word) {
        Long n = Longs.tryParse(word);
        return n != null ? literal(n) : of(Register.parse(word));
    }

    public boolean isRegister() { return register != null; }

    public Register register() {
        if (register == null) throw new IllegalStateException("literal operand has no register");
        return register;
    }

    public long value() {
        if (register != null) throw new IllegalStateException("register operand has no literal value");
        return value;
    }

    /** Resolve against a register file. */
    long resolve(long[] registers) {
        return register != null ? registers[register.ordinal()] : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operand)) return false;
        Operand other = (Operand) o;
        return register == other.register && value == other.value;
    }

    @Override
    public int hashCode() { return Objects.hash(register, value); }

    @Override
    public String toString() { return register != null ? register.toString() : Long.toString(value); }
}
