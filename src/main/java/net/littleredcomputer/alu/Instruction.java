package net.littleredcomputer.alu;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * One ALU instruction. Input instructions carry the index of the digit they consume;
 * equality instructions carry their comparison id, which indexes every breadcrumb.
 */
public final class Instruction {
    private final Opcode opcode;
    private final Register dest;
    private final Operand operand;  // null for INP
    private final int id;  // input sequence id for INP, comparison id for EQL, otherwise -1

    private Instruction(Opcode opcode, Register dest, Operand operand, int id) {
        this.opcode = Preconditions.checkNotNull(opcode);
        this.dest = Preconditions.checkNotNull(dest);
        this.operand = operand;
        this.id = id;
    }

    public static Instruction input(int id, Register dest) {
        Preconditions.checkArgument(id >= 0, "negative input id %s", id);
        return new Instruction(Opcode.INP, dest, null, id);
    }

    public static Instruction equal(int id, Register dest, Operand operand) {
        Preconditions.checkArgument(id >= 0, "negative comparison id %s", id);
        return new Instruction(Opcode.EQL, dest, Preconditions.checkNotNull(operand), id);
    }

    /** Build an ADD, MUL, DIV or MOD instruction. */
    public static Instruction binary(Opcode opcode, Register dest, Operand operand) {
        Preconditions.checkArgument(opcode != Opcode.INP && opcode != Opcode.EQL,
                "%s instructions need an id", opcode);
        return new Instruction(opcode, dest, Preconditions.checkNotNull(operand), -1);
    }

    public Opcode opcode() { return opcode; }
    public Register dest() { return dest; }

    public Operand operand() {
        if (operand == null) throw new IllegalStateException(this + " has no operand");
        return operand;
    }

    /** @return the input sequence id of an INP or the comparison id of an EQL */
    public int id() {
        if (id < 0) throw new IllegalStateException(this + " has no id");
        return id;
    }

    public boolean isInput() { return opcode == Opcode.INP; }
    public boolean isEqual() { return opcode == Opcode.EQL; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction other = (Instruction) o;
        return opcode == other.opcode && dest == other.dest && id == other.id && Objects.equals(operand, other.operand);
    }

    @Override
    public int hashCode() { return Objects.hash(opcode, dest, operand, id); }

    @Override
    public String toString() {
        switch (opcode) {
            case INP: return String.format("inp_%d(%s)", id, dest);
            case EQL: return String.format("eql_%d(%s, %s)", id, dest, operand);
            default: return String.format("%s(%s, %s)", opcode.mnemonic(), dest, operand);
        }
    }
}
