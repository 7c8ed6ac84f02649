package net.littleredcomputer.alu;

/**
 * The six operations of the ALU. The arithmetic is shared by the concrete executor
 * and the symbolic pass, so that both agree on which operand pairs fault.
 */
public enum Opcode {
    INP("inp"),
    ADD("add"),
    MUL("mul"),
    DIV("div"),
    MOD("mod"),
    EQL("eql");

    private final String mnemonic;

    Opcode(String mnemonic) { this.mnemonic = mnemonic; }

    public String mnemonic() { return mnemonic; }

    public static Opcode parse(String mnemonic) {
        for (Opcode o : values()) {
            if (o.mnemonic.equals(mnemonic)) return o;
        }
        throw new IllegalArgumentException("unknown operator: " + mnemonic);
    }

    /**
     * @return false if computing a op b faults: division by zero, or a modulus with
     * a negative dividend or a non-positive divisor
     */
    public boolean isDefined(long a, long b) {
        switch (this) {
            case DIV: return b != 0;
            case MOD: return a >= 0 && b > 0;
            default: return true;
        }
    }

    /**
     * Compute a op b. Division and remainder truncate toward zero.
     * @throws ArithmeticException if the pair is not {@linkplain #isDefined defined}
     */
    public long apply(long a, long b) {
        if (!isDefined(a, b)) throw new ArithmeticException(String.format("%s(%d, %d) is undefined", mnemonic, a, b));
        switch (this) {
            case ADD: return a + b;
            case MUL: return a * b;
            case DIV: return a / b;
            case MOD: return a % b;
            case EQL: return a == b ? 1 : 0;
            default: throw new IllegalStateException("not a binary operator: " + this);
        }
    }
}
