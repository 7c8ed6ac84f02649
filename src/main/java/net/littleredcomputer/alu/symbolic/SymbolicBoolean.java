package net.littleredcomputer.alu.symbolic;

import java.util.Optional;

/**
 * What is known about the outcome of one comparison along the derivations of a value.
 * ANY is the unconstrained element; INVALID marks a derivation whose requirements
 * contradict each other.
 */
public enum SymbolicBoolean {
    ANY,
    TRUE,
    FALSE,
    INVALID;

    public static SymbolicBoolean of(boolean b) { return b ? TRUE : FALSE; }

    /**
     * Join: two alternative derivations reach the same value. INVALID is the
     * identity; disagreeing requirements give ANY.
     */
    public SymbolicBoolean or(SymbolicBoolean other) {
        if (this == other) return this;
        if (this == INVALID) return other;
        if (other == INVALID) return this;
        return ANY;
    }

    /**
     * Meet: both requirements must hold at once. ANY is the identity; disagreeing
     * requirements give INVALID.
     */
    public SymbolicBoolean and(SymbolicBoolean other) {
        if (this == other) return this;
        if (this == ANY) return other;
        if (other == ANY) return this;
        return INVALID;
    }

    /** @return the outcome, if this is pinned to exactly one */
    public Optional<Boolean> single() {
        switch (this) {
            case TRUE: return Optional.of(true);
            case FALSE: return Optional.of(false);
            default: return Optional.empty();
        }
    }
}
