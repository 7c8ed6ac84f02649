package net.littleredcomputer.alu;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * The policy under which an {@link Execution} runs: which digits an input may take,
 * when a branch is abandoned, and which final states are accepted. There are exactly
 * two: plain simulation of given digits, and a search pruned by a {@link Constraint}.
 */
public abstract class Environment {
    public static final int MIN_DIGIT = 1;
    public static final int MAX_DIGIT = 9;

    /** The order in which a constrained search tries the digits of each input. */
    public enum Order {
        /** 9 down to 1: the first answer found is the largest. */
        DESCENDING,
        /** 1 up to 9: the first answer found is the smallest. */
        ASCENDING;

        int[] digits() {
            int[] ds = new int[MAX_DIGIT - MIN_DIGIT + 1];
            for (int i = 0; i < ds.length; ++i) ds[i] = this == DESCENDING ? MAX_DIGIT - i : MIN_DIGIT + i;
            return ds;
        }
    }

    private Environment() {}

    /** @return the digits to try, in order, for the input with the given sequence id */
    abstract int[] candidates(int inputId);

    /** @return true if the branch that just computed {@code result} with {@code i} must be given up */
    abstract boolean shouldAbandon(Instruction i, long result);

    /** @return true if a state that ran off the end of the program is an answer */
    abstract boolean canFinish(State s);

    /**
     * Run exactly the given digits. An input past the end of the list has no
     * candidates, so the run fails; any completed run is accepted.
     */
    public static Environment simple(int... digits) {
        for (int d : digits) {
            Preconditions.checkArgument(d >= MIN_DIGIT && d <= MAX_DIGIT, "digit out of range: %s", d);
        }
        return new Simple(digits.clone());
    }

    /** Search for an input that leaves zero in register Z. */
    public static Environment constrained(Constraint constraint, Order order) {
        return constrained(constraint, order, Register.Z, 0);
    }

    /**
     * Search for an input that leaves {@code target} in {@code register}, abandoning a
     * branch as soon as a comparison disagrees with the constraint.
     */
    public static Environment constrained(Constraint constraint, Order order, Register register, long target) {
        return new Constrained(Preconditions.checkNotNull(constraint), Preconditions.checkNotNull(order),
                Preconditions.checkNotNull(register), target);
    }

    private static final class Simple extends Environment {
        private static final int[] none = new int[0];
        private final int[] digits;

        Simple(int[] digits) { this.digits = digits; }

        @Override int[] candidates(int inputId) {
            return inputId < digits.length ? new int[]{digits[inputId]} : none;
        }

        @Override boolean shouldAbandon(Instruction i, long result) { return false; }

        @Override boolean canFinish(State s) { return true; }

        @Override public String toString() { return "simple" + Arrays.toString(digits); }
    }

    private static final class Constrained extends Environment {
        private final Constraint constraint;
        private final int[] digits;
        private final Order order;
        private final Register register;
        private final long target;

        Constrained(Constraint constraint, Order order, Register register, long target) {
            this.constraint = constraint;
            this.order = order;
            this.digits = order.digits();
            this.register = register;
            this.target = target;
        }

        @Override int[] candidates(int inputId) { return digits; }

        @Override boolean shouldAbandon(Instruction i, long result) {
            return i.isEqual() && !constraint.admits(i.id(), result == 1);
        }

        @Override boolean canFinish(State s) { return s.register(register) == target; }

        @Override public String toString() {
            return String.format("constrained[%s %s=%d %s]", order, register, target, constraint);
        }
    }
}
