package net.littleredcomputer.alu;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Concrete machine state: the register file, the digits consumed so far, and the
 * program counter. Each branch of a search owns its own copy.
 */
public class State {
    private final long[] register;
    private final TIntArrayList inputs;
    private int pc;

    public State() {
        register = new long[Register.SIZE];
        inputs = new TIntArrayList();
        pc = 0;
    }

    private State(State s) {
        register = s.register.clone();
        inputs = new TIntArrayList(s.inputs);
        pc = s.pc;
    }

    State copy() { return new State(this); }

    /** Execute the input instruction at the program counter with the given digit. */
    void input(Instruction i, int digit) {
        register[i.dest().ordinal()] = digit;
        inputs.add(digit);
        ++pc;
    }

    /**
     * Execute a non-input instruction.
     * @return false if the instruction faulted, in which case the state is unchanged
     */
    boolean execute(Instruction i) {
        final int d = i.dest().ordinal();
        final long a = register[d];
        final long b = i.operand().resolve(register);
        if (!i.opcode().isDefined(a, b)) return false;
        register[d] = i.opcode().apply(a, b);
        ++pc;
        return true;
    }

    public long register(Register r) { return register[r.ordinal()]; }

    /** @return a copy of the register file in W, X, Y, Z order */
    public long[] registers() { return register.clone(); }

    /** @return the digits consumed so far, in order */
    public List<Integer> inputs() {
        return Arrays.stream(inputs.toArray()).boxed().collect(Collectors.toList());
    }

    public int pc() { return pc; }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (Register r : Register.values()) s.append(r).append('=').append(register[r.ordinal()]).append(' ');
        return s.append("inputs=").append(inputs).append(" pc=").append(pc).toString();
    }
}
