package net.littleredcomputer.alu.symbolic;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.alu.Instruction;
import net.littleredcomputer.alu.Operand;
import net.littleredcomputer.alu.Program;
import net.littleredcomputer.alu.Register;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * The symbolic value of each register after some prefix of a program. Evaluating a
 * program visits each instruction once, in order, and leaves every register holding
 * all the values it can take together with the comparison outcomes each requires.
 */
public class SymbolicState {
    private static final Logger log = LogManager.getFormatterLogger(SymbolicState.class);
    private static final SymbolicValue ZERO = SymbolicValue.literal(0);

    private final SymbolicValue[] register;
    private final int pc;

    /** The initial state: every register is zero. */
    public SymbolicState() {
        register = new SymbolicValue[Register.SIZE];
        Arrays.fill(register, ZERO);
        pc = 0;
    }

    private SymbolicState(SymbolicValue[] register, int pc) {
        this.register = register;
        this.pc = pc;
    }

    /** Run the whole program symbolically from the initial state. */
    public static SymbolicState evaluate(Program program) {
        Stopwatch sw = Stopwatch.createStarted();
        SymbolicState s = new SymbolicState();
        for (Instruction i : program) {
            s = s.step(i);
            if (log.isDebugEnabled()) log.debug("%4d %-16s %s has %d values", s.pc, i, i.dest(), s.get(i.dest()).size());
        }
        log.info("symbolic pass over %d instructions %s: %s", program.size(), sw, s.sizes());
        return s;
    }

    /** @return the state after executing i; this state is unchanged */
    public SymbolicState step(Instruction i) {
        final SymbolicValue left = get(i.dest());
        final SymbolicValue result;
        switch (i.opcode()) {
            case INP: result = SymbolicValue.input(); break;
            case ADD: result = SymbolicValue.add(left, operand(i.operand())); break;
            case MUL: result = SymbolicValue.multiply(left, operand(i.operand())); break;
            case DIV: result = SymbolicValue.divide(left, operand(i.operand())); break;
            case MOD: result = SymbolicValue.modulo(left, operand(i.operand())); break;
            case EQL: result = SymbolicValue.equal(i.id(), left, operand(i.operand())); break;
            default: throw new IllegalArgumentException("unknown opcode " + i.opcode());
        }
        SymbolicValue[] r = register.clone();
        r[i.dest().ordinal()] = result;
        return new SymbolicState(r, pc + 1);
    }

    private SymbolicValue operand(Operand o) {
        return o.isRegister() ? get(o.register()) : SymbolicValue.literal(o.value());
    }

    public SymbolicValue get(Register r) { return register[r.ordinal()]; }

    /** @return the number of instructions evaluated to reach this state */
    public int pc() { return pc; }

    private String sizes() {
        StringBuilder s = new StringBuilder();
        for (Register r : Register.values()) {
            if (s.length() > 0) s.append(' ');
            s.append(r).append(':').append(get(r).size());
        }
        return s.toString();
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (Register r : Register.values()) s.append(r).append(": ").append(get(r)).append('\n');
        return s.toString();
    }
}
