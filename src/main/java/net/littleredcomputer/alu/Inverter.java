package net.littleredcomputer.alu;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import net.littleredcomputer.alu.symbolic.BreadCrumb;
import net.littleredcomputer.alu.symbolic.SymbolicState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Finds the digit sequences that drive a register of a program to a target value.
 * One symbolic pass over the program yields the comparison outcomes that every such
 * sequence requires; a depth-first concrete search honoring those outcomes then
 * produces the largest or smallest sequence.
 */
public class Inverter {
    private static final Logger log = LogManager.getFormatterLogger(Inverter.class);

    private final Program program;
    private final Register register;
    private final long target;
    private Duration logInterval = Duration.ofMillis(1000);
    private SymbolicState symbolic;

    /** Find inputs that leave zero in register Z. */
    public Inverter(Program program) {
        this(program, Register.Z, 0);
    }

    public Inverter(Program program, Register register, long target) {
        this.program = Preconditions.checkNotNull(program);
        this.register = Preconditions.checkNotNull(register);
        this.target = target;
    }

    public Inverter setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /** @return the symbolic state at the end of the program (computed once) */
    public SymbolicState symbolic() {
        if (symbolic == null) symbolic = SymbolicState.evaluate(program);
        return symbolic;
    }

    /**
     * @return the comparison outcomes necessary to reach the target, or empty if the
     * target is not among the values the register can hold at the end
     */
    public Optional<Constraint> constraint() {
        Optional<BreadCrumb> crumb = symbolic().get(register).get(target);
        if (!crumb.isPresent()) {
            log.info("%s can never be %d", register, target);
            return Optional.empty();
        }
        Constraint c = crumb.get().constraint();
        log.info("%s=%d requires %d of %d comparisons: %s", register, target, c.pinned(), program.nComparisons(), c);
        return Optional.of(c);
    }

    /** @return the first digit sequence reaching the target when each input tries digits in the given order */
    public Optional<List<Integer>> solve(Environment.Order order) {
        return constraint().flatMap(c -> {
            Stopwatch sw = Stopwatch.createStarted();
            Execution e = new Execution(program, Environment.constrained(c, order, register, target))
                    .setLogInterval(logInterval);
            Optional<List<Integer>> answer = e.stream().findFirst().map(State::inputs);
            log.info("%s search: %s after %d steps %s", order, answer.map(Object::toString).orElse("no solution"), e.steps(), sw);
            return answer;
        });
    }

    /** @return the lexicographically largest digit sequence reaching the target */
    public Optional<List<Integer>> largest() { return solve(Environment.Order.DESCENDING); }

    /** @return the lexicographically smallest digit sequence reaching the target */
    public Optional<List<Integer>> smallest() { return solve(Environment.Order.ASCENDING); }

    /** @return the decimal number whose digits, most significant first, are given */
    public static long toNumber(List<Integer> digits) {
        long n = 0;
        for (int d : digits) n = n * 10 + d;
        return n;
    }
}
