// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.alu;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Depth-first execution of a program under an {@link Environment}. Every input
 * instruction is a choice point; the candidates for each are tried in the order the
 * environment gives them. A branch ends when it faults, when the environment abandons
 * it, or when it runs off the end of the program (and is then accepted or not). The
 * search state is an explicit stack of choice points, so the depth of the program
 * is not limited by the Java stack. Accepted states are produced lazily, in search
 * order.
 */
public class Execution implements Spliterator<State> {
    private static final Logger log = LogManager.getFormatterLogger(Execution.class);
    private final int logCheckSteps = 10000;

    private final Program program;
    private final Environment env;
    private final Deque<ChoicePoint> choices = new ArrayDeque<>();
    private State current = new State();  // null: backtrack to the most recent choice point

    private long stepCount;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    private enum Outcome {
        CONTINUE,  // the instruction executed; keep going
        CHOOSE,    // an input instruction is next
        ABANDON,   // the branch faulted, was pruned, or finished without being accepted
        ACCEPT,    // the branch finished in an accepted state
    }

    private static class ChoicePoint {
        final State state;  // positioned at the input instruction
        final int[] candidates;
        int next = 0;

        ChoicePoint(State state, int[] candidates) {
            this.state = state;
            this.candidates = candidates;
        }
    }

    public Execution(Program program, Environment env) {
        this.program = Preconditions.checkNotNull(program);
        this.env = Preconditions.checkNotNull(env);
    }

    public Execution setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /** @return every accepted final state, in search order */
    public static Stream<State> solutions(Program program, Environment env) {
        return new Execution(program, env).stream();
    }

    /** @return the first accepted final state, if there is one */
    public static Optional<State> run(Program program, Environment env) {
        return solutions(program, env).findFirst();
    }

    public Stream<State> stream() {
        return StreamSupport.stream(this, false);
    }

    /** @return the number of instructions executed and choices made so far */
    public long steps() { return stepCount; }

    private Outcome step() {
        if (current.pc() == program.size()) return env.canFinish(current) ? Outcome.ACCEPT : Outcome.ABANDON;
        Instruction i = program.get(current.pc());
        if (i.isInput()) return Outcome.CHOOSE;
        if (!current.execute(i)) {
            log.trace("%s faulted in %s", i, current);
            return Outcome.ABANDON;
        }
        if (env.shouldAbandon(i, current.register(i.dest()))) return Outcome.ABANDON;
        return Outcome.CONTINUE;
    }

    /**
     * Resume from the most recent choice point with an untried candidate.
     * @return false if every choice point is exhausted
     */
    private boolean backtrack() {
        while (!choices.isEmpty()) {
            ChoicePoint c = choices.peek();
            if (c.next < c.candidates.length) {
                current = c.state.copy();
                current.input(program.get(current.pc()), c.candidates[c.next++]);
                return true;
            }
            choices.pop();
        }
        return false;
    }

    @Override
    public boolean tryAdvance(Consumer<? super State> action) {
        if (!stopwatch.isRunning()) {
            stopwatch.start();
            lastLogTime = Instant.now();
        }
        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress();
            if (current == null) {
                if (!backtrack()) {
                    log.debug("search exhausted after %d steps %s", stepCount, stopwatch);
                    return false;
                }
                continue;
            }
            switch (step()) {
                case CONTINUE:
                    break;
                case CHOOSE:
                    choices.push(new ChoicePoint(current, env.candidates(program.get(current.pc()).id())));
                    current = null;
                    break;
                case ABANDON:
                    current = null;
                    break;
                case ACCEPT:
                    State s = current;
                    current = null;
                    log.debug("accepted %s after %d steps %s", s.inputs(), stepCount, stopwatch);
                    action.accept(s);
                    return true;
            }
        }
    }

    private void maybeReportProgress() {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        final State s = current != null ? current : choices.isEmpty() ? null : choices.peek().state;
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s",
                env, stepCount, stopwatch, perSec, s == null ? "-" : s.inputs()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    @Override
    public Spliterator<State> trySplit() { return null; }

    @Override
    public long estimateSize() { return Long.MAX_VALUE; }

    @Override
    public int characteristics() { return ORDERED | NONNULL; }
}
