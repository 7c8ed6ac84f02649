package net.littleredcomputer.alu;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Required outcomes of the equality instructions, indexed by comparison id. A present
 * entry means every execution reaching the goal must see that comparison come out
 * that way; an empty entry (or an id past the end) means "don't care". This is a
 * necessary condition only: an assignment honoring it may still miss the goal.
 */
public final class Constraint {
    private static final Constraint NONE = new Constraint(ImmutableList.of());

    private final ImmutableList<Optional<Boolean>> required;

    public Constraint(List<Optional<Boolean>> required) {
        this.required = ImmutableList.copyOf(required);
    }

    /** The constraint that requires nothing. */
    public static Constraint none() { return NONE; }

    /** @param required per-comparison requirement, null for "don't care" */
    public static Constraint of(Boolean... required) {
        return new Constraint(Arrays.stream(required).map(Optional::ofNullable).collect(ImmutableList.toImmutableList()));
    }

    public Optional<Boolean> required(int comparisonId) {
        return comparisonId < required.size() ? required.get(comparisonId) : Optional.empty();
    }

    /** @return true unless the comparison is pinned to the opposite outcome */
    public boolean admits(int comparisonId, boolean outcome) {
        return required(comparisonId).map(r -> r == outcome).orElse(true);
    }

    public int size() { return required.size(); }

    /** @return the number of comparisons whose outcome is pinned */
    public int pinned() { return (int) required.stream().filter(Optional::isPresent).count(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constraint)) return false;
        Constraint other = (Constraint) o;
        int n = Math.max(size(), other.size());
        for (int i = 0; i < n; ++i) {
            if (!required(i).equals(other.required(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int n = required.size();
        while (n > 0 && !required.get(n - 1).isPresent()) --n;
        return required.subList(0, n).hashCode();
    }

    /** One character per comparison: T, F, or '.' for don't care. */
    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (Optional<Boolean> r : required) s.append(r.map(b -> b ? 'T' : 'F').orElse('.'));
        return s.toString();
    }
}
