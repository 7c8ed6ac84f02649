package net.littleredcomputer.alu.symbolic;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.alu.Constraint;

import javax.annotation.CheckReturnValue;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * The comparison outcomes needed to reach one value at one point in the program:
 * a vector of {@link SymbolicBoolean} indexed by comparison id, with positions past
 * the end taken to be ANY. Breadcrumbs are immutable; every combination yields a new
 * one, or one of its arguments when the result is identical to it, so that values
 * with the same provenance share a breadcrumb.
 */
public final class BreadCrumb {
    public static final BreadCrumb EMPTY = new BreadCrumb(new SymbolicBoolean[0]);

    private final SymbolicBoolean[] crumbs;

    private BreadCrumb(SymbolicBoolean[] crumbs) {
        this.crumbs = crumbs;
    }

    public SymbolicBoolean get(int comparisonId) {
        return comparisonId < crumbs.length ? crumbs[comparisonId] : SymbolicBoolean.ANY;
    }

    /** @return the number of explicitly stored positions */
    public int length() { return crumbs.length; }

    /** @return a breadcrumb equal to this one except that comparisonId is pinned to value */
    @CheckReturnValue
    public BreadCrumb set(int comparisonId, boolean value) {
        Preconditions.checkArgument(comparisonId >= 0, "negative comparison id %s", comparisonId);
        SymbolicBoolean b = SymbolicBoolean.of(value);
        if (get(comparisonId) == b) return this;
        SymbolicBoolean[] r = Arrays.copyOf(crumbs, Math.max(crumbs.length, comparisonId + 1));
        for (int i = crumbs.length; i < r.length; ++i) r[i] = SymbolicBoolean.ANY;
        r[comparisonId] = b;
        return new BreadCrumb(r);
    }

    /** Both derivations must hold: position-wise {@link SymbolicBoolean#and}. */
    @CheckReturnValue
    public BreadCrumb and(BreadCrumb other) { return combine(other, SymbolicBoolean::and); }

    /** Either derivation will do: position-wise {@link SymbolicBoolean#or}. */
    @CheckReturnValue
    public BreadCrumb or(BreadCrumb other) { return combine(other, SymbolicBoolean::or); }

    private BreadCrumb combine(BreadCrumb other, BinaryOperator<SymbolicBoolean> op) {
        if (this == other) return this;  // both operators are idempotent
        final int n = Math.max(crumbs.length, other.crumbs.length);
        SymbolicBoolean[] r = new SymbolicBoolean[n];
        boolean sameAsThis = crumbs.length == n;
        boolean sameAsOther = other.crumbs.length == n;
        for (int i = 0; i < n; ++i) {
            r[i] = op.apply(get(i), other.get(i));
            sameAsThis &= r[i] == get(i);
            sameAsOther &= r[i] == other.get(i);
        }
        if (sameAsThis) return this;
        if (sameAsOther) return other;
        return new BreadCrumb(r);
    }

    /** @return the required outcome of each comparison: the positions pinned to TRUE or FALSE */
    public Constraint constraint() {
        ImmutableList.Builder<Optional<Boolean>> b = ImmutableList.builder();
        for (SymbolicBoolean c : crumbs) b.add(c.single());
        return new Constraint(b.build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BreadCrumb)) return false;
        BreadCrumb other = (BreadCrumb) o;
        final int n = Math.max(crumbs.length, other.crumbs.length);
        for (int i = 0; i < n; ++i) {
            if (get(i) != other.get(i)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int n = crumbs.length;
        while (n > 0 && crumbs[n - 1] == SymbolicBoolean.ANY) --n;
        return Arrays.hashCode(Arrays.copyOf(crumbs, n));
    }

    /** Lists the positions that are not ANY, e.g. {@code eql_1: FALSE; eql_4: TRUE}. */
    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < crumbs.length; ++i) {
            if (crumbs[i] == SymbolicBoolean.ANY) continue;
            if (s.length() > 0) s.append("; ");
            s.append("eql_").append(i).append(": ").append(crumbs[i]);
        }
        return s.toString();
    }
}
