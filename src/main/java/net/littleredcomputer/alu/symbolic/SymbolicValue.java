// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.alu.symbolic;

import gnu.trove.iterator.TLongObjectIterator;
import gnu.trove.map.hash.TLongObjectHashMap;
import net.littleredcomputer.alu.Environment;
import net.littleredcomputer.alu.Opcode;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every value a register can hold at one point in the program, each paired with the
 * {@link BreadCrumb} of comparison outcomes required to reach it. Values are never
 * modified once built, so any number of states may share them.
 */
public final class SymbolicValue {
    private static final int displayLimit = 20;
    private static final SymbolicValue INPUT;
    static {
        TLongObjectHashMap<BreadCrumb> m = new TLongObjectHashMap<>();
        for (int d = Environment.MIN_DIGIT; d <= Environment.MAX_DIGIT; ++d) m.put(d, BreadCrumb.EMPTY);
        INPUT = new SymbolicValue(m);
    }

    private final TLongObjectHashMap<BreadCrumb> values;

    private SymbolicValue(TLongObjectHashMap<BreadCrumb> values) {
        this.values = values;
    }

    /** @return the value that is always x, unconditionally */
    public static SymbolicValue literal(long x) {
        TLongObjectHashMap<BreadCrumb> m = new TLongObjectHashMap<>(1);
        m.put(x, BreadCrumb.EMPTY);
        return new SymbolicValue(m);
    }

    /** @return the value of a freshly read digit: any of 1..9, unconditionally */
    public static SymbolicValue input() { return INPUT; }

    public Optional<BreadCrumb> get(long value) { return Optional.ofNullable(values.get(value)); }

    public boolean contains(long value) { return values.containsKey(value); }

    public int size() { return values.size(); }

    public boolean isEmpty() { return values.isEmpty(); }

    /** @return the possible values in increasing order */
    public long[] values() {
        long[] vs = values.keys();
        Arrays.sort(vs);
        return vs;
    }

    /** How the breadcrumbs of a left and right operand combine for one pair of values. */
    @FunctionalInterface
    private interface Provenance {
        BreadCrumb of(long left, BreadCrumb leftCrumb, long right, BreadCrumb rightCrumb);
    }

    private static final Provenance both = (l, lc, r, rc) -> lc.and(rc);

    // A zero factor decides the product by itself, so only its history matters.
    private static final Provenance product = (l, lc, r, rc) -> {
        if (l == 0 && r == 0) return lc.or(rc);
        if (l == 0) return lc;
        if (r == 0) return rc;
        return lc.and(rc);
    };

    // A zero dividend gives zero whatever the divisor.
    private static final Provenance quotient = (l, lc, r, rc) -> l == 0 ? lc : lc.and(rc);

    public static SymbolicValue add(SymbolicValue left, SymbolicValue right) {
        return propagate(Opcode.ADD, left, right, both);
    }

    public static SymbolicValue multiply(SymbolicValue left, SymbolicValue right) {
        return propagate(Opcode.MUL, left, right, product);
    }

    public static SymbolicValue divide(SymbolicValue left, SymbolicValue right) {
        return propagate(Opcode.DIV, left, right, quotient);
    }

    public static SymbolicValue modulo(SymbolicValue left, SymbolicValue right) {
        return propagate(Opcode.MOD, left, right, quotient);
    }

    /**
     * Compare left and right, recording in each outcome's breadcrumb that the
     * comparison with the given id had to come out that way.
     */
    public static SymbolicValue equal(int comparisonId, SymbolicValue left, SymbolicValue right) {
        TLongObjectHashMap<BreadCrumb> m = propagate(Opcode.EQL, left, right, both).values;
        for (TLongObjectIterator<BreadCrumb> it = m.iterator(); it.hasNext(); ) {
            it.advance();
            it.setValue(it.value().set(comparisonId, it.key() == 1));
        }
        return new SymbolicValue(m);
    }

    /**
     * Apply op to every pair of left and right values. Pairs on which op faults are
     * skipped, since no execution gets past them. When several pairs produce the same
     * result, their breadcrumbs are joined.
     */
    private static SymbolicValue propagate(Opcode op, SymbolicValue left, SymbolicValue right, Provenance p) {
        final int n = right.values.size();
        final long[] rv = new long[n];
        final BreadCrumb[] rc = new BreadCrumb[n];
        int k = 0;
        for (TLongObjectIterator<BreadCrumb> it = right.values.iterator(); it.hasNext(); ++k) {
            it.advance();
            rv[k] = it.key();
            rc[k] = it.value();
        }
        TLongObjectHashMap<BreadCrumb> result = new TLongObjectHashMap<>();
        for (TLongObjectIterator<BreadCrumb> it = left.values.iterator(); it.hasNext(); ) {
            it.advance();
            final long lv = it.key();
            final BreadCrumb lc = it.value();
            for (int j = 0; j < n; ++j) {
                if (!op.isDefined(lv, rv[j])) continue;
                final long total = op.apply(lv, rv[j]);
                final BreadCrumb crumb = p.of(lv, lc, rv[j], rc[j]);
                final BreadCrumb old = result.get(total);
                result.put(total, old == null ? crumb : old.or(crumb));
            }
        }
        return new SymbolicValue(result);
    }

    /** Renders {@code value: [breadcrumb]} pairs in increasing order of value. */
    @Override
    public String toString() {
        long[] vs = values();
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < vs.length && i < displayLimit; ++i) {
            if (i > 0) s.append("; ");
            s.append(vs[i]).append(": [").append(values.get(vs[i])).append(']');
        }
        if (vs.length > displayLimit) s.append("; ... (").append(vs.length).append(" values)");
        return s.toString();
    }
}
