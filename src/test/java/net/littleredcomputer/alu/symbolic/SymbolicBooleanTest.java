package net.littleredcomputer.alu.symbolic;

import org.junit.Test;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static net.littleredcomputer.alu.symbolic.SymbolicBoolean.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SymbolicBooleanTest {

    @Test
    public void laws() {
        for (SymbolicBoolean a : values()) {
            assertThat(a.or(a), is(a));
            assertThat(a.and(a), is(a));
            assertThat(ANY.and(a), is(a));
            assertThat(INVALID.or(a), is(a));
            for (SymbolicBoolean b : values()) {
                assertThat(a + " or " + b, a.or(b), is(b.or(a)));
                assertThat(a + " and " + b, a.and(b), is(b.and(a)));
            }
        }
    }

    @Test
    public void or() {
        assertThat(TRUE.or(FALSE), is(ANY));
        assertThat(TRUE.or(ANY), is(ANY));
        assertThat(FALSE.or(INVALID), is(FALSE));
        assertThat(ANY.or(INVALID), is(ANY));
    }

    @Test
    public void and() {
        assertThat(TRUE.and(FALSE), is(INVALID));
        assertThat(TRUE.and(ANY), is(TRUE));
        assertThat(FALSE.and(INVALID), is(INVALID));
        assertThat(ANY.and(INVALID), is(INVALID));
    }

    @Test
    public void invalidOnlyLeavesThroughOr() {
        SymbolicBoolean conflict = TRUE.and(FALSE);
        assertThat(conflict.and(ANY), is(INVALID));
        assertThat(conflict.and(TRUE), is(INVALID));
        assertThat(conflict.or(TRUE), is(TRUE));
    }

    @Test
    public void single() {
        assertThat(TRUE.single(), isPresentAndIs(true));
        assertThat(FALSE.single(), isPresentAndIs(false));
        assertThat(ANY.single(), isEmpty());
        assertThat(INVALID.single(), isEmpty());
        assertThat(SymbolicBoolean.of(true), is(TRUE));
        assertThat(SymbolicBoolean.of(false), is(FALSE));
    }
}
