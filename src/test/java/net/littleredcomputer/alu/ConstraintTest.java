package net.littleredcomputer.alu;

import org.junit.Test;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

public class ConstraintTest {
    @Test
    public void required() {
        Constraint c = Constraint.of(true, null, false);
        assertThat(c.required(0), isPresentAndIs(true));
        assertThat(c.required(1), isEmpty());
        assertThat(c.required(2), isPresentAndIs(false));
        assertThat(c.required(3), isEmpty());
        assertThat(c.size(), is(3));
        assertThat(c.pinned(), is(2));
        assertThat(c.toString(), is("T.F"));
    }

    @Test
    public void admits() {
        Constraint c = Constraint.of(true, null, false);
        assertThat(c.admits(0, true), is(true));
        assertThat(c.admits(0, false), is(false));
        assertThat(c.admits(1, false), is(true));
        assertThat(c.admits(2, true), is(false));
        assertThat(c.admits(17, true), is(true));
        assertThat(Constraint.none().admits(0, false), is(true));
    }

    @Test
    public void trailingDontCaresAreInsignificant() {
        assertThat(Constraint.of(true, null, null), is(Constraint.of(true)));
        assertThat(Constraint.of(true, null, null).hashCode(), is(Constraint.of(true).hashCode()));
        assertThat(Constraint.of(null, null), is(Constraint.none()));
        assertThat(Constraint.of(true, false), is(not(Constraint.of(true))));
    }
}
