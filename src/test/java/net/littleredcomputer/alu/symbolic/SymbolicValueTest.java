package net.littleredcomputer.alu.symbolic;

import net.littleredcomputer.alu.Program;
import net.littleredcomputer.alu.Register;
import org.junit.Test;

import java.util.stream.LongStream;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.junit.Assert.assertThat;

public class SymbolicValueTest {

    private static SymbolicValue last(String program, Register r) {
        return SymbolicState.evaluate(Program.parseFrom(program)).get(r);
    }

    @Test
    public void literalAndInput() {
        assertThat(SymbolicValue.literal(-26).toString(), is("-26: []"));
        assertThat(SymbolicValue.input().values(), is(LongStream.rangeClosed(1, 9).toArray()));
        assertThat(SymbolicValue.input().get(0), isEmpty());
        assertThat(SymbolicValue.input().get(5).get(), is(BreadCrumb.EMPTY));
    }

    @Test
    public void sumOfTwoDigits() {
        SymbolicValue v = SymbolicValue.add(SymbolicValue.input(), SymbolicValue.input());
        assertThat(v.values(), is(LongStream.rangeClosed(2, 18).toArray()));
    }

    @Test
    public void equalStampsItsOutcome() {
        SymbolicValue v = last("inp w\neql w 3", Register.W);
        assertThat(v.toString(), is("0: [eql_0: FALSE]; 1: [eql_0: TRUE]"));
    }

    @Test
    public void equalWithOneOutcome() {
        // A digit is never 10, so only the false outcome is possible.
        SymbolicValue v = last("inp x\neql x 10", Register.X);
        assertThat(v.toString(), is("0: [eql_0: FALSE]"));
    }

    @Test
    public void zeroFactorOnTheLeftDecides() {
        SymbolicValue v = last("inp w\neql w 5\ninp x\neql x 10\nadd x 1\nmul w x", Register.W);
        assertThat(v.toString(), is("0: [eql_0: FALSE]; 1: [eql_0: TRUE; eql_1: FALSE]"));
    }

    @Test
    public void zeroFactorOnTheRightDecides() {
        SymbolicValue v = last("inp w\neql w 5\ninp x\neql x 10\nadd x 1\nmul x w", Register.X);
        assertThat(v.toString(), is("0: [eql_0: FALSE]; 1: [eql_0: TRUE; eql_1: FALSE]"));
    }

    @Test
    public void twoZeroFactorsAreAlternatives() {
        SymbolicValue v = last("inp w\neql w 5\ninp x\neql x 7\nmul w x", Register.W);
        assertThat(v.toString(), is("0: []; 1: [eql_0: TRUE; eql_1: TRUE]"));
    }

    @Test
    public void zeroDividendDecides() {
        String prefix = "inp w\neql w 5\nmul w 7\ninp x\neql x 10\nadd x 2\n";
        assertThat(last(prefix + "div w x", Register.W).toString(), is("0: [eql_0: FALSE]; 3: [eql_0: TRUE; eql_1: FALSE]"));
        assertThat(last(prefix + "mod w x", Register.W).toString(), is("0: [eql_0: FALSE]; 1: [eql_0: TRUE; eql_1: FALSE]"));
    }

    @Test
    public void faultingPairsAreSkipped() {
        // x ranges over -4..4; dividing by the zero is not an outcome
        assertThat(last("inp w\nadd x -5\nadd x w\ndiv z x", Register.Z).toString(), is("0: []"));
        // only the positive divisors 1..4 count
        assertThat(last("inp w\ninp x\nadd x -5\nmod w x", Register.W).values(), is(new long[]{0, 1, 2, 3}));
        // nothing survives a certain fault
        assertThat(last("add z -1\nmod z 2", Register.Z).isEmpty(), is(true));
    }

    @Test
    public void longValuesAreAbbreviated() {
        SymbolicValue v = last("inp w\ninp x\nmul x 10\nadd x w", Register.X);
        assertThat(v.size(), is(81));
        assertThat(v.toString(), startsWith("11: []; 12: []; "));
        assertThat(v.toString().endsWith("; ... (81 values)"), is(true));
    }
}
