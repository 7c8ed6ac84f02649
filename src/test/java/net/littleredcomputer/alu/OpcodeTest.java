package net.littleredcomputer.alu;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class OpcodeTest {
    @Test
    public void arithmetic() {
        assertThat(Opcode.ADD.apply(7, -3), is(4L));
        assertThat(Opcode.MUL.apply(-7, 3), is(-21L));
        assertThat(Opcode.DIV.apply(7, 2), is(3L));
        assertThat(Opcode.DIV.apply(-7, 2), is(-3L));  // truncates toward zero
        assertThat(Opcode.MOD.apply(27, 26), is(1L));
        assertThat(Opcode.EQL.apply(5, 5), is(1L));
        assertThat(Opcode.EQL.apply(5, 6), is(0L));
    }

    @Test
    public void faults() {
        assertThat(Opcode.DIV.isDefined(3, 0), is(false));
        assertThat(Opcode.DIV.isDefined(0, -2), is(true));
        assertThat(Opcode.MOD.isDefined(-1, 5), is(false));
        assertThat(Opcode.MOD.isDefined(0, 5), is(true));
        assertThat(Opcode.MOD.isDefined(5, 0), is(false));
        assertThat(Opcode.MOD.isDefined(5, -5), is(false));
        assertThat(Opcode.ADD.isDefined(Long.MIN_VALUE, 0), is(true));
    }

    @Test(expected = ArithmeticException.class)
    public void divideByZeroThrows() {
        Opcode.DIV.apply(1, 0);
    }

    @Test(expected = ArithmeticException.class)
    public void negativeModulusThrows() {
        Opcode.MOD.apply(-4, 3);
    }

    @Test
    public void mnemonics() {
        for (Opcode o : Opcode.values()) assertThat(Opcode.parse(o.mnemonic()), is(o));
    }
}
