// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.alu;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;

/**
 * A straight-line ALU program. Input instructions are numbered 0, 1, ... in order of
 * appearance, and equality instructions are numbered separately in the same way.
 */
public class Program implements Iterable<Instruction> {
    private static final Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();

    private final ImmutableList<Instruction> instructions;
    private final int nInputs;
    private final int nComparisons;

    public Program(List<Instruction> instructions) {
        this.instructions = ImmutableList.copyOf(instructions);
        int inputs = 0, comparisons = 0;
        for (Instruction i : this.instructions) {
            if (i.isInput()) ++inputs;
            if (i.isEqual()) ++comparisons;
        }
        nInputs = inputs;
        nComparisons = comparisons;
    }

    public static Program parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Parse a program: one instruction per line, blank lines ignored.
     * <pre>
     *   inp a
     *   add|mul|div|mod|eql a b
     * </pre>
     * where a is one of w, x, y, z and b is a register or an integer.
     */
    public static Program parseFrom(Reader r) {
        ImmutableList.Builder<Instruction> b = ImmutableList.builder();
        int nextInput = 0;
        int nextEqual = 0;
        int lineNumber = 0;
        try (BufferedReader br = new BufferedReader(r)) {
            String line;
            while ((line = br.readLine()) != null) {
                ++lineNumber;
                List<String> words = splitter.splitToList(line.replace('\t', ' '));
                if (words.isEmpty()) continue;
                try {
                    Opcode op = Opcode.parse(words.get(0));
                    int arity = op == Opcode.INP ? 1 : 2;
                    if (words.size() != arity + 1) {
                        throw new IllegalArgumentException(String.format("%s takes %d operand%s",
                                op.mnemonic(), arity, arity == 1 ? "" : "s"));
                    }
                    Register dest = Register.parse(words.get(1));
                    switch (op) {
                        case INP: b.add(Instruction.input(nextInput++, dest)); break;
                        case EQL: b.add(Instruction.equal(nextEqual++, dest, Operand.parse(words.get(2)))); break;
                        default: b.add(Instruction.binary(op, dest, Operand.parse(words.get(2))));
                    }
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException(String.format("line %d: %s: %s", lineNumber, e.getMessage(), line), e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new Program(b.build());
    }

    public int size() { return instructions.size(); }
    public Instruction get(int i) { return instructions.get(i); }

    /** @return the number of digits the program consumes */
    public int nInputs() { return nInputs; }

    /** @return the number of equality instructions, i.e. the width of a full breadcrumb */
    public int nComparisons() { return nComparisons; }

    /** @return the program consisting of the first n instructions */
    public Program prefix(int n) {
        Preconditions.checkPositionIndex(n, size());
        return new Program(instructions.subList(0, n));
    }

    @Override
    public Iterator<Instruction> iterator() { return instructions.iterator(); }

    @Override
    public String toString() { return Joiner.on('\n').join(instructions); }
}
