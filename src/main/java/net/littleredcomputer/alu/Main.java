package net.littleredcomputer.alu;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

public class Main {
    private static final Joiner spaceJoiner = Joiner.on(' ');

    private static Options options() {
        return new Options()
                .addOption("task", true, "largest, smallest, both, constraint, symbolic or run")
                .addOption("problem", true, "filename of ALU program, or - for stdin")
                .addOption("inputs", true, "digits to run the program with (task run)")
                .addOption("register", true, "register that must reach the target [z]")
                .addOption("target", true, "value the register must reach [0]")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static int[] digits(CommandLine cmd) {
        if (!cmd.hasOption("inputs")) throw new IllegalArgumentException("Must specify -inputs");
        String s = CharMatcher.whitespace().removeFrom(cmd.getOptionValue("inputs"));
        if (!CharMatcher.inRange('1', '9').matchesAllOf(s)) throw new IllegalArgumentException("inputs must be digits 1-9");
        return s.chars().map(c -> c - '0').toArray();
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static boolean report(String label, Optional<List<Integer>> answer) {
        if (answer.isPresent()) {
            System.out.println(label + Inverter.toNumber(answer.get()));
            return true;
        }
        System.out.println(label + "no solution");
        return false;
    }

    public static void main(String[] args) throws ParseException, FileNotFoundException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        String task = cmd.getOptionValue("task", "both");
        Program program = Program.parseFrom(problem(cmd));
        Register register = Register.parse(cmd.getOptionValue("register", "z"));
        long target = Long.parseLong(cmd.getOptionValue("target", "0"));
        Inverter inverter = new Inverter(program, register, target).setLogInterval(logInterval(cmd));
        boolean ok;
        switch (task) {
            case "largest":
                ok = report("", inverter.largest());
                break;
            case "smallest":
                ok = report("", inverter.smallest());
                break;
            case "both":
                ok = report("largest ", inverter.largest()) & report("smallest ", inverter.smallest());
                break;
            case "constraint": {
                Optional<Constraint> c = inverter.constraint();
                c.ifPresent(System.out::println);
                if (!c.isPresent()) System.out.println("no solution");
                ok = c.isPresent();
                break;
            }
            case "symbolic":
                System.out.print(inverter.symbolic());
                ok = true;
                break;
            case "run": {
                Optional<State> s = Execution.run(program, Environment.simple(digits(cmd)));
                if (s.isPresent()) {
                    long[] r = s.get().registers();
                    System.out.println(spaceJoiner.join(r[0], r[1], r[2], r[3]));
                } else {
                    System.out.println("no solution");
                }
                ok = s.isPresent();
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
        if (!ok) System.exit(1);
    }
}
