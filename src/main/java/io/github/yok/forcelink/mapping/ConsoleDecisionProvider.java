package io.github.yok.forcelink.mapping;

import io.github.yok.forcelink.exception.ForceLinkException;
import io.github.yok.forcelink.model.FieldChange;
import io.github.yok.forcelink.model.MappingDecision;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Locale;

/**
 * Interactive decision provider reading answers from a terminal.
 *
 * <p>
 * For each column it asks {@code y/n}; on {@code y} it asks for the target field name, where an
 * empty answer keeps the column name. Invalid answers repeat the question. End of input is treated
 * as an error.
 * </p>
 */
public class ConsoleDecisionProvider implements DecisionProvider {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleDecisionProvider(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    /**
     * Creates a provider bound to {@code System.in} and {@code System.out}.
     *
     * @return console provider
     */
    public static ConsoleDecisionProvider system() {
        return new ConsoleDecisionProvider(
                new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset())),
                System.out);
    }

    @Override
    public MappingDecision mapDecision(String column) {
        if (!askYesNo("Map column '" + column + "'? (y/n): ")) {
            return MappingDecision.skip();
        }
        out.print("Target field for '" + column + "' (Enter to keep '" + column + "'): ");
        out.flush();
        return MappingDecision.mapTo(readLine());
    }

    @Override
    public boolean confirm(List<FieldChange> diff) {
        out.println("Proposed changes:");
        for (FieldChange change : diff) {
            out.println("  " + change.getField() + ": '" + change.getCurrentValue() + "' -> '"
                    + change.getProposedValue() + "'");
        }
        return askYesNo("Apply these changes? (yes/no): ");
    }

    private boolean askYesNo(String prompt) {
        while (true) {
            out.print(prompt);
            out.flush();
            String answer = readLine().trim().toLowerCase(Locale.ROOT);
            switch (answer) {
                case "y":
                case "yes":
                    return true;
                case "n":
                case "no":
                    return false;
                default:
                    out.println("Please answer y(es) or n(o).");
            }
        }
    }

    private String readLine() {
        try {
            String line = in.readLine();
            if (line == null) {
                throw new ForceLinkException("Input closed while waiting for an answer.");
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read answer", e);
        }
    }
}
