package arbor.core.output;

import arbor.core.result.Outcome;
import arbor.core.result.TestCaseResult;
import arbor.core.result.TestSuiteResult;
import arbor.core.result.Timer;
import arbor.core.util.ObjectChecker;

import java.io.IOException;
import java.io.Writer;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a human-readable summary of a result tree: one line per test result followed by a table counting the test
 * results of each outcome.
 *
 * Failure reasons are only printed when the verbosity reaches {@link ConsoleFormatter#REASON_VERBOSITY}. Table rows
 * follow the declaration order of {@link Outcome}, with the labels right-aligned to the longest label.
 */
public final class ConsoleFormatter implements ResultFormatter {
    public static final int REASON_VERBOSITY = 1;
    private static final String NEWLINE = System.lineSeparator();
    private final int verbosity;
    private final int width;
    private final boolean color;

    private ConsoleFormatter(int verbosity, int width, boolean color) {
        this.verbosity = verbosity;
        this.width = width;
        this.color = color;
    }

    /**
     * Returns a colored formatter sized to the current display width.
     *
     * @param verbosity The verbosity.
     * @return the formatter.
     */
    public static ConsoleFormatter forTerminal(int verbosity) {
        return new ConsoleFormatter(verbosity, Terminal.displayWidth(), true);
    }

    /**
     * Returns a formatter with the given settings.
     *
     * @param verbosity The verbosity.
     * @param width The width of separator lines.
     * @param color Whether or not outcome labels are colored.
     * @return the formatter.
     */
    public static ConsoleFormatter withSettings(int verbosity, int width, boolean color) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive but was: " + width);
        }
        return new ConsoleFormatter(verbosity, width, color);
    }

    @Override
    public void format(TestSuiteResult root, Writer writer) throws IOException {
        ObjectChecker.assertNonNull(root, writer);
        int labelWidth = longestLabel();
        List<TestCaseResult> tests = root.getAllTestResults();

        writer.write(Terminal.insertSeparator("Results", Terminal.DEFAULT_SEPARATOR, this.width));
        writer.write(NEWLINE);
        for (TestCaseResult test : tests) {
            writer.write(label(test.getOutcome(), labelWidth) + " " + test.getUid());
            writer.write(NEWLINE);
            if (this.verbosity >= REASON_VERBOSITY && test.getReason() != null) {
                writer.write("    " + test.getReason());
                writer.write(NEWLINE);
            }
        }

        writer.write(Terminal.separator(Terminal.DEFAULT_SEPARATOR, this.width));
        writer.write(NEWLINE);
        Map<Outcome, Integer> counts = countOutcomes(tests);
        for (Outcome outcome : Outcome.values()) {
            writer.write(label(outcome, labelWidth) + ": " + counts.get(outcome));
            writer.write(NEWLINE);
        }

        Outcome overall = root.getOutcome();
        String summary = overall + " in " + Timer.nanosToSecondsString(root.getElapsedNanos(), 3) + "s";
        writer.write(Terminal.insertSeparator(this.color ? Terminal.colorize(summary, colorOf(overall)) : summary, Terminal.DEFAULT_SEPARATOR, this.width));
        writer.write(NEWLINE);
        writer.flush();
    }

    /**
     * Returns the number of test results with each outcome, every outcome present.
     *
     * @param tests The test results.
     * @return the counts.
     */
    public static Map<Outcome, Integer> countOutcomes(List<TestCaseResult> tests) {
        Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
        for (Outcome outcome : Outcome.values()) {
            counts.put(outcome, 0);
        }
        for (TestCaseResult test : tests) {
            if (test.getOutcome() != null) {
                counts.merge(test.getOutcome(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private String label(Outcome outcome, int labelWidth) {
        String name = String.valueOf(outcome);
        StringBuilder padded = new StringBuilder();
        for (int i = name.length(); i < labelWidth; i++) {
            padded.append(' ');
        }
        padded.append(this.color && outcome != null ? Terminal.colorize(name, colorOf(outcome)) : name);
        return padded.toString();
    }

    private static int longestLabel() {
        int longest = 0;
        for (Outcome outcome : Outcome.values()) {
            longest = Math.max(longest, outcome.name().length());
        }
        return longest;
    }

    private static Terminal.Color colorOf(Outcome outcome) {
        switch (outcome) {
            case PASS:
                return Terminal.Color.GREEN;
            case XFAIL:
                return Terminal.Color.CYAN;
            case SKIP:
                return Terminal.Color.YELLOW;
            case ERROR:
                return Terminal.Color.MAGENTA;
            case FAIL:
                return Terminal.Color.RED;
            default:
                return Terminal.Color.BLUE;
        }
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { verbosity: " + this.verbosity + ", width: " + this.width + ", color: " + this.color + " }";
    }
}
