package arbor.core.output;

/**
 * Helpers for laying text out on the terminal: separators sized to the display width and ANSI colors.
 */
public final class Terminal {
    public static final String COLUMNS_VARIABLE = "COLUMNS";
    public static final int DEFAULT_WIDTH = 80;
    public static final char DEFAULT_SEPARATOR = '=';
    private static final String RESET = "\u001B[0m";
    private static final String ESCAPE_PATTERN = "\u001B\\[[0-9;]*m";

    public enum Color {
        RED("\u001B[31m"),
        GREEN("\u001B[32m"),
        YELLOW("\u001B[33m"),
        BLUE("\u001B[34m"),
        MAGENTA("\u001B[35m"),
        CYAN("\u001B[36m");

        private final String code;

        Color(String code) {
            this.code = code;
        }
    }

    private Terminal() {}

    /**
     * Returns the display width given by the {@code COLUMNS} environment variable, or {@link Terminal#DEFAULT_WIDTH} if
     * it is unset or not a positive integer.
     *
     * @return the display width.
     */
    public static int displayWidth() {
        return parseWidth(System.getenv(COLUMNS_VARIABLE));
    }

    static int parseWidth(String columns) {
        if (columns == null) {
            return DEFAULT_WIDTH;
        }
        try {
            int width = Integer.parseInt(columns.trim());
            return (width > 0) ? width : DEFAULT_WIDTH;
        } catch (NumberFormatException e) {
            return DEFAULT_WIDTH;
        }
    }

    /**
     * Returns a line made of the given character repeated across the given width.
     *
     * @param character The separator character.
     * @param width The width.
     * @return the separator line.
     */
    public static String separator(char character, int width) {
        StringBuilder builder = new StringBuilder(Math.max(width, 0));
        for (int i = 0; i < width; i++) {
            builder.append(character);
        }
        return builder.toString();
    }

    /**
     * Returns a separator line of the given width with the given text centered in it. Color codes in the text take up
     * no room. Text too long to fit leaves a single separator character on each side.
     *
     * @param text The text to center.
     * @param character The separator character.
     * @param width The width.
     * @return the separator line.
     */
    public static String insertSeparator(String text, char character, int width) {
        String padded = " " + text + " ";
        int remaining = width - visibleLength(padded);
        int left = Math.max(remaining / 2, 1);
        int right = Math.max(remaining - remaining / 2, 1);
        return separator(character, left) + padded + separator(character, right);
    }

    /**
     * Returns the number of characters of the given text that show up on the terminal.
     *
     * @param text The text, possibly colored.
     * @return the visible length.
     */
    public static int visibleLength(String text) {
        return text.replaceAll(ESCAPE_PATTERN, "").length();
    }

    /**
     * Wraps the given text in the escape codes of the given color.
     *
     * @param text The text.
     * @param color The color.
     * @return the colored text.
     */
    public static String colorize(String text, Color color) {
        return color.code + text + RESET;
    }
}
