// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.relaykit.core;

/**
 * ANSI palette for debug output, disabled automatically outside a TTY unless
 * {@code FORCE_COLOR=true} is set.
 *
 * <ul>
 * <li><b>TEAL</b> - success
 * <li><b>CORAL</b> - errors and failed transactions
 * <li><b>INDIGO</b> - transport exchanges
 * <li><b>LAVENDER</b> - submissions
 * <li><b>SLATE</b> - pending states and metadata
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    public static final String RESET = ansi("0");
    public static final String TEAL = ansi("38;5;44");
    public static final String CORAL = ansi("38;5;204");
    public static final String INDIGO = ansi("38;5;105");
    public static final String LAVENDER = ansi("38;5;183");
    public static final String SLATE = ansi("38;5;245");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
