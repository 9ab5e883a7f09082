package util;

import java.io.PrintStream;

/**
 * Console diagnostics, gated by the output level chosen on the command line (higher means more output)
 */
public class Logger {
    private static int outputLevel = 0;
    private static PrintStream out = System.err;

    private static boolean shouldLog(int level) {
        return level <= outputLevel;
    }

    public static void setOutputLevel(int level) {
        outputLevel = level;
    }

    public static int getOutputLevel() {
        return outputLevel;
    }

    /**
     * Redirect diagnostics, standard error by default
     *
     * @param stream stream to print to
     */
    public static void setOutput(PrintStream stream) {
        out = stream;
    }

    /**
     * Print a line if the output level is at least the given level
     *
     * @param level minimum output level for the message to be printed
     * @param s message
     */
    public static void println(int level, String s) {
        if (shouldLog(level)) {
            out.println(s);
        }
    }
}
