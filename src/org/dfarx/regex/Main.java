/* @LICENSE@  
 */
package org.dfarx.regex;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Command line front end. Compiles the expression given as arguments, prints
 * the GraphViz rendering of its DFA, then classifies each line of standard
 * input as <code>Accept</code> or <code>Reject</code>.
 * <p>
 * Usage: <code>dfarx &lt;regex&gt;</code>. The arguments are joined with
 * single spaces, so an expression with consecutive spaces must be quoted.
 */
public final class Main {

    private static final Logger logger = Logger.getLogger("org.dfarx.regex");
    private static final Level level = Level.FINE;

    static final String USAGE = "Usage: dfarx <regex>";
    static final String LOGGING_PROPERTIES = "/logging.properties";

    private Main() {}

    public static void main(String[] args) {
        configureLogging(System.err);
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * @return the process exit status: 0 on success (including the usage
     *         message), 1 on a malformed expression or an input error.
     */
    static int run(String[] args, InputStream in, PrintStream out, 
            PrintStream err) {

        final String regex = join(args);
        if (regex.isEmpty()) {
            out.println(USAGE);
            return 0;
        }

        final Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            err.println(e.getMessage());
            return 1;
        } catch (ConstructionException e) {
            err.println(e.getMessage());
            return 1;
        }

        out.println("---[ DFA Graph ]----------------");
        out.println(pattern.toGraph());
        out.println("--------------------------------");

        out.println("Enter strings to test them:");
        final BufferedReader br = new BufferedReader(
            new InputStreamReader(in, Charset.defaultCharset()));
        try {
            for (String line; (line = br.readLine()) != null;) {
                out.println((pattern.matches(line) ? "Accept " : "Reject ") 
                    + line);
            }
        } catch (IOException e) {
            logger.log(level, "classification input failed", e);
            err.println("Error reading from stdin: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    static String join(String[] args) {
        StringBuilder sb = new StringBuilder();
        for (String arg : args) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(arg);
        }
        return sb.toString();
    }

    /*
     * An explicit java.util.logging.config.file wins over the bundled
     * configuration.
     */
    static void configureLogging(PrintStream err) {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        InputStream is = Main.class.getResourceAsStream(LOGGING_PROPERTIES);
        if (is == null) {
            return;
        }
        try {
            try {
                LogManager.getLogManager().readConfiguration(is);
            } finally {
                is.close();
            }
        } catch (IOException e) {
            err.println("cannot read " + LOGGING_PROPERTIES + ": " + e);
        }
    }
}
