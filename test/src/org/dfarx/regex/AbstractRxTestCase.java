/* @LICENSE@  
 */

package org.dfarx.regex;

import static org.dfarx.regex.Misc.FS;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractRxTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.dfarx.regex.test");
    protected static final Level level = Level.FINEST; 
    
    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    } 

    public AbstractRxTestCase(String name) {
        super(name);
    }

    private final Logger rxLogger = Logger.getLogger("org.dfarx.regex");
    private final List<Handler> rxHandlers = new ArrayList<Handler>();
    private Level rxLevel;
    
    private void attach(Handler handler, Level level) {
        if (rxHandlers.isEmpty()) {
            rxLevel = rxLogger.getLevel();
        }
        handler.setLevel(level);
        rxLogger.addHandler(handler);
        rxLogger.setLevel(level);
        rxHandlers.add(handler);
    }

    /**
     * Send the package log of the running test to
     * <code>log/&lt;class&gt;/&lt;test&gt;.log</code>.
     */
    protected void logRxFile(Level level) {
        File logDir = new File("log" + FS + getClass().getSimpleName());
        if (!logDir.exists()) {
            logDir.mkdirs();
        }
        try {
            attach(new LogFileHandler(getClass().getSimpleName(), getName()), 
                level);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
    protected void logRxFile() {
        logRxFile(level);
    }

    /**
     * Capture the package log of the running test in memory.
     * 
     * @return the live list of captured records.
     */
    protected List<LogRecord> captureRx(Level level) {
        final List<LogRecord> records = 
            Collections.synchronizedList(new ArrayList<LogRecord>());
        attach(new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (isLoggable(record)) records.add(record);
            }
            @Override
            public void flush() {}
            @Override
            public void close() {}
        }, level);
        return records;
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        for (Handler handler : rxHandlers) {
            handler.flush();
            handler.close();
            rxLogger.removeHandler(handler);
        }
        if (!rxHandlers.isEmpty()) {
            rxLogger.setLevel(rxLevel);
            rxHandlers.clear();
        }
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }
    
    /**
     * Re-creates the syntax tree for an expression - useful for logging and
     * testing.
     */
    protected static AST astOf(String regex) {
        return RegexParser.parse(regex);
    }

    protected static NFA nfaOf(String regex) {
        return new NFA(astOf(regex));
    }

    protected static DFA dfaOf(String regex) {
        return new DFA(nfaOf(regex));
    }
}
