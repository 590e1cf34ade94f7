package org.chasm.compiler.diagnostics;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Maps the compiler's integer verbosity (0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE) onto the
 * Logback level of the {@value #COMPILER_LOGGER} logger, which every phase logs below.
 */
public final class CompilerLogger {

    /** Name of the parent logger of all compiler phases. */
    public static final String COMPILER_LOGGER = "org.chasm.compiler";

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for phase progress. */
    public static final int DEBUG = 3;
    /** Log level for per-statement detail. */
    public static final int TRACE = 4;

    private static final Level[] LEVELS = {Level.ERROR, Level.WARN, Level.INFO, Level.DEBUG, Level.TRACE};

    private CompilerLogger() {}

    /**
     * Sets the verbosity of all compiler phases. Values outside the known range are clamped.
     * This overrides any level the logging configuration gave {@value #COMPILER_LOGGER}.
     * @param verbosity The new verbosity.
     */
    public static void setLevel(int verbosity) {
        int clamped = Math.max(ERROR, Math.min(TRACE, verbosity));
        compilerLogger().setLevel(LEVELS[clamped]);
    }

    /**
     * @return The verbosity the compiler phases currently log at, derived from the effective Logback level.
     */
    public static int getLevel() {
        Level effective = compilerLogger().getEffectiveLevel();
        for (int verbosity = TRACE; verbosity > ERROR; verbosity--) {
            if (LEVELS[verbosity].isGreaterOrEqual(effective)) {
                return verbosity;
            }
        }
        return ERROR;
    }

    private static Logger compilerLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(COMPILER_LOGGER);
    }
}
