/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.util;

import java.io.IOError;
import java.io.IOException;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * The shared {@link Logger} for all processes, backends and pipelines.  Each
 * message is attributed to the class and method that issued it, rather than
 * to this class.
 */
public class CltkLogger {

    public static final Logger LOGGER = Logger.getLogger("org.cltk");

    public static final String LOG_FILE_PROPERTY = "cltk.logfile";

    static {
        String logFileName = System.getProperty(LOG_FILE_PROPERTY);
        if (logFileName != null) {
            try {
                Handler handler = new FileHandler(logFileName);
                LOGGER.addHandler(handler);
            } catch (IOException ioe) {
                throw new IOError(ioe);
            }
        }
    }

    private CltkLogger() { }

    /**
     * Returns {@code true} if log messages sent at this output level will be
     * shown to the user.
     */
    public static boolean isLoggable(Level outputLevel) {
        return LOGGER.isLoggable(outputLevel);
    }

    /**
     * Sets which messages are reported on the console according to the
     * desired level.
     */
    public static void setLevel(Level outputLevel) {
        Handler verboseHandler = new ConsoleHandler();
        verboseHandler.setLevel(outputLevel);
        LOGGER.addHandler(verboseHandler);
        LOGGER.setLevel(outputLevel);
        LOGGER.setUseParentHandlers(false);
    }

    /**
     * Prints {@link Level#FINER} messages, e.g., per-token or per-vector
     * progress.
     */
    public static void veryVerbose(String format, Object... args) {
        log(Level.FINER, format, args);
    }

    /**
     * Prints {@link Level#FINE} messages.
     */
    public static void verbose(String format, Object... args) {
        log(Level.FINE, format, args);
    }

    public static void info(String format, Object... args) {
        log(Level.INFO, format, args);
    }

    public static void warning(String format, Object... args) {
        log(Level.WARNING, format, args);
    }

    public static void severe(String format, Object... args) {
        log(Level.SEVERE, format, args);
    }

    private static void log(Level level, String format, Object[] args) {
        if (!LOGGER.isLoggable(level))
            return;
        // Index 0 is Thread.getStackTrace(), 1 is this method, 2 is the
        // public level method and 3 is whoever called it
        StackTraceElement[] callStack = Thread.currentThread().getStackTrace();
        StackTraceElement caller = callStack[Math.min(3, callStack.length - 1)];
        LOGGER.logp(level, caller.getClassName(), caller.getMethodName(),
                    String.format(format, args));
    }
}
