package com.ficshelf;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide log of project activity: a timestamped {@code [LEVEL]} line per
 * event, appended to the log file and echoed to the console when enabled.
 * Classes fetch the shared instance with {@link #get()}, which stays null until
 * {@link #initialize(Path, boolean)} is called, so callers must tolerate a null logger.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static AppLogger instance;

    private final PrintStream file;
    private final PrintStream console;
    private final boolean consoleEnabled;
    private int warnings;
    private int errors;

    private AppLogger(Path logFile, boolean consoleEnabled) throws IOException {
        if (logFile.getParent() != null) {
            Files.createDirectories(logFile.getParent());
        }
        this.file = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);
        this.console = System.out;
        this.consoleEnabled = consoleEnabled;

        file.println();
        file.println("=".repeat(60));
        file.println("FicShelf session " + LocalDateTime.now().format(TIME_FORMAT));
        file.println("=".repeat(60));
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled);
        }
    }

    public static AppLogger get() {
        return instance;
    }

    public void info(String message) {
        write("INFO", message, null);
    }

    public synchronized void warn(String message) {
        warnings++;
        write("WARN", message, null);
    }

    public synchronized void error(String message, Throwable t) {
        errors++;
        write("ERROR", message, t);
    }

    public void error(String message) {
        error(message, null);
    }

    /**
     * Batch progress ({@code [i/n]} lines). Reaches the console even when
     * console logging is off.
     */
    public void progress(String message) {
        write("INFO", message, null);
        if (!consoleEnabled) {
            console.println(message);
        }
    }

    /**
     * Untimestamped text such as the startup banner.
     */
    public void console(String message) {
        file.println(message);
        if (consoleEnabled) {
            console.println(message);
        }
    }

    private synchronized void write(String level, String message, Throwable t) {
        String line = "[" + LocalDateTime.now().format(TIME_FORMAT) + "] [" + level + "] " + message;
        file.println(line);
        if (t != null) {
            t.printStackTrace(file);
        }
        if (consoleEnabled) {
            console.println(line);
            if (t != null) {
                t.printStackTrace(console);
            }
        }
    }

    /**
     * Write the session's warning and error totals and close the log file.
     */
    public synchronized void close() {
        file.println("Session ended with " + warnings + " warning(s), " + errors + " error(s)");
        file.close();
    }
}
