package com.library.api.service;

import java.io.PrintStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes one line per call to a print stream, normally {@code System.out}:
 * {@code [tag] timestamp: message}, where the timestamp is the local wall-clock time of
 * the given {@link Clock}.
 */
public class ConsoleActivityLogger implements ActivityLogger {

    private final PrintStream out;
    private final Clock clock;
    private final String tag;
    private final DateTimeFormatter formatter;

    public ConsoleActivityLogger(PrintStream out, Clock clock, String tag, String timestampPattern) {
        this.out = out;
        this.clock = clock;
        this.tag = tag;
        this.formatter = DateTimeFormatter.ofPattern(timestampPattern);
    }

    @Override
    public void log(String message) {
        out.println("[" + tag + "] " + formatter.format(LocalDateTime.now(clock)) + ": " + message);
    }
}
