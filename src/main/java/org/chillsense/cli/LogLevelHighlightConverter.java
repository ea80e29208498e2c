package org.chillsense.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.Locale;
import java.util.function.BooleanSupplier;

/**
 * Logback converter that colors the level column of plain stderr output.
 *
 * <p>Usage: {@code %levelColor{mode}(%-5level)} where mode is {@code auto} (the default),
 * {@code always} or {@code never}. In {@code auto} mode colors are only written when the JVM
 * has an interactive console. Under {@code serve} the editor owns both pipes and shows stderr
 * verbatim in its output panel, so escape sequences are left out there.</p>
 *
 * <p>Colors:
 * <ul>
 *   <li>ERROR - Red</li>
 *   <li>WARN - Yellow</li>
 *   <li>DEBUG/TRACE - Gray (skipped source lines are reported at DEBUG)</li>
 *   <li>INFO - Default</li>
 * </ul>
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_GRAY = "\u001B[90m";

    enum ColorMode { AUTO, ALWAYS, NEVER }

    private final BooleanSupplier interactive;
    private ColorMode mode = ColorMode.AUTO;

    public LogLevelHighlightConverter() {
        this(() -> System.console() != null);
    }

    LogLevelHighlightConverter(BooleanSupplier interactive) {
        this.interactive = interactive;
    }

    @Override
    public void start() {
        String option = getFirstOption();
        if (option != null && !option.isBlank()) {
            try {
                mode = ColorMode.valueOf(option.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                addWarn("Unknown levelColor mode '" + option + "', using auto");
                mode = ColorMode.AUTO;
            }
        }
        super.start();
    }

    ColorMode mode() {
        return mode;
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!colorsEnabled()) {
            return in;
        }
        return switch (event.getLevel().toInt()) {
            case Level.ERROR_INT -> ANSI_RED + in + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + in + ANSI_RESET;
            case Level.DEBUG_INT, Level.TRACE_INT -> ANSI_GRAY + in + ANSI_RESET;
            default -> in;
        };
    }

    private boolean colorsEnabled() {
        return switch (mode) {
            case ALWAYS -> true;
            case NEVER -> false;
            case AUTO -> interactive.getAsBoolean();
        };
    }
}
