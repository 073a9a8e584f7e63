package com.vexrobotics.aimconnector;

import java.util.logging.*;

/**
 * Thin wrapper over java.util.logging that understands "{}" placeholders and
 * prefixes every message with the simple name of the owning class.
 * A trailing Throwable argument that has no placeholder is attached to the record.
 */
public class Log {
    private final Logger logger;
    private final String label;

    public static Log getLogger(Class<?> cls) {
        return new Log(cls);
    }

    public Log(Class<?> cls) {
        logger = Logger.getLogger(cls.getName());
        label = cls.getSimpleName();
    }

    public void info(String fmt, Object... args) {
        log(Level.INFO, fmt, args);
    }

    public void warn(String fmt, Object... args) {
        log(Level.WARNING, fmt, args);
    }

    public void error(String fmt, Object... args) {
        log(Level.SEVERE, fmt, args);
    }

    public void debug(String fmt, Object... args) {
        log(Level.FINE, fmt, args);
    }

    private void log(Level level, String fmt, Object[] args) {
        if (!logger.isLoggable(level)) return;
        LogRecord record = new LogRecord(level, format(fmt, args));
        record.setLoggerName(logger.getName());
        Throwable thrown = trailingThrowable(fmt, args);
        if (thrown != null) record.setThrown(thrown);
        logger.log(record);
    }

    private static Throwable trailingThrowable(String fmt, Object[] args) {
        if (args.length == 0 || !(args[args.length - 1] instanceof Throwable)) return null;
        int placeholders = fmt.split("\\{}", -1).length - 1;
        return placeholders < args.length ? (Throwable) args[args.length - 1] : null;
    }

    String format(String fmt, Object[] args) {
        String[] parts = fmt.split("\\{}", -1); // -1 keeps trailing empty part
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(label).append("] ");
        for (int i = 0; i < parts.length - 1; i++) {
            sb.append(parts[i]);
            sb.append(i < args.length ? String.valueOf(args[i]) : "{}");
        }
        sb.append(parts[parts.length - 1]);
        return sb.toString();
    }

    public static class OneLineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            String line = String.format(
                    "[%1$tF %1$tT] [%2$-5s] [%3$s] %4$s%n",
                    record.getMillis(),
                    levelName(record.getLevel()),
                    Thread.currentThread().getName(),
                    formatMessage(record));
            if (record.getThrown() == null) return line;
            return line + Utilities.stackTraceToString(record.getThrown());
        }

        public static String levelName(Level level) {
            int val = level.intValue();
            if (val >= Level.SEVERE.intValue()) return "ERROR";
            if (val >= Level.WARNING.intValue()) return "WARN";
            if (val >= Level.INFO.intValue()) return "INFO";
            if (val >= Level.FINE.intValue()) return "DEBUG";
            return "TRACE";
        }
    }

    static final Formatter ONE_LINE_FORMATTER = new OneLineFormatter();

    static {
        Logger root = Logger.getLogger("");
        for (Handler handler : root.getHandlers()) {
            handler.setFormatter(ONE_LINE_FORMATTER);
        }
        if (System.getProperty("aim.debug") != null) {
            root.setLevel(Level.FINE);
            for (Handler handler : root.getHandlers()) handler.setLevel(Level.FINE);
        }
    }
}
