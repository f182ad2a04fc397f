package org.nlp2phenome.util;

/*
 * This file is part of NLP2Phenome.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * NLP2Phenome is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * NLP2Phenome is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with NLP2Phenome.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Minimal, dependency-free logger for NLP2Phenome batch runs.
 *
 * <p>Features:</p>
 * <ul>
 *   <li>Log levels (TRACE, DEBUG, INFO, WARN, ERROR)</li>
 *   <li>Timestamp + thread name in each line</li>
 *   <li>Named channels (e.g. {@code performance}) that prefix their output</li>
 *   <li>Configuration via system properties:
 *     <ul>
 *       <li><b>nlp2phenome.log.level</b> – minimum level to print (default: INFO)</li>
 *       <li><b>nlp2phenome.log.datetime</b> – pattern (default: yyyy-MM-dd HH:mm:ss)</li>
 *     </ul>
 *   </li>
 * </ul>
 */
public final class Logger {

    /** Log levels in increasing order of severity. */
    public enum Level {
        TRACE, DEBUG, INFO, WARN, ERROR;

        static Level parse(String s, Level fallback) {
            if (s == null) return fallback;
            try {
                return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                return fallback;
            }
        }
    }

    /** A named log sink; lines are tagged with the channel name. */
    public static final class Channel {
        private final String name;

        private Channel(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public void debug(String msg, Object... args) { log(Level.DEBUG, name, null, msg, args); }
        public void info (String msg, Object... args) { log(Level.INFO , name, null, msg, args); }
        public void warn (String msg, Object... args) { log(Level.WARN , name, null, msg, args); }
        public void error(String msg, Throwable t, Object... args) { log(Level.ERROR, name, t, msg, args); }
    }

    // ---- Configuration (read once at class load) ----
    private static final Level MIN_LEVEL =
            Level.parse(System.getProperty("nlp2phenome.log.level"), Level.INFO);

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern(
                    System.getProperty("nlp2phenome.log.datetime", "yyyy-MM-dd HH:mm:ss")
            );

    private static final Map<String, Channel> CHANNELS = new ConcurrentHashMap<>();

    private Logger() {}

    /** Returns the shared channel for {@code name}, creating it on first use. */
    public static Channel channel(String name) {
        return CHANNELS.computeIfAbsent(name, Channel::new);
    }

    public static boolean isEnabled(Level level) {
        return level.ordinal() >= MIN_LEVEL.ordinal();
    }

    public static void trace(String msg, Object... args) { log(Level.TRACE, null, null, msg, args); }
    public static void debug(String msg, Object... args) { log(Level.DEBUG, null, null, msg, args); }
    public static void info (String msg, Object... args) { log(Level.INFO , null, null, msg, args); }
    public static void warn (String msg, Object... args) { log(Level.WARN , null, null, msg, args); }
    public static void error(String msg, Object... args) { log(Level.ERROR, null, null, msg, args); }

    public static void warn (String msg, Throwable t, Object... args) { log(Level.WARN , null, t, msg, args); }
    public static void error(String msg, Throwable t, Object... args) { log(Level.ERROR, null, t, msg, args); }

    // ---- Core implementation ----

    private static void log(Level level, String channel, Throwable t, String msg, Object... args) {
        if (!isEnabled(level)) return;

        final String ts = LocalDateTime.now().format(TS);
        final String thread = Thread.currentThread().getName();
        final String body = format(msg, args);
        final String prefix = (channel == null) ? "" : channel + " ";

        // INFO and below -> stdout; WARN/ERROR -> stderr
        final PrintStream out = (level.ordinal() >= Level.WARN.ordinal()) ? System.err : System.out;

        synchronized (Logger.class) {
            out.println("[" + ts + "] [" + thread + "] " + level + " " + prefix + body);
            if (t != null) {
                t.printStackTrace(out);
            }
        }
    }

    /**
     * Replaces each "{}" with the stringified next argument.
     * If counts mismatch, extra args are appended.
     */
    static String format(String template, Object... args) {
        if (template == null) return "null";
        if (args == null || args.length == 0) return template;

        StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
        int argIdx = 0;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '}' && argIdx < args.length) {
                sb.append(String.valueOf(args[argIdx++]));
                i++; // skip '}'
            } else {
                sb.append(c);
            }
        }
        while (argIdx < args.length) {
            sb.append(' ').append(String.valueOf(args[argIdx++]));
        }
        return sb.toString();
    }
}
