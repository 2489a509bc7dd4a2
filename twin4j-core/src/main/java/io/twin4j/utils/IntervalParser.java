package io.twin4j.utils;

import io.twin4j.core.SourceRange;
import io.twin4j.errors.ConfigurationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Parses unit schedules, lookback windows and source ranges.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Cron expressions with 5 fields ("*&#47;5 * * * *", seconds default to 0) or 6 fields
 *       ("0 0 2 * * *"); day-of-week uses the Unix numbering 0-7 with 0 and 7 for Sunday</li>
 *   <li>Human-readable intervals: "30m", "2h", "5 minutes", "1 day 3 hours"</li>
 *   <li>Source ranges: a record count ("100") or an interval ("1h")</li>
 * </ul>
 * <p>
 * Cron expressions are executed by Quartz {@link CronExpression}; {@link #normalizeCron(String)}
 * translates them into Quartz syntax.
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    /**
     * Parses and validates a cron expression.
     *
     * @param spec 5- or 6-field cron expression
     * @param zone time zone the expression is evaluated in; null means system default
     * @throws ConfigurationException on a wrong field count or out-of-range values
     */
    public static CronExpression parseCron(String spec, ZoneId zone) {
        String quartz = normalizeCron(spec);
        CronExpression exp;
        try {
            exp = new CronExpression(quartz);
        } catch (ParseException | RuntimeException ex) {
            throw new ConfigurationException(
                    "Invalid cron expression '" + spec + "': " + ex.getMessage(),
                    Map.of("cron", spec),
                    ex
            );
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault()));
        return exp;
    }

    /**
     * Computes the next fire time strictly after the later of the previous fire time and now.
     * Ticks missed while the process was down are therefore never replayed.
     *
     * @return next fire time, or {@code null} when the expression has no future occurrence
     */
    public static Instant computeNextRunAt(CronExpression cron, Instant previousFireAt, Instant now) {
        Objects.requireNonNull(cron, "cron must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Instant base = laterOf(previousFireAt, now);
        Date next = cron.getNextValidTimeAfter(Date.from(base));
        return next == null ? null : next.toInstant();
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    /**
     * Normalize cron expressions into Quartz syntax:
     * - 5 fields get a "0" seconds field prepended.
     * - day-of-week numbers are shifted from Unix (0=Sunday) to Quartz (1=Sunday).
     * - exactly one of day-of-month / day-of-week becomes "?".
     */
    public static String normalizeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new ConfigurationException("Cron expression must not be empty");
        }

        String[] parts = spec.trim().split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron(spec, "0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(spec, parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new ConfigurationException(
                "Cron expression must have 5 or 6 fields but has " + parts.length + ": '" + spec + "'",
                Map.of("cron", spec)
        );
    }

    private static String toQuartzCron(String original, String sec, String min, String hour,
                                       String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = toQuartzDayOfWeek(original, dayOfWeek);

        boolean domAny = "*".equals(dom) || "?".equals(dom);
        boolean dowAny = "*".equals(dow) || "?".equals(dow);

        if (dowAny) {
            dow = "?";
            if ("?".equals(dom)) {
                dom = "*";
            }
        } else if (domAny) {
            dom = "?";
        } else {
            throw new ConfigurationException(
                    "Cron expression cannot restrict both day-of-month and day-of-week: '" + original + "'",
                    Map.of("cron", original)
            );
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String toQuartzDayOfWeek(String original, String field) {
        if ("*".equals(field) || "?".equals(field)) {
            return field;
        }
        StringBuilder out = new StringBuilder();
        for (String part : field.split(",")) {
            if (out.length() > 0) {
                out.append(',');
            }
            int slash = part.indexOf('/');
            String range = slash >= 0 ? part.substring(0, slash) : part;
            String step = slash >= 0 ? part.substring(slash) : "";

            String[] ends = range.split("-", -1);
            for (int i = 0; i < ends.length; i++) {
                if (i > 0) {
                    out.append('-');
                }
                out.append(shiftDay(original, ends[i]));
            }
            out.append(step);
        }
        return out.toString();
    }

    // "5", "5L", "5#3" -> shift the leading day number; names (MON) and "*" pass through.
    private static String shiftDay(String original, String token) {
        int digits = 0;
        while (digits < token.length() && Character.isDigit(token.charAt(digits))) {
            digits++;
        }
        if (digits == 0) {
            return token;
        }
        int day = Integer.parseInt(token.substring(0, digits));
        if (day > 7) {
            throw new ConfigurationException(
                    "Day-of-week value out of range (0-7): " + day + " in '" + original + "'",
                    Map.of("cron", original)
            );
        }
        int quartzDay = (day % 7) + 1;
        return quartzDay + token.substring(digits);
    }

    /**
     * Returns true if the string is a cron expression accepted by {@link #parseCron(String, ZoneId)}.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (ConfigurationException ignored) {
            return false;
        }
    }

    /**
     * Parses a source range: digits only means a record count, anything else an interval.
     */
    public static SourceRange parseSourceRange(String spec) {
        if (spec == null || spec.isBlank()) {
            return null;
        }
        String s = spec.trim();
        if (s.matches("^\\d+$")) {
            try {
                return SourceRange.count(Integer.parseInt(s));
            } catch (NumberFormatException ex) {
                throw new ConfigurationException("Source range count out of range: " + spec);
            }
        }
        try {
            return SourceRange.window(parseHumanDuration(s));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Invalid source range format: " + spec, Map.of("sourceRange", spec), ex);
        }
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds = Long.parseLong(s);
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*(ms|[smhdw])$")) {
            long n = Long.parseLong(s.replaceAll("[^0-9]", ""));
            String unit = s.replaceAll("[0-9\\s]", "");
            return switch (unit) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                case "d" -> Duration.ofDays(n);
                case "w" -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + unit);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        Duration total = Duration.ZERO;
        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            ChronoUnit chrono = switch (unit) {
                case "week" -> ChronoUnit.WEEKS;
                case "day" -> ChronoUnit.DAYS;
                case "hour" -> ChronoUnit.HOURS;
                case "minute" -> ChronoUnit.MINUTES;
                case "second" -> ChronoUnit.SECONDS;
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            };
            total = total.plus(chrono.getDuration().multipliedBy(n));
        }

        if (total.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return total;
    }
}
