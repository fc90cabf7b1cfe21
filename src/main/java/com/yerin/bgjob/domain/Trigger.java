package com.yerin.bgjob.domain;

import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.JobErrorCode;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * When a scheduled job fires: either a cron expression or a fixed interval, never both.
 */
public sealed interface Trigger permits Trigger.Cron, Trigger.Interval {

    String EVERY_PREFIX = "@every ";

    Instant nextRunAfter(Instant now, ZoneId zone);

    /**
     * Parses a trigger expression. {@code @every <duration>} yields an {@link Interval}
     * (e.g. {@code @every 1s}, {@code @every 1h30m}); anything else is a cron expression.
     */
    static Trigger parse(String text) {
        if (text == null || text.isBlank()) {
            throw new AppException(JobErrorCode.INVALID_TRIGGER);
        }
        String s = text.trim();
        if (s.toLowerCase(Locale.ROOT).startsWith(EVERY_PREFIX)) {
            return new Interval(parseDuration(s.substring(EVERY_PREFIX.length())));
        }
        return new Cron(s);
    }

    /**
     * Builds the trigger from the two persisted columns, exactly one of which must be set.
     */
    static Trigger fromColumns(String cronExpression, Long intervalSeconds) {
        boolean hasCron = cronExpression != null && !cronExpression.isBlank();
        boolean hasInterval = intervalSeconds != null && intervalSeconds > 0;
        if (hasCron == hasInterval) {
            throw new AppException(JobErrorCode.INVALID_TRIGGER);
        }
        return hasCron ? parse(cronExpression) : new Interval(Duration.ofSeconds(intervalSeconds));
    }

    static Duration parseDuration(String text) {
        Matcher m = Interval.PART.matcher(text.trim().toLowerCase(Locale.ROOT));
        Duration total = Duration.ZERO;
        int end = 0;
        while (m.find()) {
            if (m.start() != end) break;
            long n = Long.parseLong(m.group(1));
            total = total.plus(switch (m.group(2)) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                default -> Duration.ofDays(n);
            });
            end = m.end();
        }
        if (end == 0 || end != text.trim().length()) {
            throw new AppException(JobErrorCode.INVALID_TRIGGER.withDetail("invalid duration: " + text));
        }
        return total;
    }

    record Cron(String expression) implements Trigger {

        public Cron {
            expression = normalize(expression);
            if (!CronExpression.isValidExpression(expression)) {
                throw new AppException(JobErrorCode.INVALID_TRIGGER.withDetail("invalid cron expression: " + expression));
            }
        }

        // five-field standard cron gets a leading seconds field
        private static String normalize(String expr) {
            String e = expr == null ? "" : expr.trim();
            if (!e.startsWith("@") && e.split("\\s+").length == 5) {
                return "0 " + e;
            }
            return e;
        }

        @Override
        public Instant nextRunAfter(Instant now, ZoneId zone) {
            ZonedDateTime next = CronExpression.parse(expression).next(now.atZone(zone));
            if (next == null) {
                throw new AppException(JobErrorCode.INVALID_TRIGGER.withDetail("cron never fires: " + expression));
            }
            return next.toInstant();
        }
    }

    record Interval(Duration period) implements Trigger {

        static final Pattern PART = Pattern.compile("(\\d+)(ms|s|m|h|d)");

        public Interval {
            if (period == null || period.compareTo(Duration.ofSeconds(1)) < 0) {
                throw new AppException(JobErrorCode.INVALID_TRIGGER.withDetail("interval must be at least 1s"));
            }
        }

        @Override
        public Instant nextRunAfter(Instant now, ZoneId zone) {
            return now.plus(period);
        }
    }
}
