package io.trigger4j.utils;

import io.trigger4j.core.ScheduleDescriptor;
import io.trigger4j.core.ScheduleException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes fire times for a {@link ScheduleDescriptor}.
 * <p>
 * Cron descriptors are evaluated with Quartz {@link CronExpression}s built from the five standard
 * fields plus a leading seconds field of "0":
 * <ul>
 *   <li>day-of-week numbers follow standard cron (0-7, 0 and 7 are Sunday) and are mapped to Quartz numbering</li>
 *   <li>when both day-of-month and day-of-week are restricted a time matches if either matches,
 *       computed as the earliest of two Quartz expressions</li>
 * </ul>
 */
public final class NextFireCalculator {
    private static final Pattern DAY_RANGE = Pattern.compile("^(\\d+)(?:-(\\d+))?$");

    private NextFireCalculator() {
    }

    /**
     * First fire time of a freshly registered job.
     *
     * @throws ScheduleException with reason INVALID_CRON_FIELD if a cron field cannot be evaluated
     */
    public static Instant firstFireTime(ScheduleDescriptor schedule, ZoneId zone, Instant registeredAt) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(registeredAt, "registeredAt must not be null");

        if (schedule instanceof ScheduleDescriptor.Interval interval) {
            return registeredAt.plus(interval.duration());
        }
        return nextCronMatch((ScheduleDescriptor.Cron) schedule, zone, registeredAt);
    }

    /**
     * Next fire time after a completed firing.
     *
     * @param previousFireAt fire time the completed firing was scheduled for
     * @param finishedAt     time the callback returned
     */
    public static Instant nextFireTime(ScheduleDescriptor schedule,
                                       ZoneId zone,
                                       Instant previousFireAt,
                                       Instant finishedAt) {
        Objects.requireNonNull(schedule, "schedule must not be null");

        Instant base = laterOf(previousFireAt, finishedAt);
        if (base == null) {
            throw new IllegalArgumentException("previousFireAt or finishedAt must be set");
        }

        if (schedule instanceof ScheduleDescriptor.Interval interval) {
            return base.plus(interval.duration());
        }
        return nextCronMatch((ScheduleDescriptor.Cron) schedule, zone, base);
    }

    /* ================= cron ================= */

    /**
     * First time strictly after {@code after} matching the cron fields, at minute resolution.
     */
    public static Instant nextCronMatch(ScheduleDescriptor.Cron cron, ZoneId zone, Instant after) {
        Objects.requireNonNull(cron, "cron must not be null");
        Objects.requireNonNull(after, "after must not be null");
        TimeZone timeZone = TimeZone.getTimeZone(zone != null ? zone : ZoneId.of("UTC"));

        Instant best = null;
        for (String expression : toQuartzExpressions(cron)) {
            CronExpression exp = compile(expression, cron);
            exp.setTimeZone(timeZone);

            Date next = exp.getNextValidTimeAfter(Date.from(after));
            if (next != null && (best == null || next.toInstant().isBefore(best))) {
                best = next.toInstant();
            }
        }

        if (best == null) {
            throw new ScheduleException(ScheduleException.Reason.INVALID_CRON_FIELD,
                    "Cron expression produced no next execution time: " + cron);
        }
        return best;
    }

    /**
     * Quartz expressions equivalent to the cron fields. One expression unless both day fields are
     * restricted.
     */
    public static List<String> toQuartzExpressions(ScheduleDescriptor.Cron cron) {
        String dom = cron.day();
        String dow = toQuartzDayOfWeek(cron.dayOfWeek());

        boolean anyDom = isUnrestricted(dom);
        boolean anyDow = isUnrestricted(dow);

        List<String> expressions = new ArrayList<>(2);
        if (anyDow) {
            expressions.add(join(cron, anyDom ? "*" : dom, "?"));
        } else if (anyDom) {
            expressions.add(join(cron, "?", dow));
        } else {
            expressions.add(join(cron, dom, "?"));
            expressions.add(join(cron, "?", dow));
        }
        return expressions;
    }

    static String toQuartzDayOfWeek(String field) {
        if (isUnrestricted(field)) {
            return field;
        }

        String[] items = field.split(",", -1);
        List<String> out = new ArrayList<>(items.length);
        for (String item : items) {
            if (item.isEmpty()) {
                throw invalidField("day_of_week", field);
            }

            int cut = indexOfStepOrNth(item);
            String base = cut < 0 ? item : item.substring(0, cut);
            String suffix = cut < 0 ? "" : item.substring(cut);

            Matcher m = DAY_RANGE.matcher(base);
            if (m.matches()) {
                int start = parseDay(m.group(1), field);
                if (m.group(2) == null) {
                    base = String.valueOf(toQuartzDay(start));
                } else {
                    int end = parseDay(m.group(2), field);
                    if (end < start) {
                        throw invalidField("day_of_week", field);
                    }
                    int quartzEnd = (start == 0 && end == 7) ? 7 : toQuartzDay(end);
                    base = toQuartzDay(start) + "-" + quartzEnd;
                }
            }
            out.add(base + suffix);
        }
        return String.join(",", out);
    }

    private static CronExpression compile(String expression, ScheduleDescriptor.Cron cron) {
        try {
            return new CronExpression(expression);
        } catch (ParseException | RuntimeException ex) {
            throw new ScheduleException(ScheduleException.Reason.INVALID_CRON_FIELD,
                    "Invalid cron expression '" + cron + "': " + ex.getMessage(), ex);
        }
    }

    private static String join(ScheduleDescriptor.Cron cron, String dayOfMonth, String dayOfWeek) {
        return String.join(" ", "0", cron.minute(), cron.hour(), dayOfMonth, cron.month(), dayOfWeek);
    }

    private static boolean isUnrestricted(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static int indexOfStepOrNth(String item) {
        int slash = item.indexOf('/');
        int hash = item.indexOf('#');
        if (slash < 0) return hash;
        if (hash < 0) return slash;
        return Math.min(slash, hash);
    }

    private static int parseDay(String digits, String field) {
        int day;
        try {
            day = Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            throw invalidField("day_of_week", field);
        }
        if (day > 7) {
            throw invalidField("day_of_week", field);
        }
        return day;
    }

    // cron: 0=SUN..6=SAT, 7=SUN; quartz: 1=SUN..7=SAT
    private static int toQuartzDay(int cronDay) {
        return (cronDay % 7) + 1;
    }

    private static ScheduleException invalidField(String name, String value) {
        return new ScheduleException(ScheduleException.Reason.INVALID_CRON_FIELD,
                "Invalid cron field " + name + ": " + value);
    }

    /* ================= helper ================= */

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
