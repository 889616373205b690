package io.trigger4j.utils;

import io.trigger4j.core.ScheduleDescriptor;
import io.trigger4j.core.ScheduleException;

/**
 * Parses trigger schedule strings into a {@link ScheduleDescriptor}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Interval in minutes: a string of decimal digits only, e.g. "30"</li>
 *   <li>Cron expression: exactly five whitespace separated fields, e.g. "0 9 * * mon-fri"</li>
 * </ul>
 * <p>
 * Cron field grammar is not checked here; it is checked when the first fire time is computed
 * (see {@link NextFireCalculator}).
 */
public final class ScheduleParser {
    private ScheduleParser() {
    }

    public static ScheduleDescriptor parse(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new ScheduleException(ScheduleException.Reason.MALFORMED_CRON, "schedule must not be blank");
        }

        if (schedule.matches("^\\d+$")) {
            int minutes;
            try {
                minutes = Integer.parseInt(schedule);
            } catch (NumberFormatException ex) {
                throw new ScheduleException(ScheduleException.Reason.INVALID_INTERVAL,
                        "Interval minutes out of range: " + schedule, ex);
            }
            if (minutes <= 0) {
                throw new ScheduleException(ScheduleException.Reason.INVALID_INTERVAL,
                        "Interval minutes must be positive: " + schedule);
            }
            return new ScheduleDescriptor.Interval(minutes);
        }

        String[] parts = schedule.trim().split("\\s+");
        if (parts.length != 5) {
            throw new ScheduleException(ScheduleException.Reason.MALFORMED_CRON,
                    "Cron expression must have 5 parts, got " + parts.length + ": " + schedule);
        }
        return new ScheduleDescriptor.Cron(parts[0], parts[1], parts[2], parts[3], parts[4]);
    }
}
