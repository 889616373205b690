package io.trigger4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Normalized form of a schedule string: either a fixed interval in minutes or five cron fields.
 */
public interface ScheduleDescriptor {

    record Interval(int minutes) implements ScheduleDescriptor {
        public Interval {
            if (minutes <= 0) {
                throw new IllegalArgumentException("minutes must be positive");
            }
        }

        public Duration duration() {
            return Duration.ofMinutes(minutes);
        }
    }

    /**
     * Cron fields in positional order. Field grammar is not checked here.
     */
    record Cron(String minute, String hour, String day, String month, String dayOfWeek) implements ScheduleDescriptor {
        public Cron {
            Objects.requireNonNull(minute, "minute must not be null");
            Objects.requireNonNull(hour, "hour must not be null");
            Objects.requireNonNull(day, "day must not be null");
            Objects.requireNonNull(month, "month must not be null");
            Objects.requireNonNull(dayOfWeek, "dayOfWeek must not be null");
        }

        @Override
        public String toString() {
            return String.join(" ", minute, hour, day, month, dayOfWeek);
        }
    }
}
