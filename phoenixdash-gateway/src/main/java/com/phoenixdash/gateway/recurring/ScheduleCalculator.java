package com.phoenixdash.gateway.recurring;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the next execution instant of a recurring payment. All calendar
 * arithmetic is done in UTC.
 */
public final class ScheduleCalculator {

    private ScheduleCalculator() {
    }

    public static final String DEFAULT_TIME_OF_DAY = "09:00";
    /** Monday, with 0 = Sunday. */
    public static final int DEFAULT_DAY_OF_WEEK = 1;
    public static final int DEFAULT_DAY_OF_MONTH = 1;

    private static final Pattern TIME_OF_DAY_RE = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    public static Instant nextRunAt(RecurringPayment payment, Instant anchor) {
        return nextRunAt(payment.getFrequency(), payment.getTimeOfDay(), payment.getDayOfWeek(),
                payment.getDayOfMonth(), anchor);
    }

    /**
     * Next run strictly after {@code anchor}.
     *
     * @param timeOfDay  "HH:mm", ignored by the minute/hour kinds
     * @param dayOfWeek  0 (Sunday) to 6, weekly only, null = Monday
     * @param dayOfMonth 1 to 31, monthly only, null = 1; clamped to the month's length
     */
    public static Instant nextRunAt(Frequency frequency, String timeOfDay, Integer dayOfWeek,
            Integer dayOfMonth, Instant anchor) {
        if (frequency == null) {
            throw new IllegalArgumentException("Frequency is required");
        }
        if (frequency.fixedInterval() != null) {
            return anchor.plus(frequency.fixedInterval());
        }

        LocalTime time = parseTimeOfDay(timeOfDay != null ? timeOfDay : DEFAULT_TIME_OF_DAY);
        ZonedDateTime now = anchor.atZone(ZoneOffset.UTC);
        LocalDate today = now.toLocalDate();

        switch (frequency) {
            case DAILY: {
                ZonedDateTime next = today.atTime(time).atZone(ZoneOffset.UTC);
                if (!next.toInstant().isAfter(anchor)) {
                    next = next.plusDays(1);
                }
                return next.toInstant();
            }
            case WEEKLY: {
                int target = Math.floorMod(dayOfWeek != null ? dayOfWeek : DEFAULT_DAY_OF_WEEK, 7);
                int current = now.getDayOfWeek().getValue() % 7;
                int daysUntil = Math.floorMod(target - current, 7);
                ZonedDateTime next = today.atTime(time).atZone(ZoneOffset.UTC).plusDays(daysUntil);
                // same weekday, time already passed
                if (daysUntil == 0 && !next.toInstant().isAfter(anchor)) {
                    next = next.plusDays(7);
                }
                return next.toInstant();
            }
            case MONTHLY: {
                int target = dayOfMonth != null ? dayOfMonth : DEFAULT_DAY_OF_MONTH;
                if (target < 1 || target > 31) {
                    throw new IllegalArgumentException("Day of month must be between 1 and 31: " + target);
                }
                YearMonth month = YearMonth.from(today);
                Instant next = atClampedDay(month, target, time);
                if (!next.isAfter(anchor)) {
                    next = atClampedDay(month.plusMonths(1), target, time);
                }
                return next;
            }
            default:
                throw new IllegalStateException("Unhandled frequency: " + frequency);
        }
    }

    private static Instant atClampedDay(YearMonth month, int day, LocalTime time) {
        return month.atDay(Math.min(day, month.lengthOfMonth()))
                .atTime(time)
                .toInstant(ZoneOffset.UTC);
    }

    /**
     * Parse "H:mm" / "HH:mm".
     *
     * @throws IllegalArgumentException if malformed or out of range
     */
    public static LocalTime parseTimeOfDay(String timeOfDay) {
        Matcher m = TIME_OF_DAY_RE.matcher(timeOfDay == null ? "" : timeOfDay.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid time of day: " + timeOfDay);
        }
        int hours = Integer.parseInt(m.group(1));
        int minutes = Integer.parseInt(m.group(2));
        if (hours > 23 || minutes > 59) {
            throw new IllegalArgumentException("Invalid time of day: " + timeOfDay);
        }
        return LocalTime.of(hours, minutes);
    }
}
