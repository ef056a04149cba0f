package com.pawpal.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minute-of-day helpers. Times are plain ints in {@code [0, 1439]}; there is no
 * rollover into the next day.
 */
public final class TimeOfDay {

    public static final int START_OF_DAY = 0;
    public static final int END_OF_DAY = 24 * 60 - 1;

    private static final Pattern HH_MM = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private TimeOfDay() {
        // utility class
    }

    public static boolean isValid(int minuteOfDay) {
        return minuteOfDay >= START_OF_DAY && minuteOfDay <= END_OF_DAY;
    }

    public static int of(int hour, int minute) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new IllegalArgumentException("Invalid time of day: " + hour + ":" + minute);
        }
        return hour * 60 + minute;
    }

    /**
     * Parses {@code "H:MM"} or {@code "HH:MM"} (24-hour clock).
     *
     * @throws IllegalArgumentException if the text is not a valid time of day
     */
    public static int parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Time of day is null");
        }
        Matcher m = HH_MM.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed time of day: '" + text + "' (expected HH:MM)");
        }
        return of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    public static String format(int minuteOfDay) {
        if (!isValid(minuteOfDay)) {
            throw new IllegalArgumentException("Minute of day out of range: " + minuteOfDay);
        }
        return String.format("%02d:%02d", minuteOfDay / 60, minuteOfDay % 60);
    }
}
