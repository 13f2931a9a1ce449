package com.chatter.chatbackend.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Wall-clock timestamps as clients see them: {@code yyyy-MM-dd HH:mm:ss} at UTC+8. */
public final class TimeFormat {
    public static final String PATTERN = "yyyy-MM-dd HH:mm:ss";
    public static final ZoneOffset EAST_8 = ZoneOffset.ofHours(8);

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern(PATTERN);

    private TimeFormat() {}

    public static LocalDateTime now(Clock clock) {
        return LocalDateTime.ofInstant(clock.instant(), EAST_8);
    }

    public static String format(LocalDateTime time) {
        if (time == null) return "";
        return FORMATTER.format(time);
    }
}
