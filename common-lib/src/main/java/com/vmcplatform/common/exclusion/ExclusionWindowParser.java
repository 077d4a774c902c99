package com.vmcplatform.common.exclusion;

import com.vmcplatform.common.exception.InputGuardException;
import com.vmcplatform.common.model.TimeWindow;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the lab's hand-entered exclusion notation into absolute windows on a recording date.
 *
 * <pre>
 *   "1:30 PM - 3:00 PM, 9:15 pm - 11:45 pm"
 * </pre>
 *
 * A window whose end clock time is earlier than its start runs past midnight and ends on the
 * following day. The whole string is rejected on the first malformed range.
 */
public final class ExclusionWindowParser {

    private static final String OPERATION = "parseExclusions";

    private static final DateTimeFormatter CLOCK = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern("h:mm a")
        .toFormatter(Locale.US);

    private ExclusionWindowParser() {}

    public static List<TimeWindow> parse(LocalDate day, String text) {
        if (day == null) {
            throw new InputGuardException(OPERATION, "recording date is required");
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<TimeWindow> windows = new ArrayList<>();
        for (String range : text.split(",")) {
            String[] bounds = range.split("-");
            if (bounds.length != 2) {
                throw new InputGuardException(OPERATION, "expected 'start - end' but got '" + range.trim() + "'");
            }
            LocalTime start = clock(bounds[0]);
            LocalTime end   = clock(bounds[1]);
            if (start.equals(end)) {
                throw new InputGuardException(OPERATION, "empty window '" + range.trim() + "'");
            }
            LocalDateTime startAt = day.atTime(start);
            LocalDateTime endAt   = end.isAfter(start) ? day.atTime(end) : day.plusDays(1).atTime(end);
            windows.add(new TimeWindow(startAt, endAt));
        }
        return windows;
    }

    private static LocalTime clock(String raw) {
        String value = raw.trim().replaceAll("\\s+", " ");
        try {
            return LocalTime.parse(value, CLOCK);
        } catch (DateTimeParseException e) {
            throw new InputGuardException(OPERATION, "unreadable clock time '" + value + "'", e);
        }
    }
}
