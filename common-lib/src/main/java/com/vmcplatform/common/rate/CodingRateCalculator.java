package com.vmcplatform.common.rate;

import com.vmcplatform.common.model.CodingEvent;
import com.vmcplatform.common.model.CodingSession;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits each coder's coding timestamps into work sessions.
 *
 * <p>A new session starts whenever the gap between two consecutive codes of the same coder
 * is strictly greater than {@code maxPause}. Coders are returned in name order.
 */
public final class CodingRateCalculator {

    public static final Duration DEFAULT_MAX_PAUSE = Duration.ofMinutes(10);

    private CodingRateCalculator() {}

    public static Map<String, List<CodingSession>> sessions(List<CodingEvent> events, Duration maxPause) {
        Map<String, List<CodingEvent>> byCoder = new TreeMap<>();
        for (CodingEvent event : events) {
            byCoder.computeIfAbsent(event.coder(), k -> new ArrayList<>()).add(event);
        }

        Map<String, List<CodingSession>> result = new LinkedHashMap<>();
        byCoder.forEach((coder, coderEvents) -> {
            coderEvents.sort(Comparator.comparing(CodingEvent::codedAt));
            result.put(coder, split(coder, coderEvents, maxPause));
        });
        return result;
    }

    private static List<CodingSession> split(String coder, List<CodingEvent> ordered, Duration maxPause) {
        List<CodingSession> sessions = new ArrayList<>();
        int first = 0;
        for (int i = 1; i <= ordered.size(); i++) {
            boolean boundary = i == ordered.size()
                || Duration.between(ordered.get(i - 1).codedAt(), ordered.get(i).codedAt()).compareTo(maxPause) > 0;
            if (boundary) {
                CodingEvent start = ordered.get(first);
                CodingEvent end   = ordered.get(i - 1);
                sessions.add(new CodingSession(coder, start.codedAt(),
                    Duration.between(start.codedAt(), end.codedAt()), i - first));
                first = i;
            }
        }
        return sessions;
    }
}
