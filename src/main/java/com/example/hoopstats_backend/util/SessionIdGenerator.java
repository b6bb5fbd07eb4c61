package com.example.hoopstats_backend.util;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Issues session identifiers of the form {@code yyyyMMdd_HHmmss_NNN}.
 * <p>
 * The suffix is a per-second sequence, so two runs inside the same second still get distinct ids and the ids
 * sort lexicographically in creation order. If the clock steps backwards the last issued second is reused.
 * The sequence only lives in this process; {@link #next(Predicate)} skips ids another process already stored.
 */
@Component
public class SessionIdGenerator {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT);

    private final Clock clock;
    private LocalDateTime lastSecond;
    private int sequence;

    public SessionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        return next(id -> false);
    }

    /** Next id for which {@code taken} is false. */
    public synchronized String next(Predicate<String> taken) {
        String id = advance();
        while (taken.test(id)) {
            id = advance();
        }
        return id;
    }

    private String advance() {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        if (lastSecond != null && !now.isAfter(lastSecond)) {
            sequence++;
            if (sequence > 999) {
                lastSecond = lastSecond.plusSeconds(1);
                sequence = 0;
            }
        } else {
            lastSecond = now;
            sequence = 0;
        }
        return lastSecond.format(FORMAT) + "_" + String.format(Locale.ROOT, "%03d", sequence);
    }
}
