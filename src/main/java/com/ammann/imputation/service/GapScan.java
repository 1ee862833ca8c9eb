/* (C)2026 */
package com.ammann.imputation.service;

import com.ammann.imputation.dto.GapDTO;
import com.ammann.imputation.enumeration.MeasuredParameter;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable sequence of gaps over a snapshot of present hours.
 *
 * <p>Each {@link #iterator()} walks the expected hourly timestamps from start to end anew;
 * gaps are classified as they are closed.
 */
public final class GapScan implements Iterable<GapDTO> {

    private static final Duration HOUR = Duration.ofHours(1);

    private final String stationId;
    private final MeasuredParameter parameter;
    private final Instant start;
    private final Instant end;
    private final Set<Instant> presentHours;
    private final int shortMaxHours;
    private final int mediumMaxHours;

    GapScan(String stationId,
            MeasuredParameter parameter,
            Instant start,
            Instant end,
            Set<Instant> presentHours,
            int shortMaxHours,
            int mediumMaxHours)
    {
        this.stationId = stationId;
        this.parameter = parameter;
        this.start = start;
        this.end = end;
        this.presentHours = Set.copyOf(presentHours);
        this.shortMaxHours = shortMaxHours;
        this.mediumMaxHours = mediumMaxHours;
    }

    @Override
    public Iterator<GapDTO> iterator() {
        return new GapIterator();
    }

    public Stream<GapDTO> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public Instant start() {
        return start;
    }

    public Instant end() {
        return end;
    }

    private final class GapIterator implements Iterator<GapDTO> {

        private Instant cursor = start;
        private GapDTO next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public GapDTO next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            GapDTO gap = next;
            next = null;
            return gap;
        }

        private GapDTO advance() {
            Instant gapStart = null;
            while (!cursor.isAfter(end)) {
                Instant hour = cursor;
                cursor = cursor.plus(HOUR);
                boolean missing = !presentHours.contains(hour);
                if (missing && gapStart == null) {
                    gapStart = hour;
                } else if (!missing && gapStart != null) {
                    return GapDTO.of(stationId, parameter, gapStart, hour.minus(HOUR), shortMaxHours, mediumMaxHours);
                }
            }
            if (gapStart != null) {
                return GapDTO.of(stationId, parameter, gapStart, end, shortMaxHours, mediumMaxHours);
            }
            return null;
        }
    }
}
