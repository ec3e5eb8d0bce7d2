package com.securepower.antitheft.domain.tracking;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity log of location points ordered by timestamp, backed by a circular array.
 * Timestamps are unique keys. When full, the oldest point is evicted to make room, so
 * in-order appends cost O(1) and never grow the log past its capacity.
 *
 * <p>Not thread-safe; the owning session serializes access.</p>
 */
public class LocationLog {

    /**
     * Outcome of {@link #add(LocationPoint)}.
     *
     * @param stored  whether the point is now part of the log
     * @param evicted points removed to respect the capacity, oldest first
     */
    public record Insertion(boolean stored, List<LocationPoint> evicted) {
        static Insertion rejected() {
            return new Insertion(false, List.of());
        }
    }

    private final LocationPoint[] ring;
    private int head;
    private int size;

    public LocationLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.ring = new LocationPoint[capacity];
    }

    /**
     * Rebuilds a log from stored points. Points beyond the capacity are dropped oldest first.
     */
    public static LocationLog of(int capacity, Collection<LocationPoint> points) {
        LocationLog log = new LocationLog(capacity);
        points.stream()
                .sorted((a, b) -> a.timestamp().compareTo(b.timestamp()))
                .forEach(log::add);
        return log;
    }

    public int capacity() {
        return ring.length;
    }

    public int size() {
        return size;
    }

    public Insertion add(LocationPoint point) {
        int position = insertionPoint(point.timestamp());
        if (position < 0) {
            return Insertion.rejected();
        }

        List<LocationPoint> evicted = Collections.emptyList();
        if (size == ring.length) {
            // full and older than everything kept: it would be evicted straight away
            if (position == 0) {
                return Insertion.rejected();
            }
            evicted = List.of(removeOldest());
            position--;
        }

        for (int i = size; i > position; i--) {
            ring[slot(i)] = ring[slot(i - 1)];
        }
        ring[slot(position)] = point;
        size++;
        return new Insertion(true, evicted);
    }

    public Optional<LocationPoint> latest() {
        return size == 0 ? Optional.empty() : Optional.of(get(size - 1));
    }

    public Optional<LocationPoint> oldest() {
        return size == 0 ? Optional.empty() : Optional.of(get(0));
    }

    public List<LocationPoint> snapshot() {
        List<LocationPoint> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(get(i));
        }
        return copy;
    }

    private LocationPoint get(int index) {
        return ring[slot(index)];
    }

    private int slot(int index) {
        return (head + index) % ring.length;
    }

    private LocationPoint removeOldest() {
        LocationPoint oldest = ring[head];
        ring[head] = null;
        head = (head + 1) % ring.length;
        size--;
        return oldest;
    }

    // Index at which a point with this timestamp belongs, or -1 if the timestamp is taken.
    private int insertionPoint(Instant timestamp) {
        if (size == 0 || get(size - 1).timestamp().isBefore(timestamp)) {
            return size;
        }
        int low = 0;
        int high = size - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int cmp = get(mid).timestamp().compareTo(timestamp);
            if (cmp == 0) {
                return -1;
            } else if (cmp < 0) {
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }
}
