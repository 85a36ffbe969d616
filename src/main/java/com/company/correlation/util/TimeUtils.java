package com.company.correlation.util;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class TimeUtils {

    private TimeUtils() {
    }

    /**
     * Median gap between consecutive timestamps.
     *
     * @param timestamps ascending timestamps
     * @return empty when fewer than two timestamps are given
     */
    public static Optional<Duration> medianInterval(List<Instant> timestamps) {
        if (timestamps.size() < 2) {
            return Optional.empty();
        }
        List<Long> gapsNanos = new ArrayList<>(timestamps.size() - 1);
        for (int i = 1; i < timestamps.size(); i++) {
            gapsNanos.add(Duration.between(timestamps.get(i - 1), timestamps.get(i)).toNanos());
        }
        gapsNanos.sort(null);

        int mid = gapsNanos.size() / 2;
        if (gapsNanos.size() % 2 == 1) {
            return Optional.of(Duration.ofNanos(gapsNanos.get(mid)));
        }
        return Optional.of(Duration.ofNanos((gapsNanos.get(mid - 1) + gapsNanos.get(mid)) / 2));
    }

    public static String formatDuration(Duration duration) {
        if (duration == null) return null;

        boolean negative = duration.isNegative();
        long durationMs = duration.abs().toMillis();
        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        String formatted;
        if (hours > 0) {
            formatted = String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            formatted = String.format("%dm %ds", minutes, seconds);
        } else {
            formatted = String.format("%ds", seconds);
        }
        return negative ? "-" + formatted : formatted;
    }
}
