package net.readtrack.domain.stats;

import java.util.List;

/** Histogram bucket: a label and how many items fall in it. */
public record NameCount(String name, long count) {

    public static long maxCount(List<NameCount> buckets) {
        long max = 0;
        for (NameCount bucket : buckets) {
            max = Math.max(max, bucket.count());
        }
        return max;
    }
}
