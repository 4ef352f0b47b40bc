package net.readtrack.domain.stats;

import java.util.List;

/** Pages read within a labelled period (a month or a year). */
public record NamePages(String name, long pages) {

    public static long maxPages(List<NamePages> buckets) {
        long max = 0;
        for (NamePages bucket : buckets) {
            max = Math.max(max, bucket.pages());
        }
        return max;
    }
}
