package com.stealerlens.normalization;

import java.util.Objects;

/**
 * Canonical date/time pair produced by {@link DateTimeNormalizer}.
 * {@code date} is "YYYY-MM-DD" or null; {@code time} is always "HH:mm:ss".
 */
public final class NormalizedDateTime {

    public static final String MIDNIGHT = "00:00:00";

    private static final NormalizedDateTime EMPTY = new NormalizedDateTime(null, MIDNIGHT);

    private final String date;
    private final String time;

    public NormalizedDateTime(String date, String time) {
        this.date = date;
        this.time = time != null ? time : MIDNIGHT;
    }

    public static NormalizedDateTime empty() {
        return EMPTY;
    }

    public String getDate() {
        return date;
    }

    public String getTime() {
        return time;
    }

    public boolean hasDate() {
        return date != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizedDateTime that = (NormalizedDateTime) o;
        return Objects.equals(date, that.date) && time.equals(that.time);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, time);
    }

    @Override
    public String toString() {
        return (date != null ? date : "<no date>") + " " + time;
    }
}
