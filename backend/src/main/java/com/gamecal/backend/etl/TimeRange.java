package com.gamecal.backend.etl;

/** Possibly partial result of reading a range out of free text. Either side may be null. */
public record TimeRange(String startIso, String endIso) {

    private static final TimeRange EMPTY = new TimeRange(null, null);

    public static TimeRange empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return startIso == null && endIso == null;
    }
}
