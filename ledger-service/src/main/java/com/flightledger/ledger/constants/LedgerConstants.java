package com.flightledger.ledger.constants;

public final class LedgerConstants {

    private LedgerConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Ledger Constraints ==========

    public static final int MIN_SEATS = 1;
    public static final int DEFAULT_MAX_FLIGHTS = 1000;

    // ========== Locking ==========

    public static final int DEFAULT_LOCK_WAIT_SECONDS = 5;

    // ========== ID Generation ==========

    public static final String FLIGHT_ID_PREFIX = "FL";
    public static final int FLIGHT_ID_SUFFIX_LENGTH = 8;

    // ========== Metrics ==========

    public static final String METRIC_BOOK_TOTAL = "ledger.book.total";
    public static final String METRIC_BOOK_DURATION = "ledger.book.duration";
    public static final String METRIC_CANCEL_TOTAL = "ledger.cancel.total";
    public static final String METRIC_TAG_RESULT = "result";
    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_LOCK_FAILED = "lock_failed";
}
