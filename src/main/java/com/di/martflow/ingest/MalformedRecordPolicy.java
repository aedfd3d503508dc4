package com.di.martflow.ingest;

/** What the source reader does with a record that fails coercion. */
public enum MalformedRecordPolicy {
    /** Drop the record, log it and count it. */
    SKIP,
    /** Fail the whole load; nothing from the run is staged. */
    ABORT
}
