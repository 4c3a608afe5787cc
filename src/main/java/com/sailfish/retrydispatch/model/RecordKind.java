package com.sailfish.retrydispatch.model;

/**
 * Distinguishes original integration runs from the runs created to retry them.
 */
public enum RecordKind {
    /**
     * A run started by the integration itself.
     */
    EGRESS,
    /**
     * A retry attempt of an {@link #EGRESS} run, linked to it through {@code retryFrom}.
     */
    EGRESS_CHILD
}
