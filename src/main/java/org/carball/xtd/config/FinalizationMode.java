package org.carball.xtd.config;

/**
 * How child element counts become foreign keys when the database is flushed.
 */
public enum FinalizationMode {
    /** The parent gets one key per child occurrence: {@code <child>_id} or {@code <child>1_id .. <child>N_id}. */
    DEFAULT,
    /** Every child gets a single {@code <parent>_id}, whatever the count. */
    DUPLICATE_KEYS,
    /** Like DEFAULT, but children occurring more than the threshold get {@code <parent>_id} instead. */
    MAX_COLUMNS
}
