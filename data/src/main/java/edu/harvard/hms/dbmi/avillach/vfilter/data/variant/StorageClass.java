package edu.harvard.hms.dbmi.avillach.vfilter.data.variant;

public enum StorageClass {
    /**
     * Answered directly by the backing store
     */
    PUSHABLE,
    /**
     * Held in schemaless nested data, evaluated in memory
     */
    CATCH_ALL
}
