package com.strata.storage;

/**
 * The metadata store could not be read or written.
 */
public class MetadataStoreException extends RuntimeException {

    private final String table;

    public MetadataStoreException(String message, String table, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }

    @Override
    public String getMessage() {
        return table != null ? super.getMessage() + " [Table: " + table + "]" : super.getMessage();
    }
}
