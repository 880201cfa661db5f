package com.strata.policy;

/**
 * The metadata a whole loop depends on (policy table, dataset registry) cannot be read.
 * Aborts the pass instead of being handled per unit of work.
 */
public class MetadataUnavailableException extends RuntimeException {

    private final String source;

    public MetadataUnavailableException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (source != null) {
            sb.append(" [Source: ").append(source).append("]");
        }
        return sb.toString();
    }
}
