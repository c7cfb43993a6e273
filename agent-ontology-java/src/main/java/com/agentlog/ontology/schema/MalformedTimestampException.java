package com.agentlog.ontology.schema;

/**
 * A timestamp string could not be read as ISO-8601 after trailing-{@code Z} normalization.
 */
public class MalformedTimestampException extends OntologyException {

    private final String value;

    public MalformedTimestampException(String field, String value, Throwable cause) {
        super("malformed timestamp '" + value + "'", field, cause);
        this.value = value;
    }

    /** The raw text that failed to parse. */
    public String getValue() { return value; }

    @Override
    public MalformedTimestampException under(String parentPath) {
        return new MalformedTimestampException(joinPath(parentPath, getPath()), value, getCause());
    }
}
