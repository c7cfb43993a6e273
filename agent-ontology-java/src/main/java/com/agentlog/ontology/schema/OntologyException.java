package com.agentlog.ontology.schema;

/**
 * Base of every error raised by the ontology core.
 *
 * Carries an optional JSON path (e.g. {@code $.steps[2].action_state}) locating
 * the offending value. Adapters that read nested entities re-root the path with
 * {@link #under(String)} so the caller always sees the absolute location.
 */
public abstract class OntologyException extends RuntimeException {

    private final String detail;
    private final String path;

    protected OntologyException(String detail, String path, Throwable cause) {
        super(path == null ? detail : detail + " (at " + path + ")", cause);
        this.detail = detail;
        this.path = path;
    }

    /** Message without the location suffix. */
    public String getDetail() { return detail; }

    /** JSON path of the offending value, or null when raised outside a document read. */
    public String getPath()   { return path; }

    /**
     * Returns an equivalent exception whose path is nested under {@code parentPath}.
     */
    public abstract OntologyException under(String parentPath);

    protected static String joinPath(String parentPath, String path) {
        if (parentPath == null) return path;
        if (path == null) return parentPath;
        if (path.startsWith("$")) return parentPath + path.substring(1);
        return parentPath + "." + path;
    }
}
