package com.agentlog.ontology.schema;

/**
 * A required field is missing, an enumerated field holds an unknown tag, or a
 * value has the wrong JSON type for its field.
 */
public class ValidationException extends OntologyException {

    private final String entity;
    private final String field;

    public ValidationException(String entity, String field, String detail, String path, Throwable cause) {
        super(detail, path, cause);
        this.entity = entity;
        this.field = field;
    }

    public static ValidationException missingField(String entity, String field) {
        return new ValidationException(entity, field, entity + "." + field + " is required", null, null);
    }

    public static ValidationException invalid(String entity, String field, String reason) {
        return new ValidationException(entity, field, entity + "." + field + " " + reason, null, null);
    }

    public static ValidationException unknownTag(String enumName, String tag, String path) {
        return new ValidationException(enumName, null,
                "unrecognized " + enumName + " value '" + tag + "'", path, null);
    }

    public static ValidationException typeMismatch(String entity, String path, String reason, Throwable cause) {
        return new ValidationException(entity, null, entity + ": " + reason, path, cause);
    }

    /** Simple name of the entity or enum that rejected the value. */
    public String getEntity() { return entity; }

    /** Offending field name, or null when only the path identifies it. */
    public String getField()  { return field; }

    @Override
    public ValidationException under(String parentPath) {
        return new ValidationException(entity, field, getDetail(), joinPath(parentPath, getPath()), getCause());
    }
}
