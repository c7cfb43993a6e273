package com.agentlog.ontology.schema;

/**
 * Closed enumeration whose constants are written to JSON as a fixed string tag
 * (e.g. {@code "task-execution"}) instead of the Java constant name.
 */
public interface OntologyEnum {

    String tag();

    /**
     * Looks up the constant of {@code type} carrying {@code tag}.
     *
     * @return the constant, or null if no constant carries that tag
     */
    static <E extends Enum<E> & OntologyEnum> E fromTag(Class<E> type, String tag) {
        if (tag == null) return null;
        for (E constant : type.getEnumConstants()) {
            if (constant.tag().equals(tag)) return constant;
        }
        return null;
    }
}
