package toml;

import java.time.OffsetDateTime;

/**
 * Type tags assigned by the tokenizer. {@link #OPAQUE} is never carried by a parsed entry,
 * it is the fallback element type when the elements of an array cannot be unified.
 */
public enum TomlType {
    STRING(String.class),
    INT(Long.class),
    FLOAT(Double.class),
    DATETIME(OffsetDateTime.class),
    BOOLEAN(Boolean.class),
    ARRAY(Object.class),
    OPAQUE(Object.class);

    private final Class<?> nativeType;

    TomlType(Class<?> nativeType) {
        this.nativeType = nativeType;
    }

    public Class<?> getNativeType() {
        return nativeType;
    }

    public String displayName() {
        switch (this) {
            case STRING:
                return "String";
            case INT:
                return "Int";
            case FLOAT:
                return "Float";
            case DATETIME:
                return "DateTime";
            case BOOLEAN:
                return "Boolean";
            case ARRAY:
                return "Array";
            default:
                return "Object";
        }
    }
}
