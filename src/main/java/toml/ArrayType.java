package toml;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.lang.reflect.Array;

/**
 * Unified element type of an array. When the element type is {@link TomlType#ARRAY} the
 * component describes the nested arrays.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ArrayType {

    public static final ArrayType OPAQUE = new ArrayType(TomlType.OPAQUE, null);

    TomlType elementType;
    ArrayType component;

    public static ArrayType of(TomlType elementType) {
        if (elementType == TomlType.ARRAY) {
            throw new IllegalArgumentException("Nested array types need a component, use arrayOf");
        }
        return new ArrayType(elementType, null);
    }

    public static ArrayType arrayOf(ArrayType component) {
        return new ArrayType(TomlType.ARRAY, component);
    }

    public Class<?> toJavaType() {
        Class<?> element = elementType == TomlType.ARRAY
                ? component.toJavaType()
                : elementType.getNativeType();
        return Array.newInstance(element, 0).getClass();
    }

    @Override
    public String toString() {
        if (elementType == TomlType.ARRAY) {
            return component + "[]";
        }
        return elementType.displayName() + "[]";
    }
}
