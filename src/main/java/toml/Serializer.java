package toml;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Writes objects as documents, driven by a {@link TomlSchema}. Values are written first,
 * then arrays, then nested groups under their own header.
 */
@Slf4j
public final class Serializer {

    private static final String LINE_SEPARATOR = "\n";
    private static final String[] ESCAPED = {"\\", "\"", "\n", "\r", "\t", "\0"};
    private static final String[] ESCAPES = {"\\\\", "\\\"", "\\n", "\\r", "\\t", "\\0"};

    private static final Map<Class<?>, Function<Object, String>> NATIVE_TYPES = new HashMap<>();

    static {
        NATIVE_TYPES.put(Boolean.class, String::valueOf);
        NATIVE_TYPES.put(Byte.class, String::valueOf);
        NATIVE_TYPES.put(Short.class, String::valueOf);
        NATIVE_TYPES.put(Integer.class, String::valueOf);
        NATIVE_TYPES.put(Long.class, String::valueOf);
        NATIVE_TYPES.put(BigInteger.class, String::valueOf);
        NATIVE_TYPES.put(Float.class, value -> formatDecimal(new BigDecimal(value.toString())));
        NATIVE_TYPES.put(Double.class, value -> formatDecimal(BigDecimal.valueOf((Double) value)));
        NATIVE_TYPES.put(BigDecimal.class, value -> formatDecimal((BigDecimal) value));
        NATIVE_TYPES.put(String.class, value -> escapeAndQuote((String) value));
        NATIVE_TYPES.put(OffsetDateTime.class, Object::toString);
        NATIVE_TYPES.put(LocalDateTime.class, Object::toString);
        NATIVE_TYPES.put(LocalDate.class, Object::toString);
        NATIVE_TYPES.put(Instant.class, Object::toString);
    }

    private Serializer() {
    }

    public static <T> String toString(T value, TomlSchema<T> schema, String rootKeyGroup) {
        StringWriter writer = new StringWriter();
        write(value, schema, rootKeyGroup, writer);
        return writer.toString();
    }

    public static <T> void write(T value, TomlSchema<T> schema, String rootKeyGroup, Writer writer) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        try {
            serialize(value, schema, normalizeKeyGroup(rootKeyGroup), writer);
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static <T> void serialize(T value, TomlSchema<T> schema, String keyGroup, Writer writer) throws IOException {
        log.trace("Writing {} as [{}]", schema.getType().getSimpleName(), keyGroup);
        if (!keyGroup.isEmpty()) {
            writer.write(TomlArray.START + keyGroup + TomlArray.END + LINE_SEPARATOR);
        }

        for (TomlSchema.Property<T> property : schema.properties(TomlSchema.Kind.VALUE)) {
            Object propertyValue = property.read(value);
            if (propertyValue != null) {
                if (!isNativeType(propertyValue)) {
                    throw new IllegalArgumentException(String.format("Property %s of %s is not a native value: %s",
                            property.getName(), schema.getType().getName(), propertyValue.getClass().getName()));
                }
                writer.write(property.getName() + " = " + formatNative(propertyValue) + LINE_SEPARATOR);
            }
        }

        for (TomlSchema.Property<T> property : schema.properties(TomlSchema.Kind.ARRAY)) {
            Object propertyValue = property.read(value);
            if (propertyValue != null) {
                writer.write(property.getName() + " = " + formatArray(propertyValue) + LINE_SEPARATOR);
            }
        }

        for (TomlSchema.Property<T> property : schema.properties(TomlSchema.Kind.GROUP)) {
            Object propertyValue = property.read(value);
            if (propertyValue != null) {
                String childGroup = keyGroup.isEmpty() ? property.getName() : keyGroup + Group.SEPARATOR + property.getName();
                writer.write(LINE_SEPARATOR);
                serialize(propertyValue, property.getSchema(), childGroup, writer);
            }
        }
    }

    public static String formatValue(Object value) {
        if (isNativeType(value)) {
            return formatNative(value);
        }
        if (isArrayType(value)) {
            return formatArray(value);
        }
        throw new IllegalArgumentException("Cannot format value of type " + value.getClass().getName());
    }

    static boolean isNativeType(Object value) {
        return NATIVE_TYPES.containsKey(value.getClass());
    }

    private static boolean isArrayType(Object value) {
        return value.getClass().isArray() || value instanceof Iterable;
    }

    private static String formatNative(Object value) {
        return NATIVE_TYPES.get(value.getClass()).apply(value);
    }

    private static String formatArray(Object array) {
        List<String> elements = new ArrayList<>();
        for (Object element : elements(array)) {
            if (element == null) {
                throw new IllegalArgumentException("Arrays cannot contain null elements");
            }
            if (isNativeType(element)) {
                elements.add(formatNative(element));
            } else if (isArrayType(element)) {
                elements.add(formatArray(element));
            } else {
                throw new UnsupportedOperationException("Cannot serialize complex types in an array: "
                        + element.getClass().getName());
            }
        }
        return TomlArray.START + String.join(TomlArray.SEPARATOR + " ", elements) + TomlArray.END;
    }

    private static Iterable<?> elements(Object array) {
        if (array instanceof Iterable) {
            return (Iterable<?>) array;
        }
        if (!array.getClass().isArray()) {
            throw new IllegalArgumentException("Not an array: " + array.getClass().getName());
        }
        int length = Array.getLength(array);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(array, i));
        }
        return elements;
    }

    private static String formatDecimal(BigDecimal value) {
        String text = value.toPlainString();
        return text.indexOf('.') < 0 ? text + ".0" : text;
    }

    private static String normalizeKeyGroup(String keyGroup) {
        if (StringUtils.isBlank(keyGroup)) {
            return "";
        }
        String trimmed = StringUtils.strip(keyGroup.trim(), "[]");
        return StringUtils.strip(trimmed, String.valueOf(Group.SEPARATOR));
    }

    static String escapeAndQuote(String value) {
        return "\"" + StringUtils.replaceEach(value, ESCAPED, ESCAPES) + "\"";
    }
}
