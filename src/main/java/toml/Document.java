package toml;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The root group of a parsed source. Not modified once parsing has finished, so a document
 * can be read from several threads.
 */
public class Document extends Group {

    private final ValueConverter converter;

    private Document(ValueConverter converter) {
        super("");
        this.converter = converter;
    }

    public static Document create() {
        return new Document(new DefaultValueConverter());
    }

    public static Document create(ValueConverter converter) {
        if (converter == null) {
            throw new IllegalArgumentException("Converter cannot be null");
        }
        return new Document(converter);
    }

    public <T> T getFieldValue(String path, Class<T> type) {
        Entry entry = getValue(path);
        return converter.convert(entry.getSourceText(), type)
                .orElseThrow(() -> new ValueConversionException(path, entry.getSourceText(), type));
    }

    public <T> Optional<T> tryGetFieldValue(String path, Class<T> type) {
        if (path == null || type == null) {
            return Optional.empty();
        }
        return tryGetValue(path).flatMap(entry -> converter.convert(entry.getSourceText(), type));
    }

    public <T> List<T> getArrayValue(String path, Class<T> elementType) {
        TomlArray array = getArray(path);
        List<T> values = new ArrayList<>(array.size());
        for (Entry child : array.getChildren()) {
            @SuppressWarnings("unchecked")
            T value = (T) convertElement(child, elementType);
            values.add(value);
        }
        return values;
    }

    // nested arrays are read into Java arrays of the component type, one level per dimension
    private Object convertElement(Entry element, Class<?> type) {
        if (type.isArray() && element.getParsedType() == TomlType.ARRAY) {
            TomlArray nested = (TomlArray) element;
            Object values = Array.newInstance(type.getComponentType(), nested.size());
            for (int i = 0; i < nested.size(); i++) {
                Array.set(values, i, convertElement(nested.getChildren().get(i), type.getComponentType()));
            }
            return values;
        }
        return converter.convert(element.getSourceText(), type)
                .orElseThrow(() -> new ValueConversionException(element.getFullName(), element.getSourceText(), type));
    }

    public ArrayType getArrayType(String path) {
        return getArray(path).getArrayType();
    }

    private TomlArray getArray(String path) {
        Entry entry = getValue(path);
        if (entry.getParsedType() != TomlType.ARRAY) {
            throw new IllegalStateException(String.format("%s is a %s, not an array", path, entry.getParsedType().displayName()));
        }
        return (TomlArray) entry;
    }
}
