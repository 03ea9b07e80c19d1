package toml;

import lombok.Getter;

@Getter
public class ValueConversionException extends TomlException {

    private final String path;
    private final String text;
    private final Class<?> targetType;

    public ValueConversionException(String path, String text, Class<?> targetType) {
        super(String.format("Cannot convert value of '%s' (%s) to %s", path, text, targetType.getName()));
        this.path = path;
        this.text = text;
        this.targetType = targetType;
    }
}
