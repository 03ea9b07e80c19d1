package toml;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * A {@code name = value} entry of a document, or an element of an array.
 * The payload and type tag never change once the entry is created.
 */
@Getter
public class Entry {

    private final String group;
    private final String name;
    private final int lineNumber;
    private final int position;
    private final TomlType parsedType;
    private final String sourceText;
    private final boolean arrayElement;

    /**
     * @param group      dotted path of the owning group, empty or null for the root
     * @param name       local name; for array elements the index within the array
     * @param sourceText raw text; for strings the unescaped payload
     * @param lineNumber 1-based line the value starts at
     * @param position   0-based column the value starts at
     */
    public Entry(String group, String name, String sourceText, int lineNumber, int position, TomlType parsedType) {
        this(group, name, sourceText, lineNumber, position, parsedType, false);
    }

    Entry(String group, String name, String sourceText, int lineNumber, int position,
          TomlType parsedType, boolean arrayElement) {
        this.group = StringUtils.defaultString(group);
        this.name = name;
        this.sourceText = sourceText;
        this.lineNumber = lineNumber;
        this.position = position;
        this.parsedType = parsedType;
        this.arrayElement = arrayElement;
    }

    public String getFullName() {
        if (group.isEmpty()) {
            return name;
        }
        return group + Group.SEPARATOR + name;
    }

    String valueText() {
        if (parsedType == TomlType.STRING) {
            return "\"" + getSourceText() + "\"";
        }
        return getSourceText();
    }

    @Override
    public String toString() {
        if (!arrayElement) {
            return parsedType.displayName() + " " + getFullName() + " = " + valueText();
        }
        return valueText();
    }
}
