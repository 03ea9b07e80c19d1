package toml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An array entry. Children keep source order and are never removed; nested arrays are
 * children themselves and are named by their index in the enclosing array.
 */
public class TomlArray extends Entry {

    static final char START = '[';
    static final char END = ']';
    static final char SEPARATOR = ',';

    private final List<Entry> children = new ArrayList<>();
    private String materializedText = "";
    private boolean closed;

    public TomlArray(String group, String name, int lineNumber, int position) {
        this(group, name, lineNumber, position, false);
    }

    TomlArray(String group, String name, int lineNumber, int position, boolean arrayElement) {
        super(group, name, "", lineNumber, position, TomlType.ARRAY, arrayElement);
    }

    public List<Entry> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int size() {
        return children.size();
    }

    String nextEntryName() {
        return String.valueOf(children.size());
    }

    void add(Entry entry) {
        if (closed) {
            throw new IllegalStateException("Array " + getFullName() + " is already closed");
        }
        children.add(entry);
    }

    // called once the closing bracket has been read
    void close() {
        materializedText = children.stream()
                .map(Entry::getSourceText)
                .collect(Collectors.joining(String.valueOf(SEPARATOR), String.valueOf(START), String.valueOf(END)));
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String getSourceText() {
        return materializedText;
    }

    @Override
    String valueText() {
        return children.stream()
                .map(Entry::valueText)
                .collect(Collectors.joining(SEPARATOR + " ", String.valueOf(START), String.valueOf(END)));
    }

    public Dimensions getDimensions() {
        return new Dimensions(getMaxDepth(), getMaxLength());
    }

    private int getMaxDepth() {
        int deepest = 0;
        for (TomlArray child : childArrays()) {
            deepest = Math.max(deepest, child.getMaxDepth());
        }
        return deepest + 1;
    }

    private int getMaxLength() {
        int longest = children.size();
        for (TomlArray child : childArrays()) {
            longest = Math.max(longest, child.getMaxLength());
        }
        return longest;
    }

    private List<TomlArray> childArrays() {
        List<TomlArray> arrays = new ArrayList<>();
        for (Entry child : children) {
            if (child.getParsedType() == TomlType.ARRAY) {
                arrays.add((TomlArray) child);
            }
        }
        return arrays;
    }

    /**
     * Folds the element types into a single type. Any rejected fold, or any disagreement
     * between nested arrays, yields {@link ArrayType#OPAQUE} for the whole array.
     */
    public ArrayType getArrayType() {
        Dimensions dimensions = getDimensions();
        if (dimensions.getLength() == 0) {
            return ArrayType.OPAQUE;
        }

        if (dimensions.getDepth() == 1) {
            TomlType current = null;
            for (Entry child : children) {
                current = fold(current, child.getParsedType());
                if (current == null) {
                    return ArrayType.OPAQUE;
                }
            }
            return ArrayType.of(current);
        }

        List<TomlArray> arrays = childArrays();
        if (arrays.size() != children.size()) {
            return ArrayType.OPAQUE;
        }
        ArrayType first = arrays.get(0).getArrayType();
        for (TomlArray array : arrays) {
            if (!first.equals(array.getArrayType())) {
                return ArrayType.OPAQUE;
            }
        }
        return ArrayType.arrayOf(first);
    }

    /**
     * @return the established type after visiting {@code next}, or null if they cannot be unified
     */
    static TomlType fold(TomlType current, TomlType next) {
        switch (next) {
            case INT:
                if (current == null || current == TomlType.INT) {
                    return TomlType.INT;
                }
                return current == TomlType.FLOAT ? TomlType.FLOAT : null;
            case FLOAT:
                if (current == null || current == TomlType.FLOAT || current == TomlType.INT) {
                    return TomlType.FLOAT;
                }
                return null;
            case BOOLEAN:
                if (current == null || current == TomlType.BOOLEAN) {
                    return TomlType.BOOLEAN;
                }
                return null;
            case DATETIME:
                if (current == null || current == TomlType.DATETIME) {
                    return TomlType.DATETIME;
                }
                // an established string absorbs a date-time
                return current == TomlType.STRING ? TomlType.STRING : null;
            case STRING:
                if (current == TomlType.INT || current == TomlType.FLOAT) {
                    return null;
                }
                return TomlType.STRING;
            default:
                return null;
        }
    }
}
