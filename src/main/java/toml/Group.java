package toml;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A node of the key namespace. Holds child groups and values, both keyed by their local
 * name and kept in insertion order.
 */
public class Group {

    public static final char SEPARATOR = '.';

    private static final String LINE_SEPARATOR = "\n";

    private final String key;
    private final Group parent;
    private final Map<String, Group> children = new LinkedHashMap<>();
    private final Map<String, Entry> items = new LinkedHashMap<>();

    Group(String key) {
        this(null, key);
    }

    Group(Group parent, String key) {
        this.parent = parent;
        this.key = key;
    }

    static List<String> splitKey(String key) {
        if (StringUtils.isEmpty(key)) {
            return Collections.emptyList();
        }
        return Arrays.asList(StringUtils.splitPreserveAllTokens(key, SEPARATOR));
    }

    public String getKey() {
        return key;
    }

    public Group getParent() {
        return parent;
    }

    public String getFullKey() {
        if (parent != null) {
            String parentKey = parent.getFullKey();
            if (!parentKey.isEmpty()) {
                return parentKey + SEPARATOR + key;
            }
        }
        return key;
    }

    public Collection<Group> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    public Map<String, Entry> getItems() {
        return Collections.unmodifiableMap(items);
    }

    public List<Entry> getAllItems() {
        List<Entry> all = new ArrayList<>(items.values());
        for (Group child : children.values()) {
            all.addAll(child.getAllItems());
        }
        return all;
    }

    public List<Group> getDescendingGroups() {
        List<Group> groups = new ArrayList<>();
        for (Group current = this; current != null; current = current.parent) {
            groups.add(current);
        }
        return groups;
    }

    public List<Group> getAscendingGroups() {
        Deque<Group> groups = new ArrayDeque<>();
        for (Group current = this; current != null; current = current.parent) {
            groups.push(current);
        }
        return new ArrayList<>(groups);
    }

    public Group createGroup(String key) {
        return createGroup(splitKey(key));
    }

    public Group createGroup(List<String> keyParts) {
        Group current = this;
        for (String part : keyParts) {
            if (StringUtils.isEmpty(part)) {
                throw new IllegalArgumentException("Group key cannot contain an empty part: " + String.join(".", keyParts));
            }
            if (current.items.containsKey(part)) {
                throw new DuplicateKeyException(current.items.get(part).getFullName());
            }
            Group parentGroup = current;
            current = current.children.computeIfAbsent(part, k -> new Group(parentGroup, k));
        }
        return current;
    }

    public Optional<Group> tryGetGroup(String key) {
        return tryGetGroup(splitKey(key));
    }

    public Optional<Group> tryGetGroup(List<String> keyParts) {
        Group current = this;
        for (String part : keyParts) {
            current = current.children.get(part);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public Group getGroup(String key) {
        return tryGetGroup(key).orElseThrow(() -> new KeyNotFoundException(key));
    }

    public boolean groupExists(String key) {
        return tryGetGroup(key).isPresent();
    }

    public void addValue(Entry entry) {
        List<String> keyParts = relativeParts(entry.getFullName());
        Group group = createGroup(keyParts.subList(0, keyParts.size() - 1));
        group.addValueDirect(keyParts.get(keyParts.size() - 1), entry);
    }

    public void addValue(String key, Object value) {
        if (value instanceof Entry) {
            addValue((Entry) value);
            return;
        }
        if (StringUtils.isEmpty(key)) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        addValue(Parser.parseEntry(getFullKey(), key + " = " + Serializer.formatValue(value)));
    }

    private void addValueDirect(String name, Entry entry) {
        if (items.containsKey(name) || children.containsKey(name)) {
            throw new DuplicateKeyException(entry.getFullName());
        }
        items.put(name, entry);
    }

    private List<String> relativeParts(String fullName) {
        String fullKey = getFullKey();
        String relative = fullName;
        if (!fullKey.isEmpty()) {
            if (!fullName.startsWith(fullKey + SEPARATOR)) {
                throw new IllegalArgumentException("Cannot add " + fullName + " to group " + fullKey);
            }
            relative = fullName.substring(fullKey.length() + 1);
        }
        return splitKey(relative);
    }

    public Optional<Entry> tryGetValue(String key) {
        List<String> keyParts = splitKey(key);
        if (keyParts.isEmpty()) {
            return Optional.empty();
        }
        return tryGetGroup(keyParts.subList(0, keyParts.size() - 1))
                .map(group -> group.items.get(keyParts.get(keyParts.size() - 1)));
    }

    public Entry getValue(String key) {
        return tryGetValue(key).orElseThrow(() -> new KeyNotFoundException(key));
    }

    public String getValueString(String key) {
        return getValue(key).getSourceText();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (StringUtils.isNotEmpty(key)) {
            sb.append('[').append(getFullKey()).append(']').append(LINE_SEPARATOR);
        }
        for (Map.Entry<String, Entry> item : items.entrySet()) {
            sb.append(item.getKey()).append(" = ").append(item.getValue().valueText()).append(LINE_SEPARATOR);
        }
        for (Group child : children.values()) {
            sb.append(LINE_SEPARATOR).append(child);
        }
        return sb.toString();
    }
}
