package toml;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Describes which properties of a type the {@link Serializer} writes, and how: as a
 * single value, as an array, or as a nested group with its own schema.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TomlSchema<T> {

    public enum Kind {
        VALUE,
        ARRAY,
        GROUP
    }

    @Getter
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Property<T> {
        private final String name;
        private final Kind kind;
        private final Function<T, ?> getter;
        private final TomlSchema<Object> schema;

        Object read(T owner) {
            return getter.apply(owner);
        }
    }

    private final Class<T> type;
    private final List<Property<T>> properties;

    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    public List<Property<T>> properties(Kind kind) {
        List<Property<T>> selected = new ArrayList<>();
        for (Property<T> property : properties) {
            if (property.kind == kind) {
                selected.add(property);
            }
        }
        return selected;
    }

    public static final class Builder<T> {
        private final Class<T> type;
        private final List<Property<T>> properties = new ArrayList<>();

        private Builder(Class<T> type) {
            this.type = type;
        }

        public Builder<T> value(String name, Function<T, ?> getter) {
            return add(new Property<>(name, Kind.VALUE, getter, null));
        }

        public Builder<T> array(String name, Function<T, ?> getter) {
            return add(new Property<>(name, Kind.ARRAY, getter, null));
        }

        @SuppressWarnings("unchecked")
        public <U> Builder<T> group(String name, Function<T, U> getter, TomlSchema<U> schema) {
            if (schema == null) {
                throw new IllegalArgumentException("Group " + name + " needs a schema");
            }
            return add(new Property<>(name, Kind.GROUP, getter, (TomlSchema<Object>) (TomlSchema<?>) schema));
        }

        private Builder<T> add(Property<T> property) {
            if (property.name == null || property.name.isEmpty()) {
                throw new IllegalArgumentException("Property name cannot be empty");
            }
            for (Property<T> existing : properties) {
                if (existing.name.equals(property.name)) {
                    throw new IllegalArgumentException("Property " + property.name + " is already defined for " + type.getName());
                }
            }
            properties.add(property);
            return this;
        }

        public TomlSchema<T> build() {
            return new TomlSchema<>(type, Collections.unmodifiableList(new ArrayList<>(properties)));
        }
    }
}
