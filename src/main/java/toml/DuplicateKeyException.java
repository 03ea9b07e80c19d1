package toml;

import lombok.Getter;

@Getter
public class DuplicateKeyException extends TomlException {

    private final String key;

    public DuplicateKeyException(String key) {
        super("Duplicate key: " + key);
        this.key = key;
    }
}
