package toml;

import lombok.Getter;

@Getter
public class KeyNotFoundException extends TomlException {

    private final String path;

    public KeyNotFoundException(String path) {
        super("Key not found: " + path);
        this.path = path;
    }
}
