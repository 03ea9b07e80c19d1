package mappers;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import toml.TomlType;

/**
 * A single value of the flat view. {@code path} is the owning group, empty for the root;
 * {@code type} and {@code lineNumber} are only set for items read from a file.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class FileDataItem {
    private String key;
    private Object value;
    private String path;
    private TomlType type;
    private int lineNumber;
    private String comment;
}
