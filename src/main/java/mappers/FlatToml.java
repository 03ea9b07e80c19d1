package mappers;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.NotImplementedException;
import org.apache.commons.lang3.StringUtils;
import toml.Document;
import toml.Entry;
import toml.Parser;
import toml.ParserOptions;
import toml.Serializer;
import toml.TomlArray;
import toml.TomlType;
import toml.ValueConversionException;
import toml.ValueConverter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

@Slf4j
public class FlatToml implements FlatService {

    private static final String LINE_SEPARATOR = "\n";
    private static final String COMMENT_PREFIX = "#";

    private final ParserOptions options;

    public FlatToml() {
        this(ParserOptions.defaults());
    }

    public FlatToml(ParserOptions options) {
        this.options = options;
    }

    @Override
    public Map<String, FileDataItem> flatToMap(String data) {
        Map<String, FileDataItem> result = new LinkedHashMap<>();
        if (StringUtils.isBlank(data)) {
            return result;
        }

        Document document = Parser.parse(data, options);
        for (Entry entry : document.getAllItems()) {
            FileDataItem item = FileDataItem.builder()
                    .key(entry.getFullName())
                    .path(entry.getGroup())
                    .value(toNative(entry, options.getConverter()))
                    .type(entry.getParsedType())
                    .lineNumber(entry.getLineNumber())
                    .build();
            result.put(item.getKey(), item);
        }
        log.debug("Flattened {} entries", result.size());
        return result;
    }

    @Override
    public String flatToString(Map<String, FileDataItem> data) {
        if (data == null || data.isEmpty()) {
            return "";
        }

        Map<String, List<FileDataItem>> byPath = new LinkedHashMap<>();
        byPath.put(StringUtils.EMPTY, new ArrayList<>());
        for (FileDataItem item : data.values()) {
            if (item != null && item.getKey() != null && item.getValue() != null) {
                byPath.computeIfAbsent(StringUtils.defaultString(item.getPath()), k -> new ArrayList<>()).add(item);
            }
        }

        StringJoiner out = new StringJoiner(LINE_SEPARATOR, "", LINE_SEPARATOR);
        for (Map.Entry<String, List<FileDataItem>> section : byPath.entrySet()) {
            String path = section.getKey();
            if (!path.isEmpty()) {
                if (out.length() > LINE_SEPARATOR.length()) {
                    out.add(StringUtils.EMPTY);
                }
                out.add("[" + path + "]");
            }
            for (FileDataItem item : section.getValue()) {
                appendComment(out, item.getComment());
                out.add(localName(item) + " = " + Serializer.formatValue(item.getValue()));
            }
        }
        return out.toString();
    }

    @Override
    public void validate(Map<String, FileDataItem> data) {
        throw new NotImplementedException("Validation of .toml files is not implemented yet.");
    }

    private static Object toNative(Entry entry, ValueConverter converter) {
        if (entry.getParsedType() == TomlType.ARRAY) {
            List<Object> values = new ArrayList<>();
            for (Entry child : ((TomlArray) entry).getChildren()) {
                values.add(toNative(child, converter));
            }
            return values;
        }
        Class<?> type = entry.getParsedType().getNativeType();
        return converter.convert(entry.getSourceText(), type)
                .orElseThrow(() -> new ValueConversionException(entry.getFullName(), entry.getSourceText(), type));
    }

    private static String localName(FileDataItem item) {
        String key = item.getKey();
        String path = item.getPath();
        if (StringUtils.isNotEmpty(path) && key.startsWith(path + ".")) {
            return key.substring(path.length() + 1);
        }
        return key;
    }

    private static void appendComment(StringJoiner out, String comment) {
        if (StringUtils.isBlank(comment)) {
            return;
        }
        for (String line : comment.split("\\R")) {
            out.add(line.startsWith(COMMENT_PREFIX) ? line : COMMENT_PREFIX + " " + line);
        }
    }
}
