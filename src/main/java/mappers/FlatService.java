package mappers;

import java.util.Map;

/**
 * Flat view of a configuration file: one item per value, keyed by its full dotted name.
 */
public interface FlatService {

    Map<String, FileDataItem> flatToMap(String data);

    String flatToString(Map<String, FileDataItem> data);

    void validate(Map<String, FileDataItem> data);
}
