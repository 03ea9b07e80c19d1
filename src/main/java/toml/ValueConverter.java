package toml;

import java.util.Optional;

/**
 * Converts the raw text of an entry to a Java value. Implementations report unsupported
 * types and malformed text with an empty result and never throw for them.
 */
public interface ValueConverter {

    <T> Optional<T> convert(String text, Class<T> type);
}
