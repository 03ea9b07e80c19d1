package toml;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Entry points for reading documents. Any syntax error aborts the parse with a
 * {@link ParserException}; no partial document is returned.
 */
@Slf4j
public final class Parser {

    private Parser() {
    }

    public static Document parse(String text) {
        return parse(new StringReader(text), ParserOptions.defaults());
    }

    public static Document parse(String text, ParserOptions options) {
        return parse(new StringReader(text), options);
    }

    public static Document parse(Reader reader) {
        return parse(reader, ParserOptions.defaults());
    }

    public static Document parse(InputStream stream) {
        return parse(stream, ParserOptions.defaults());
    }

    public static Document parse(InputStream stream, ParserOptions options) {
        return parse(new InputStreamReader(stream, options.getCharset()), options);
    }

    public static Document parse(Path path) {
        return parse(path, ParserOptions.builder().sourceName(path.toString()).build());
    }

    public static Document parse(Path path, ParserOptions options) {
        Reader reader;
        try {
            reader = Files.newBufferedReader(path, options.getCharset());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return parse(reader, options);
    }

    public static Document parse(Reader reader, ParserOptions options) {
        Document document = Document.create(options.getConverter());
        log.debug("Parsing {}", options.getSourceName() == null ? "<unnamed source>" : options.getSourceName());

        int count = 0;
        try (Tokenizer tokens = tokens(reader, options, document::createGroup)) {
            while (tokens.hasNext()) {
                document.addValue(tokens.next());
                count++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        log.debug("Parsed {} entries", count);
        return document;
    }

    public static Tokenizer tokens(Reader reader, ParserOptions options, Consumer<String> groupListener) {
        return new Tokenizer(reader, options.getSourceName(), groupListener);
    }

    public static Entry parseEntry(String text) {
        return parseEntry("", text);
    }

    static Entry parseEntry(String group, String text) {
        try (Tokenizer tokens = new Tokenizer(new StringReader(text), null, group, null)) {
            if (!tokens.hasNext()) {
                throw new IllegalArgumentException("No value found in: " + text);
            }
            return tokens.next();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
