package toml;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.CharUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Pull-based state machine turning lines of text into entries.
 * <p>
 * Each call to {@link #next()} reads as many lines as needed to complete one top-level
 * value; array elements are collected into their array and only the outermost array is
 * returned. Group headers are reported to the group listener as they are read. The reader
 * is closed once the input is exhausted, when a syntax error is raised, or on
 * {@link #close()}, whichever comes first.
 * <p>
 * Not thread safe.
 */
@Slf4j
public class Tokenizer implements Iterator<Entry>, Closeable {

    enum Mode {
        SCANNING,
        READING_VALUE_NAME,
        SEARCHING_FOR_VALUE_SEPARATOR,
        READING_VALUE,
        READING_STRING_VALUE,
        READING_MULTI_LINE_STRING_VALUE,
        SEARCHING_FOR_ARRAY_SEPARATOR
    }

    private static final char COMMENT = '#';
    private static final char EQUALS = '=';
    private static final char KEY_START = '[';
    private static final char KEY_END = ']';
    private static final char QUOTE = '"';
    private static final char ESCAPE = '\\';
    private static final char MINUS = '-';
    private static final char DECIMAL_POINT = '.';
    private static final String EMPTY_STRING = "\"\"";
    private static final String MULTI_LINE_QUOTE = "\"\"\"";
    private static final String TRUE = "true";
    private static final String FALSE = "false";
    private static final int MAX_INTEGER_BITS = 63;

    private final BufferedReader reader;
    private final String sourceName;
    private final Consumer<String> groupListener;

    private String line;
    private int lineNumber;
    private int pos;
    private boolean needLine = true;
    private Mode mode = Mode.SCANNING;

    private String currentGroup;
    private int keyStart;
    private int keyEnd;
    private String valueGroup;
    private String valueName;
    private int valueLine;
    private int valueColumn;
    private final Deque<TomlArray> openArrays = new ArrayDeque<>();
    private final StringBuilder buffer = new StringBuilder();
    private boolean escaping;

    private Entry next;
    private boolean closed;

    public Tokenizer(Reader reader, String sourceName, Consumer<String> groupListener) {
        this(reader, sourceName, "", groupListener);
    }

    Tokenizer(Reader reader, String sourceName, String initialGroup, Consumer<String> groupListener) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.sourceName = sourceName;
        this.currentGroup = StringUtils.defaultString(initialGroup);
        this.groupListener = groupListener == null ? group -> { } : groupListener;
    }

    Mode getMode() {
        return mode;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        try {
            next = advance();
        } catch (IOException e) {
            throw releaseAfter(new UncheckedIOException(e));
        } catch (RuntimeException e) {
            throw releaseAfter(e);
        }
        return next != null;
    }

    @Override
    public Entry next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Entry entry = next;
        next = null;
        return entry;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            reader.close();
        }
    }

    private RuntimeException releaseAfter(RuntimeException error) {
        try {
            close();
        } catch (IOException closeError) {
            error.addSuppressed(closeError);
        }
        return error;
    }

    private Entry advance() throws IOException {
        while (true) {
            if (needLine) {
                String text = reader.readLine();
                if (text == null) {
                    finish();
                    return null;
                }
                line = text;
                lineNumber++;
                pos = 0;
                needLine = false;
            }
            if (pos >= line.length()) {
                endOfLine();
                needLine = true;
                continue;
            }
            Entry token = step();
            if (token != null) {
                return token;
            }
        }
    }

    private void finish() throws IOException {
        if (mode != Mode.SCANNING) {
            throw error("incomplete token at end of input", line == null ? 0 : line.length());
        }
        log.trace("Reached end of input after {} lines", lineNumber);
        close();
    }

    private Entry step() {
        switch (mode) {
            case SCANNING:
                scan();
                return null;
            case READING_VALUE_NAME:
                readValueName();
                return null;
            case SEARCHING_FOR_VALUE_SEPARATOR:
                searchValueSeparator();
                return null;
            case READING_VALUE:
                return readValue();
            case READING_STRING_VALUE:
                return readString();
            case READING_MULTI_LINE_STRING_VALUE:
                return readMultiLineString();
            case SEARCHING_FOR_ARRAY_SEPARATOR:
                return searchArraySeparator();
            default:
                throw new IllegalStateException("Unknown mode " + mode);
        }
    }

    private void endOfLine() {
        switch (mode) {
            case SEARCHING_FOR_VALUE_SEPARATOR:
                throw error("expected value separator '='", keyEnd);
            case READING_VALUE:
                if (openArrays.isEmpty()) {
                    throw error("expected value", line.length());
                }
                break;
            case READING_STRING_VALUE:
                throw error("unexpected newline in string", line.length());
            case READING_MULTI_LINE_STRING_VALUE:
                if (escaping) {
                    escaping = false;
                } else {
                    buffer.append('\n');
                }
                break;
            default:
                break;
        }
    }

    private void scan() {
        char c = line.charAt(pos);
        if (Character.isWhitespace(c)) {
            pos++;
        } else if (c == COMMENT) {
            pos = line.length();
        } else if (c == KEY_START) {
            readGroupHeader();
        } else if (c == KEY_END) {
            throw error("unexpected array terminator", pos);
        } else if (isIdentifierStart(c)) {
            keyStart = pos;
            mode = Mode.READING_VALUE_NAME;
        } else if (c == EQUALS) {
            throw error("identifier cannot be empty", pos);
        } else if (CharUtils.isAsciiNumeric(c)) {
            throw error("identifier cannot start with a digit", pos);
        } else {
            throw error("invalid character '" + c + "' in identifier", pos);
        }
    }

    private void readGroupHeader() {
        int end = line.indexOf(KEY_END, pos + 1);
        if (end < 0) {
            throw error("group name cannot span multiple lines", line.length());
        }
        int start = pos + 1;
        while (start < end && Character.isWhitespace(line.charAt(start))) {
            start++;
        }
        int stop = end;
        while (stop > start && Character.isWhitespace(line.charAt(stop - 1))) {
            stop--;
        }
        if (start == stop) {
            throw error("group name cannot be empty", pos + 1);
        }

        String name = line.substring(start, stop);
        validateKey(name, start);
        currentGroup = name;
        groupListener.accept(name);
        log.trace("Group [{}] at line {}", name, lineNumber);
        pos = end + 1;
    }

    private void readValueName() {
        while (pos < line.length() && isKeyChar(line.charAt(pos))) {
            pos++;
        }
        if (pos >= line.length()) {
            throw error("unexpected newline in key name", pos);
        }
        char c = line.charAt(pos);
        if (!Character.isWhitespace(c) && c != EQUALS && c != COMMENT) {
            throw error("invalid character '" + c + "' in identifier", pos);
        }

        String key = line.substring(keyStart, pos);
        validateKey(key, keyStart);
        keyEnd = pos;

        String fullName = currentGroup.isEmpty() ? key : currentGroup + Group.SEPARATOR + key;
        int lastSeparator = fullName.lastIndexOf(Group.SEPARATOR);
        valueGroup = lastSeparator < 0 ? "" : fullName.substring(0, lastSeparator);
        valueName = fullName.substring(lastSeparator + 1);
        mode = Mode.SEARCHING_FOR_VALUE_SEPARATOR;
    }

    private void searchValueSeparator() {
        char c = line.charAt(pos);
        if (Character.isWhitespace(c)) {
            pos++;
        } else if (c == EQUALS) {
            pos++;
            mode = Mode.READING_VALUE;
        } else if (c == COMMENT) {
            throw error("comment before value separator '='", pos);
        } else {
            throw error("expected value separator '='", keyEnd);
        }
    }

    private Entry readValue() {
        char c = line.charAt(pos);
        if (Character.isWhitespace(c)) {
            pos++;
            return null;
        }
        if (c == COMMENT) {
            pos = line.length();
            return null;
        }
        if (c == TomlArray.END) {
            if (openArrays.isEmpty()) {
                throw error("unexpected array terminator", pos);
            }
            return closeArray();
        }
        if (c == TomlArray.START) {
            openArray();
            return null;
        }
        if (c == QUOTE) {
            return startString();
        }
        if (c == 't' || c == 'T' || c == 'f' || c == 'F') {
            return readBoolean();
        }
        if (CharUtils.isAsciiNumeric(c) || c == MINUS) {
            return readNumberOrDateTime();
        }
        throw error("expected value but found '" + c + "'", pos);
    }

    private Entry searchArraySeparator() {
        char c = line.charAt(pos);
        if (Character.isWhitespace(c)) {
            pos++;
        } else if (c == COMMENT) {
            pos = line.length();
        } else if (c == TomlArray.SEPARATOR) {
            pos++;
            mode = Mode.READING_VALUE;
        } else if (c == TomlArray.END) {
            return closeArray();
        } else {
            throw error("expected array separator", pos);
        }
        return null;
    }

    private void openArray() {
        TomlArray parent = openArrays.peek();
        TomlArray array = parent == null
                ? new TomlArray(valueGroup, valueName, lineNumber, pos)
                : new TomlArray(parent.getFullName(), parent.nextEntryName(), lineNumber, pos, true);
        openArrays.push(array);
        pos++;
        mode = Mode.READING_VALUE;
    }

    private Entry closeArray() {
        TomlArray array = openArrays.pop();
        array.close();
        pos++;
        return complete(array);
    }

    private Entry complete(Entry entry) {
        TomlArray parent = openArrays.peek();
        if (parent != null) {
            parent.add(entry);
            mode = Mode.SEARCHING_FOR_ARRAY_SEPARATOR;
            return null;
        }
        mode = Mode.SCANNING;
        log.trace("Read {}", entry);
        return entry;
    }

    private Entry newValue(String text, TomlType type) {
        TomlArray parent = openArrays.peek();
        if (parent == null) {
            return new Entry(valueGroup, valueName, text, valueLine, valueColumn, type);
        }
        return new Entry(parent.getFullName(), parent.nextEntryName(), text, valueLine, valueColumn, type, true);
    }

    private void markValueStart() {
        valueLine = lineNumber;
        valueColumn = pos;
    }

    private Entry startString() {
        markValueStart();
        buffer.setLength(0);
        escaping = false;
        if (line.startsWith(MULTI_LINE_QUOTE, pos)) {
            pos += MULTI_LINE_QUOTE.length();
            mode = Mode.READING_MULTI_LINE_STRING_VALUE;
            return null;
        }
        if (line.startsWith(EMPTY_STRING, pos)) {
            pos += EMPTY_STRING.length();
            return complete(newValue("", TomlType.STRING));
        }
        pos++;
        mode = Mode.READING_STRING_VALUE;
        return null;
    }

    private Entry readString() {
        while (pos < line.length()) {
            char c = line.charAt(pos);
            if (escaping) {
                buffer.append(unescape(c));
                escaping = false;
            } else if (c == ESCAPE) {
                escaping = true;
            } else if (c == QUOTE) {
                pos++;
                return complete(newValue(buffer.toString(), TomlType.STRING));
            } else {
                buffer.append(c);
            }
            pos++;
        }
        return null;
    }

    private Entry readMultiLineString() {
        while (pos < line.length()) {
            char c = line.charAt(pos);
            if (escaping) {
                buffer.append(unescape(c));
                escaping = false;
            } else if (c == ESCAPE) {
                escaping = true;
            } else if (c == QUOTE && line.startsWith(MULTI_LINE_QUOTE, pos)) {
                pos += MULTI_LINE_QUOTE.length();
                return complete(newValue(buffer.toString(), TomlType.STRING));
            } else {
                buffer.append(c);
            }
            pos++;
        }
        return null;
    }

    private char unescape(char c) {
        switch (c) {
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case '0':
                return '\0';
            case ESCAPE:
                return ESCAPE;
            case QUOTE:
                return QUOTE;
            default:
                throw error("invalid escape character '" + c + "'", pos);
        }
    }

    private Entry readBoolean() {
        markValueStart();
        int end = tokenEnd(pos);
        String text = line.substring(pos, end);
        if (!StringUtils.equalsAnyIgnoreCase(text, TRUE, FALSE)) {
            throw error("invalid boolean literal '" + text + "'", pos);
        }
        pos = end;
        return complete(newValue(text.toLowerCase(Locale.ROOT), TomlType.BOOLEAN));
    }

    // up to two minus signs in YYYY-MM-DD position keep the token a date candidate
    private Entry readNumberOrDateTime() {
        markValueStart();
        int start = pos;
        int end = tokenEnd(start);
        int digits = 0;
        int fractionDigits = 0;
        int dateSeparators = 0;
        boolean decimalPoint = false;
        boolean dateTime = false;

        for (int i = start; i < end && !dateTime; i++) {
            char c = line.charAt(i);
            if (CharUtils.isAsciiNumeric(c)) {
                digits++;
                if (decimalPoint) {
                    fractionDigits++;
                }
            } else if (c == MINUS) {
                if (i == start) {
                    continue;
                }
                boolean dateSeparator = !decimalPoint
                        && ((dateSeparators == 0 && digits == 4) || (dateSeparators == 1 && digits == 6));
                if (dateSeparator) {
                    dateSeparators++;
                } else {
                    dateTime = true;
                }
            } else if (c == DECIMAL_POINT && dateSeparators == 0) {
                if (decimalPoint) {
                    throw error("number cannot contain more than one decimal point", i);
                }
                if (digits == 0) {
                    throw error("expected digit before decimal point", i);
                }
                decimalPoint = true;
            } else if (dateSeparators > 0) {
                dateTime = true;
            } else {
                throw error("invalid character '" + c + "' in number", i);
            }
        }

        String text = line.substring(start, end);
        TomlType type;
        if (dateTime || dateSeparators > 0) {
            if (!DateTimes.isDateTime(text)) {
                throw error("invalid date-time literal '" + text + "'", start);
            }
            type = TomlType.DATETIME;
        } else {
            if (digits == 0) {
                throw error("expected digit", start);
            }
            if (decimalPoint && fractionDigits == 0) {
                throw error("expected digit after decimal point", end);
            }
            if (!decimalPoint && new BigInteger(text).bitLength() > MAX_INTEGER_BITS) {
                throw error("integer out of range '" + text + "'", start);
            }
            type = decimalPoint ? TomlType.FLOAT : TomlType.INT;
        }
        pos = end;
        return complete(newValue(text, type));
    }

    private int tokenEnd(int from) {
        int end = from;
        while (end < line.length() && !isTokenTerminator(line.charAt(end))) {
            end++;
        }
        return end;
    }

    private static boolean isTokenTerminator(char c) {
        return Character.isWhitespace(c)
                || c == TomlArray.SEPARATOR
                || c == TomlArray.END
                || c == TomlArray.START
                || c == COMMENT;
    }

    private void validateKey(String key, int column) {
        int segmentStart = 0;
        for (int i = 0; i <= key.length(); i++) {
            if (i == key.length() || key.charAt(i) == Group.SEPARATOR) {
                if (i == segmentStart) {
                    throw error("identifier cannot be empty", column + i);
                }
                segmentStart = i + 1;
                continue;
            }
            char c = key.charAt(i);
            if (i == segmentStart && CharUtils.isAsciiNumeric(c)) {
                throw error("identifier cannot start with a digit", column + i);
            }
            boolean valid = i == segmentStart ? isIdentifierStart(c) : isIdentifierPart(c);
            if (!valid) {
                throw error("invalid character '" + c + "' in identifier", column + i);
            }
        }
    }

    private static boolean isIdentifierStart(char c) {
        return CharUtils.isAsciiAlpha(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return CharUtils.isAsciiAlphanumeric(c) || c == '_' || c == MINUS;
    }

    private static boolean isKeyChar(char c) {
        return isIdentifierPart(c) || c == Group.SEPARATOR;
    }

    private ParserException error(String reason, int column) {
        return new ParserException(reason, sourceName, lineNumber, column, line);
    }
}
