package toml;

import lombok.Getter;

/**
 * A lexical or structural error. Parsing stops at the first one; there is no recovery.
 */
@Getter
public class ParserException extends TomlException {

    private final String sourceName;
    private final int lineNumber;
    private final int column;
    private final String lineText;
    private final String reason;

    public ParserException(String reason, String sourceName, int lineNumber, int column, String lineText) {
        super(format(reason, sourceName, lineNumber, column, lineText));
        this.reason = reason;
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
        this.column = column;
        this.lineText = lineText == null ? "" : lineText;
    }

    private static String format(String reason, String sourceName, int lineNumber, int column, String lineText) {
        StringBuilder sb = new StringBuilder(reason)
                .append(" at line ").append(lineNumber)
                .append(", column ").append(column);
        if (sourceName != null) {
            sb.append(" of <").append(sourceName).append('>');
        }
        sb.append(": ").append(lineText == null ? "" : lineText);
        return sb.toString();
    }
}
