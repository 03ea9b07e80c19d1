package toml;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Date-time literals: an offset date-time, a local date-time or a local date, all ISO-8601.
 * Local values are read as UTC.
 */
final class DateTimes {

    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private DateTimes() {
    }

    static boolean isDateTime(String text) {
        return parse(text).isPresent();
    }

    static Optional<OffsetDateTime> parse(String text) {
        TemporalAccessor parsed;
        try {
            parsed = FORMAT.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        if (parsed instanceof OffsetDateTime) {
            return Optional.of((OffsetDateTime) parsed);
        }
        if (parsed instanceof LocalDateTime) {
            return Optional.of(((LocalDateTime) parsed).atOffset(ZoneOffset.UTC));
        }
        return Optional.of(((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC));
    }
}
