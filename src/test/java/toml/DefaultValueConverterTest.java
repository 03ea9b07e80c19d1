package toml;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class DefaultValueConverterTest {

    private final DefaultValueConverter converter = new DefaultValueConverter();

    @Test
    void numbers() {
        assertEquals(Optional.of(42L), converter.convert("42", Long.class));
        assertEquals(Optional.of(-7), converter.convert("-7", Integer.class));
        assertEquals(Optional.of(7), converter.convert("7", int.class));
        assertEquals(Optional.of((short) 3), converter.convert("3", Short.class));
        assertEquals(Optional.of((byte) 1), converter.convert("1", byte.class));
        assertEquals(Optional.of(3.25), converter.convert("3.25", Double.class));
        assertEquals(Optional.of(0.5f), converter.convert("0.5", Float.class));
        assertEquals(Optional.of(new BigInteger("123456789012345678901234567890")),
                converter.convert("123456789012345678901234567890", BigInteger.class));
        assertEquals(Optional.of(new BigDecimal("1.10")), converter.convert("1.10", BigDecimal.class));
    }

    @Test
    void malformedNumbers() {
        assertFalse(converter.convert("3.25", Long.class).isPresent());
        assertFalse(converter.convert("300", Byte.class).isPresent());
        assertFalse(converter.convert("abc", Double.class).isPresent());
        assertFalse(converter.convert("NaN", Double.class).isPresent());
        assertFalse(converter.convert("", BigDecimal.class).isPresent());
    }

    @Test
    void booleans() {
        assertEquals(Optional.of(true), converter.convert("true", Boolean.class));
        assertEquals(Optional.of(false), converter.convert("FALSE", boolean.class));
        assertFalse(converter.convert("yes", Boolean.class).isPresent());
    }

    @Test
    void dateTimes() {
        var expected = OffsetDateTime.of(1979, 5, 27, 7, 32, 0, 0, ZoneOffset.ofHours(-7));

        assertEquals(Optional.of(expected), converter.convert("1979-05-27T07:32:00-07:00", OffsetDateTime.class));
        assertEquals(Optional.of(OffsetDateTime.of(1979, 5, 27, 0, 0, 0, 0, ZoneOffset.UTC)),
                converter.convert("1979-05-27", OffsetDateTime.class));
        assertEquals(Optional.of(expected.toInstant()), converter.convert("1979-05-27T07:32:00-07:00", Instant.class));
        assertEquals(Optional.of(LocalDateTime.of(1979, 5, 27, 7, 32)), converter.convert("1979-05-27T07:32:00", LocalDateTime.class));
        assertEquals(Optional.of(LocalDate.of(1979, 5, 27)), converter.convert("1979-05-27", LocalDate.class));
        assertFalse(converter.convert("1979-05-27T07:32:00Z", LocalDate.class).isPresent());
        assertFalse(converter.convert("yesterday", OffsetDateTime.class).isPresent());
    }

    @Test
    void otherTypes() {
        var uuid = UUID.randomUUID();

        assertEquals(Optional.of("text"), converter.convert("text", String.class));
        assertEquals(Optional.of('x'), converter.convert("x", char.class));
        assertFalse(converter.convert("xy", Character.class).isPresent());
        assertEquals(Optional.of(uuid), converter.convert(uuid.toString(), UUID.class));
        assertFalse(converter.convert("1-2-3-4-5", UUID.class).isPresent());
        assertEquals(Optional.of(TimeUnit.SECONDS), converter.convert("seconds", TimeUnit.class));
        assertFalse(converter.convert("fortnights", TimeUnit.class).isPresent());
    }

    @Test
    void unsupportedInput() {
        assertFalse(converter.convert("1", Thread.class).isPresent());
        assertFalse(converter.convert(null, String.class).isPresent());
        assertFalse(converter.convert("1", null).isPresent());
    }
}
