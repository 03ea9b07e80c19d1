package toml;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.ClassUtils;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.regex.Pattern;

@Slf4j
public class DefaultValueConverter implements ValueConverter {

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private static final Map<Class<?>, Function<String, Object>> CONVERSIONS = new HashMap<>();

    static {
        CONVERSIONS.put(String.class, text -> text);
        CONVERSIONS.put(Long.class, Long::valueOf);
        CONVERSIONS.put(Integer.class, Integer::valueOf);
        CONVERSIONS.put(Short.class, Short::valueOf);
        CONVERSIONS.put(Byte.class, Byte::valueOf);
        CONVERSIONS.put(Double.class, text -> NumberUtils.isParsable(text) ? Double.valueOf(text) : null);
        CONVERSIONS.put(Float.class, text -> NumberUtils.isParsable(text) ? Float.valueOf(text) : null);
        CONVERSIONS.put(Boolean.class, text -> BooleanUtils.toBooleanObject(StringUtils.lowerCase(text), "true", "false", null));
        CONVERSIONS.put(BigInteger.class, BigInteger::new);
        CONVERSIONS.put(BigDecimal.class, BigDecimal::new);
        CONVERSIONS.put(Character.class, text -> text.length() == 1 ? text.charAt(0) : null);
        CONVERSIONS.put(UUID.class, text -> UUID_PATTERN.matcher(text).matches() ? UUID.fromString(text) : null);
        CONVERSIONS.put(OffsetDateTime.class, text -> DateTimes.parse(text).orElse(null));
        CONVERSIONS.put(LocalDateTime.class, LocalDateTime::parse);
        CONVERSIONS.put(LocalDate.class, LocalDate::parse);
        CONVERSIONS.put(Instant.class, text -> DateTimes.parse(text).map(OffsetDateTime::toInstant).orElse(null));
    }

    @Override
    public <T> Optional<T> convert(String text, Class<T> type) {
        if (text == null || type == null) {
            return Optional.empty();
        }
        Class<?> target = ClassUtils.primitiveToWrapper(type);
        Function<String, Object> conversion = CONVERSIONS.get(target);
        if (conversion == null && target.isEnum()) {
            conversion = raw -> toEnum(target, raw);
        }
        if (conversion == null) {
            log.debug("No conversion to {} registered", type.getName());
            return Optional.empty();
        }

        Object value;
        try {
            value = conversion.apply(text);
        } catch (IllegalArgumentException | ArithmeticException | DateTimeException e) {
            log.debug("Cannot convert '{}' to {}: {}", text, type.getName(), e.getMessage());
            return Optional.empty();
        }

        @SuppressWarnings("unchecked")
        Optional<T> result = Optional.ofNullable((T) value);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static <E extends Enum<E>> E toEnum(Class<?> enumType, String text) {
        return EnumUtils.getEnumIgnoreCase((Class<E>) enumType, text);
    }
}
