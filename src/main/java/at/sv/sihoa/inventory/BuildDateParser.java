package at.sv.sihoa.inventory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the firmware build dates reported by devices, which come in many different formats. Ambiguous numeric
 * dates are read month first.
 */
public final class BuildDateParser {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.BASIC_ISO_DATE,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            pattern("uuuu-MM-dd HH:mm[:ss]"),
            pattern("uuuu/MM/dd"),
            pattern("MM/dd/uuuu"),
            pattern("dd/MM/uuuu"),
            pattern("dd.MM.uuuu"),
            pattern("d MMM uuuu"),
            pattern("d MMMM uuuu"),
            pattern("MMM d, uuuu"),
            pattern("MMMM d, uuuu"),
            pattern("MMM d uuuu"),
            pattern("MMMM d uuuu")
    );

    private BuildDateParser() {
    }

    public static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return DATE_FORMATS.stream()
                           .map(format -> tryParse(trimmed, format))
                           .flatMap(Optional::stream)
                           .findFirst();
    }

    private static Optional<LocalDate> tryParse(String value, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(value, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter pattern(String pattern) {
        return new DateTimeFormatterBuilder().parseCaseInsensitive()
                                             .appendPattern(pattern)
                                             .toFormatter(Locale.ENGLISH)
                                             .withResolverStyle(ResolverStyle.STRICT);
    }
}
