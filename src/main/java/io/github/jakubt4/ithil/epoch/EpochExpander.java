package io.github.jakubt4.ithil.epoch;

import io.github.jakubt4.ithil.error.InvalidEpochException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Expands an epoch expression into the observing nights it covers.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>a single night, {@code 20151001} or {@code 2015-10-01}</li>
 *   <li>{@code today} or {@code yesterday}, resolved against the injected {@link Clock}</li>
 *   <li>{@code 20151001-20151005}: a range of two compact nights</li>
 *   <li>{@code start/end}: a range of any two single-night forms</li>
 * </ul>
 * Ranges include both endpoints. The result is ascending and free of duplicates.
 */
@Component
@RequiredArgsConstructor
public class EpochExpander {

    private static final DateTimeFormatter DAY_OBS =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern COMPACT_DAY = Pattern.compile("\\d{8}");
    private static final Pattern COMPACT_RANGE = Pattern.compile("(\\d{8})-(\\d{8})");
    private static final String RANGE_SEPARATOR = "/";

    private final Clock clock;

    /**
     * @param expression epoch expression, see class docs
     * @return nights from start through end, ascending
     * @throws InvalidEpochException if the expression cannot be parsed or start is after end
     */
    public List<LocalDate> expand(final String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidEpochException(expression, "an epoch is required");
        }
        final var trimmed = expression.trim();

        final LocalDate start;
        final LocalDate end;
        final var compactRange = COMPACT_RANGE.matcher(trimmed);
        if (compactRange.matches()) {
            start = parseDay(expression, compactRange.group(1));
            end = parseDay(expression, compactRange.group(2));
        } else if (trimmed.contains(RANGE_SEPARATOR)) {
            final var bounds = trimmed.split(RANGE_SEPARATOR, -1);
            if (bounds.length != 2) {
                throw new InvalidEpochException(expression, "a range has exactly two endpoints");
            }
            start = parseDay(expression, bounds[0].trim());
            end = parseDay(expression, bounds[1].trim());
        } else {
            start = parseDay(expression, trimmed);
            end = start;
        }

        if (start.isAfter(end)) {
            throw new InvalidEpochException(expression, "start " + start + " is after end " + end);
        }
        return Stream.concat(start.datesUntil(end), Stream.of(end)).toList();
    }

    /**
     * Compact {@code yyyyMMdd} rendering of a night, as used in product paths.
     */
    public static String dayObs(final LocalDate night) {
        return DAY_OBS.format(night);
    }

    private LocalDate parseDay(final String expression, final String token) {
        return switch (token.toLowerCase(Locale.ROOT)) {
            case "today" -> LocalDate.now(clock);
            case "yesterday" -> LocalDate.now(clock).minusDays(1);
            default -> parseDate(expression, token);
        };
    }

    private static LocalDate parseDate(final String expression, final String token) {
        try {
            final var format = COMPACT_DAY.matcher(token).matches() ? DAY_OBS : DateTimeFormatter.ISO_LOCAL_DATE;
            return LocalDate.parse(token, format);
        } catch (final DateTimeParseException e) {
            throw new InvalidEpochException(expression, "'" + token + "' is not a valid date", e);
        }
    }
}
