package com.alleato.insights.extraction;

import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the date an event took place from free text such as a meeting title or the first
 * lines of a transcript.
 *
 * <p>Formats are tried in a fixed priority order: ISO {@code 2024-09-23}, US numeric
 * {@code 9/23/2024} or {@code 9-23-2024}, {@code September 23, 2024},
 * {@code 23 September 2024}, then {@code 2024_09_23} or {@code 2024.09.23}. The first
 * match that is a real calendar date wins.
 */
@Component
public class DocumentDateExtractor {

    private static final String MONTH = "(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*";

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
        Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
        Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12)
    );

    private record DateFormat(Pattern pattern, Function<Matcher, LocalDate> toDate) {}

    private static final List<DateFormat> FORMATS = List.of(
        new DateFormat(Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})"),
            m -> date(m.group(1), m.group(2), m.group(3))),
        new DateFormat(Pattern.compile("(\\d{1,2})[/-](\\d{1,2})[/-](\\d{4})"),
            m -> date(m.group(3), m.group(1), m.group(2))),
        new DateFormat(Pattern.compile(MONTH + "\\s+(\\d{1,2}),\\s+(\\d{4})", Pattern.CASE_INSENSITIVE),
            m -> date(m.group(3), month(m.group(1)), m.group(2))),
        new DateFormat(Pattern.compile("(\\d{1,2})\\s+" + MONTH + "\\s+(\\d{4})", Pattern.CASE_INSENSITIVE),
            m -> date(m.group(3), month(m.group(2)), m.group(1))),
        new DateFormat(Pattern.compile("(\\d{4})[_.](\\d{2})[_.](\\d{2})"),
            m -> date(m.group(1), m.group(2), m.group(3)))
    );

    public Optional<LocalDate> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        for (DateFormat format : FORMATS) {
            Matcher matcher = format.pattern().matcher(text);
            while (matcher.find()) {
                LocalDate date = format.toDate().apply(matcher);
                if (date != null) {
                    return Optional.of(date);
                }
            }
        }
        return Optional.empty();
    }

    private static String month(String name) {
        return String.valueOf(MONTHS.get(name.substring(0, 3).toLowerCase(Locale.ROOT)));
    }

    private static LocalDate date(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException e) {
            return null;
        }
    }
}
