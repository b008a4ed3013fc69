package com.demo.eligibility.service.extraction;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Date, amount and label patterns shared by the text extractors. */
public final class TextPatterns {

    /** ISO, day-first numeric, and "May 15, 1990" / "15 May 1990" forms. */
    public static final String DATE =
            "\\d{4}[-/]\\d{2}[-/]\\d{2}"
            + "|\\d{2}[-/]\\d{2}[-/]\\d{4}"
            + "|(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.? \\d{1,2}, \\d{4}"
            + "|\\d{1,2} (?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]* \\d{4}";

    public static final Pattern DATE_TOKEN = Pattern.compile("(?<![\\d/-])(" + DATE + ")(?![\\d/-])");

    /** Amount with an explicit currency prefix, e.g. {@code AED 12,500.00}. */
    public static final Pattern CURRENCY_AMOUNT =
            Pattern.compile("\\b(AED|USD|EUR|GBP)\\s*(-?[\\d,]+(?:\\.\\d+)?)");

    private static final Pattern MONTH_YEAR = Pattern.compile(
            "(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]* (\\d{4})", Pattern.CASE_INSENSITIVE);

    private static final DateTimeFormatter MONTH_YEAR_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive().appendPattern("MMM yyyy").toFormatter(Locale.ENGLISH);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH)
    );

    private TextPatterns() {}

    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.strip().replace(".", "");
        for (DateTimeFormatter f : DATE_FORMATS) {
            LocalDate d = tryParse(s, f);
            if (d != null) return d;
        }
        return null;
    }

    private static LocalDate tryParse(String s, DateTimeFormatter f) {
        try {
            return LocalDate.parse(s, f);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Every parseable date token, in order of appearance. */
    public static List<LocalDate> findDates(String text) {
        List<LocalDate> out = new ArrayList<>();
        if (text == null) return out;
        Matcher m = DATE_TOKEN.matcher(text);
        while (m.find()) {
            LocalDate d = parseDate(m.group(1));
            if (d != null) out.add(d);
        }
        return out;
    }

    public static LocalDate firstDate(String text) {
        List<LocalDate> dates = findDates(text);
        return dates.isEmpty() ? null : dates.get(0);
    }

    /** "March 2021" as the first day of that month. */
    public static LocalDate parseMonthYear(String raw) {
        if (raw == null) return null;
        Matcher m = MONTH_YEAR.matcher(raw);
        if (!m.find()) return null;
        try {
            return YearMonth.parse(m.group(1).substring(0, 3) + " " + m.group(2), MONTH_YEAR_FORMAT).atDay(1);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Parses "AED 1,234.50", "(1,234.50)" or "-1234.5"; {@code null} if no number is present. */
    public static Double parseAmount(String raw) {
        if (raw == null) return null;
        String s = raw.strip();
        boolean negative = s.startsWith("(") && s.endsWith(")");
        s = s.replaceAll("(?i)AED|USD|EUR|GBP|[,()\\s]", "");
        if (s.isEmpty()) return null;
        try {
            double v = Double.parseDouble(s);
            return negative ? -Math.abs(v) : v;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Value after the first {@code label:} line whose label is one of {@code labels},
     * compared case-insensitively; {@code null} if none has a value.
     */
    public static String labelled(List<String> lines, String... labels) {
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            String key = line.substring(0, colon).strip().toLowerCase(Locale.ROOT);
            for (String label : labels) {
                if (key.equals(label)) {
                    String value = line.substring(colon + 1).strip();
                    if (!value.isEmpty()) return value;
                }
            }
        }
        return null;
    }

    public static String flatten(List<String> lines) {
        return String.join(" ", lines).replaceAll("\\s+", " ");
    }
}
