package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.PersonalInfo;
import com.demo.eligibility.service.extraction.decode.DecodedDocument;
import com.demo.eligibility.service.extraction.decode.ImageTextDecoder;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class IdentityCardExtractor extends AbstractFieldExtractor<PersonalInfo> {

    static final double FULL_CONFIDENCE = 0.85;
    static final double PARTIAL_CONFIDENCE = 0.65;

    /** Dash-delimited id such as 784-1990-1234567-1; OCR may read dashes as spaces. */
    private static final Pattern NATIONAL_ID = Pattern.compile("(?<!\\d)(\\d{3})[-\\s](\\d{4})[-\\s](\\d{7,8})[-\\s](\\d)(?!\\d)");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern LETTER = Pattern.compile("\\p{L}");
    private static final Pattern NAME_LINE = Pattern.compile("^\\p{Lu}[\\p{L}'.-]+(?:\\s+\\p{Lu}[\\p{L}'.-]+)+$");

    /** Lines printed on every card that must not be taken for a holder's name. */
    private static final List<String> CARD_HEADINGS = List.of(
            "united arab emirates", "identity card", "resident identity", "emirates id",
            "federal authority", "identity and citizenship");

    private static final List<String> MARITAL_VALUES = List.of("single", "married", "divorced", "widowed");

    public IdentityCardExtractor(ImageTextDecoder decoder) {
        super(DocumentKind.IDENTITY_CARD, decoder);
    }

    @Override
    protected double confidence(DecodedDocument doc) {
        if (!doc.hasText()) return 0.0;
        String text = doc.text();
        boolean digits = DIGIT.matcher(text).find();
        boolean letters = LETTER.matcher(text).find();
        if (digits && letters) return FULL_CONFIDENCE;
        return digits || letters ? PARTIAL_CONFIDENCE : 0.0;
    }

    @Override
    protected ParseResult<PersonalInfo> parse(DecodedDocument doc, List<String> warnings) {
        List<String> lines = doc.lines();
        String name = TextPatterns.labelled(lines, "name", "full name", "holder name");
        if (name == null) name = firstNameLikeLine(lines);
        String nationalId = findNationalId(doc.text());
        LocalDate dob = dateOfBirth(lines);
        String nationality = TextPatterns.labelled(lines, "nationality", "citizenship");
        String gender = gender(lines);
        String marital = marital(lines);

        if (name == null) warnings.add("Name not found");
        if (nationalId == null) warnings.add("National id not found");
        if (dob == null) warnings.add("Date of birth not found");
        if (name == null && nationalId == null && dob == null) {
            return ParseResult.err("No identity fields recognised");
        }
        return ParseResult.ok(new PersonalInfo(name, nationalId, dob, nationality, marital, gender));
    }

    static String findNationalId(String text) {
        Matcher m = NATIONAL_ID.matcher(text);
        if (!m.find()) return null;
        return String.join("-", m.group(1), m.group(2), m.group(3), m.group(4));
    }

    private static String firstNameLikeLine(List<String> lines) {
        for (String line : lines) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (CARD_HEADINGS.stream().anyMatch(lower::contains)) continue;
            if (NAME_LINE.matcher(line).matches()) return line;
        }
        return null;
    }

    private static LocalDate dateOfBirth(List<String> lines) {
        String labelled = TextPatterns.labelled(lines, "dob", "date of birth", "birth date");
        if (labelled != null) return TextPatterns.firstDate(labelled);
        for (String line : lines) {
            if (line.toLowerCase(Locale.ROOT).contains("birth")) {
                LocalDate d = TextPatterns.firstDate(line);
                if (d != null) return d;
            }
        }
        return null;
    }

    private static String gender(List<String> lines) {
        String v = TextPatterns.labelled(lines, "gender", "sex");
        if (v == null) return null;
        String lower = v.toLowerCase(Locale.ROOT);
        if (lower.startsWith("f")) return "Female";
        if (lower.startsWith("m")) return "Male";
        return null;
    }

    private static String marital(List<String> lines) {
        String v = TextPatterns.labelled(lines, "marital status", "marital");
        if (v == null) return null;
        String lower = v.toLowerCase(Locale.ROOT);
        return MARITAL_VALUES.stream().filter(lower::startsWith).findFirst()
                .map(s -> Character.toUpperCase(s.charAt(0)) + s.substring(1))
                .orElse(v);
    }
}
