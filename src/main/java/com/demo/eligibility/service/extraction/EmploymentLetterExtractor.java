package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.EmploymentInfo;
import com.demo.eligibility.service.extraction.decode.DecodedDocument;
import com.demo.eligibility.service.extraction.decode.PdfTextDecoder;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class EmploymentLetterExtractor extends AbstractFieldExtractor<EmploymentInfo> {

    static final double TEXT_CONFIDENCE = 0.9;

    private static final Pattern EMPLOYER_PROSE =
            Pattern.compile("(?i)(?:employee of|employed (?:by|with)|working (?:for|with))\\s+(.+?)\\s*[.,]");
    private static final Pattern TITLE_PROSE =
            Pattern.compile("(?i)(?:employed as|working as|position of|designation of)\\s+(?:an?\\s+)?(.+?)\\s+(?:in|at|with|since)\\b");
    private static final Pattern SALARY_NEAR_KEYWORD = Pattern.compile(
            "(?i)salary[^.]{0,80}?\\b(AED|USD|EUR|GBP)\\s*([\\d,]+(?:\\.\\d+)?)");
    private static final Pattern START_PROSE = Pattern.compile(
            "(?i)(?:joined [^.]{0,60}? on|since|with effect from|commenced (?:employment )?on)\\s+(" + TextPatterns.DATE + ")");
    private static final Pattern END_PROSE = Pattern.compile(
            "(?i)(?:last working day (?:was|is)|until|employment ended on)\\s+(" + TextPatterns.DATE + ")");

    public EmploymentLetterExtractor(PdfTextDecoder decoder) {
        super(DocumentKind.EMPLOYMENT_LETTER, decoder);
    }

    @Override
    protected double confidence(DecodedDocument doc) {
        return doc.hasText() ? TEXT_CONFIDENCE : 0.0;
    }

    @Override
    protected ParseResult<EmploymentInfo> parse(DecodedDocument doc, List<String> warnings) {
        List<String> lines = doc.lines();
        String flat = TextPatterns.flatten(lines);

        String employer = TextPatterns.labelled(lines, "employer", "company", "company name", "organization");
        if (employer == null) employer = group(EMPLOYER_PROSE, flat, 1);
        String title = TextPatterns.labelled(lines, "position", "job title", "designation", "title");
        if (title == null) title = group(TITLE_PROSE, flat, 1);

        Double salary = null;
        String currency = null;
        Matcher sm = SALARY_NEAR_KEYWORD.matcher(flat);
        if (!sm.find()) {
            sm = TextPatterns.CURRENCY_AMOUNT.matcher(flat);
            if (!sm.find()) sm = null;
        }
        if (sm != null) {
            currency = sm.group(1).toUpperCase(Locale.ROOT);
            salary = TextPatterns.parseAmount(sm.group(2));
        }

        LocalDate start = dateField(lines, flat, START_PROSE, "start date", "date of joining", "joining date");
        LocalDate end = dateField(lines, flat, END_PROSE, "end date", "last working day");

        if (employer == null) warnings.add("Employer not found");
        if (title == null) warnings.add("Job title not found");
        if (salary == null) warnings.add("Salary with currency not found");
        if (employer == null && title == null && salary == null && start == null) {
            return ParseResult.err("No employment fields recognised");
        }
        return ParseResult.ok(new EmploymentInfo(employer, title, start, end, salary, currency));
    }

    private static LocalDate dateField(List<String> lines, String flat, Pattern prose, String... labels) {
        String labelled = TextPatterns.labelled(lines, labels);
        if (labelled != null) {
            LocalDate d = TextPatterns.firstDate(labelled);
            if (d != null) return d;
        }
        String raw = group(prose, flat, 1);
        return raw == null ? null : TextPatterns.parseDate(raw);
    }

    private static String group(Pattern p, String text, int group) {
        Matcher m = p.matcher(text);
        if (!m.find()) return null;
        String v = m.group(group).strip();
        return v.isEmpty() ? null : v;
    }
}
