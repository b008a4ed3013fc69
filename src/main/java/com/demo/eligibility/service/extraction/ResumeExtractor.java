package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.ResumeExtraction;
import com.demo.eligibility.model.WorkExperience;
import com.demo.eligibility.service.extraction.decode.DecodedDocument;
import com.demo.eligibility.service.extraction.decode.PdfTextDecoder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class ResumeExtractor extends AbstractFieldExtractor<ResumeExtraction> {

    static final double TEXT_CONFIDENCE = 0.9;

    private static final String EXPERIENCE = "experience";
    private static final String EDUCATION = "education";
    private static final String SKILLS = "skills";

    /** Heading text (upper-cased on the page) to section key. */
    private static final Map<String, String> HEADINGS = Map.of(
            "WORK EXPERIENCE", EXPERIENCE,
            "PROFESSIONAL EXPERIENCE", EXPERIENCE,
            "EXPERIENCE", EXPERIENCE,
            "EMPLOYMENT HISTORY", EXPERIENCE,
            "EDUCATION", EDUCATION,
            "KEY SKILLS", SKILLS,
            "SKILLS", SKILLS,
            "PROFESSIONAL SUMMARY", "summary",
            "SUMMARY", "summary"
    );

    private static final List<String> DEGREE_KEYWORDS =
            List.of("bachelor", "master", "diploma", "phd", "doctorate", "high school", "associate", "mba");

    private static final Pattern ONE_LINE_ROLE = Pattern.compile(
            "^(.+?)\\s+at\\s+(.+?)\\s*\\((\\d{4})\\s*[-–]\\s*(\\d{4}|present|current)\\)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATE_RANGE = Pattern.compile(
            "^(?:[A-Za-z]+\\s+)?(\\d{4})\\s*[-–]\\s*(?:(?:[A-Za-z]+\\s+)?(\\d{4})|(present|current))$", Pattern.CASE_INSENSITIVE);

    public ResumeExtractor(PdfTextDecoder decoder) {
        super(DocumentKind.RESUME, decoder);
    }

    @Override
    protected double confidence(DecodedDocument doc) {
        return doc.hasText() ? TEXT_CONFIDENCE : 0.0;
    }

    @Override
    protected ParseResult<ResumeExtraction> parse(DecodedDocument doc, List<String> warnings) {
        Map<String, List<String>> sections = sections(doc.lines());

        List<WorkExperience> experience = workExperience(sections.getOrDefault(EXPERIENCE, doc.lines()));
        List<String> education = sections.containsKey(EDUCATION)
                ? sections.get(EDUCATION)
                : doc.lines().stream().filter(ResumeExtractor::mentionsDegree).toList();
        List<String> skills = skills(doc.lines(), sections.get(SKILLS));

        if (experience.isEmpty()) warnings.add("No work experience found");
        if (education.isEmpty()) warnings.add("No education found");
        if (skills.isEmpty()) warnings.add("No skills found");
        if (experience.isEmpty() && education.isEmpty() && skills.isEmpty()) {
            return ParseResult.err("No resume sections recognised");
        }
        return ParseResult.ok(new ResumeExtraction(experience, education, skills));
    }

    private static Map<String, List<String>> sections(List<String> lines) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        List<String> current = null;
        for (String line : lines) {
            String key = HEADINGS.get(line.strip().replaceAll(":$", "").toUpperCase(Locale.ROOT));
            if (key != null) {
                current = out.computeIfAbsent(key, k -> new ArrayList<>());
            } else if (current != null) {
                current.add(line);
            }
        }
        return out;
    }

    static List<WorkExperience> workExperience(List<String> lines) {
        List<WorkExperience> out = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher one = ONE_LINE_ROLE.matcher(line);
            if (one.matches()) {
                out.add(role(one.group(1), one.group(2), one.group(3), one.group(4)));
                continue;
            }
            Matcher range = DATE_RANGE.matcher(line);
            if (range.matches() && i >= 2) {
                String end = range.group(2) != null ? range.group(2) : range.group(3);
                out.add(role(lines.get(i - 2), lines.get(i - 1), range.group(1), end));
            }
        }
        return out;
    }

    private static WorkExperience role(String title, String employer, String startYear, String end) {
        boolean current = end.chars().allMatch(Character::isLetter);
        Integer endYear = current ? null : Integer.valueOf(end);
        return new WorkExperience(title.strip(), employer.strip(), Integer.valueOf(startYear), endYear, current);
    }

    private static boolean mentionsDegree(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return DEGREE_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private static List<String> skills(List<String> lines, List<String> section) {
        String raw = section != null ? String.join(", ", section) : TextPatterns.labelled(lines, "skills", "key skills");
        if (raw == null) return List.of();
        return Arrays.stream(raw.split("[,;•]"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
