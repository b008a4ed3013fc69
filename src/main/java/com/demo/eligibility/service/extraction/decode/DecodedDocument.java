package com.demo.eligibility.service.extraction.decode;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Raw content of one decoded file: text lines and table rows for PDFs and images, sheet cells
 * for workbooks, a tree for JSON. Absent parts are empty, never {@code null}.
 */
public record DecodedDocument(
        List<String> lines,
        List<List<String>> tableRows,
        Map<String, List<List<String>>> sheets,
        JsonNode json
) {
    private static final Pattern COLUMN_GAP = Pattern.compile("\\t|\\s{2,}");

    public DecodedDocument {
        lines = lines == null ? List.of() : List.copyOf(lines);
        tableRows = tableRows == null ? List.of() : tableRows.stream().map(List::copyOf).toList();
        sheets = sheets == null ? Map.of() : copySheets(sheets);
    }

    /** Splits text into trimmed non-blank lines; rows with three or more gap-separated cells count as table rows. */
    public static DecodedDocument ofText(String text) {
        if (text == null || text.isBlank()) {
            return new DecodedDocument(List.of(), List.of(), Map.of(), null);
        }
        List<String> lines = text.lines().map(String::strip).filter(l -> !l.isEmpty()).toList();
        List<List<String>> rows = lines.stream()
                .map(l -> Arrays.stream(COLUMN_GAP.split(l)).map(String::strip).filter(c -> !c.isEmpty()).toList())
                .filter(cells -> cells.size() >= 3)
                .toList();
        return new DecodedDocument(lines, rows, Map.of(), null);
    }

    public static DecodedDocument ofSheets(Map<String, List<List<String>>> sheets) {
        return new DecodedDocument(List.of(), List.of(), sheets, null);
    }

    public static DecodedDocument ofJson(JsonNode json) {
        return new DecodedDocument(List.of(), List.of(), Map.of(), json);
    }

    public boolean hasText() {
        return !lines.isEmpty();
    }

    public String text() {
        return String.join("\n", lines);
    }

    public boolean hasNonEmptySheet() {
        return sheets.values().stream().anyMatch(rows -> rows.stream().anyMatch(r -> r.stream().anyMatch(c -> !c.isBlank())));
    }

    private static Map<String, List<List<String>>> copySheets(Map<String, List<List<String>>> in) {
        Map<String, List<List<String>>> out = new LinkedHashMap<>();
        in.forEach((name, rows) -> out.put(name, rows.stream().map(List::copyOf).toList()));
        return java.util.Collections.unmodifiableMap(out);
    }
}
