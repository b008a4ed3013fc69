package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.AssetLiabilityExtraction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.Loan;
import com.demo.eligibility.model.Property;
import com.demo.eligibility.model.Vehicle;
import com.demo.eligibility.service.extraction.decode.DecodedDocument;
import com.demo.eligibility.service.extraction.decode.SpreadsheetDecoder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the assets/liabilities workbook. Sheet names decide how rows are read: "asset" sheets
 * hold {@code [category, description, value]}, "liabilit" sheets hold
 * {@code [category, description, amount, monthly payment, ...]}, anything else is read as
 * {@code label: value} summary rows.
 */
@Component
public class AssetLiabilityExtractor extends AbstractFieldExtractor<AssetLiabilityExtraction> {

    static final double SHEET_CONFIDENCE = 0.95;

    private static final List<String> PROPERTY_KEYWORDS = List.of("real estate", "property", "villa", "apartment", "land");
    private static final List<String> VEHICLE_KEYWORDS = List.of("vehicle", "car", "auto");
    private static final List<String> SAVINGS_KEYWORDS = List.of("liquid", "savings", "cash", "deposit", "bank");
    private static final List<String> INVESTMENT_KEYWORDS = List.of("investment", "stock", "shares", "fund", "bond");
    private static final List<String> CREDIT_CARD_KEYWORDS = List.of("credit card");

    public AssetLiabilityExtractor(SpreadsheetDecoder decoder) {
        super(DocumentKind.ASSET_LIABILITY_SHEET, decoder);
    }

    @Override
    protected double confidence(DecodedDocument doc) {
        return doc.hasNonEmptySheet() ? SHEET_CONFIDENCE : 0.0;
    }

    @Override
    protected ParseResult<AssetLiabilityExtraction> parse(DecodedDocument doc, List<String> warnings) {
        Accumulator acc = new Accumulator();
        for (Map.Entry<String, List<List<String>>> sheet : doc.sheets().entrySet()) {
            String name = sheet.getKey().toLowerCase(Locale.ROOT);
            if (name.contains("liabilit")) {
                sheet.getValue().forEach(acc::liabilityRow);
            } else if (name.contains("asset")) {
                sheet.getValue().forEach(acc::assetRow);
            } else {
                sheet.getValue().forEach(acc::summaryRow);
            }
        }
        if (!acc.anyData()) {
            return ParseResult.err("No asset or liability rows found");
        }
        AssetLiabilityExtraction result = acc.build();
        if (result.totalAssets() == null) warnings.add("Total assets not found");
        if (result.totalLiabilities() == null) warnings.add("Total liabilities not found");
        return ParseResult.ok(result);
    }

    private static boolean any(String s, List<String> keywords) {
        return keywords.stream().anyMatch(s::contains);
    }

    private static String cell(List<String> row, int i) {
        return i < row.size() ? row.get(i) : "";
    }

    private static final class Accumulator {
        final List<Property> properties = new ArrayList<>();
        final List<Vehicle> vehicles = new ArrayList<>();
        final List<Loan> loans = new ArrayList<>();
        Double savings;
        Double investments;
        Double creditCardDebt;
        Double explicitAssets;
        Double explicitLiabilities;
        double assetSum;
        double liabilitySum;
        boolean assetRows;
        boolean liabilityRows;

        void assetRow(List<String> row) {
            String category = cell(row, 0).toLowerCase(Locale.ROOT);
            Double value = TextPatterns.parseAmount(cell(row, 2));
            if (category.isBlank() || value == null) return;
            if (category.startsWith("total")) {
                explicitAssets = value;
                return;
            }
            String description = cell(row, 1);
            assetRows = true;
            assetSum += value;
            if (any(category, PROPERTY_KEYWORDS)) {
                properties.add(new Property(cell(row, 0), description, value));
            } else if (any(category, VEHICLE_KEYWORDS)) {
                vehicles.add(new Vehicle(description, value));
            } else if (any(category, INVESTMENT_KEYWORDS)) {
                investments = (investments == null ? 0 : investments) + value;
            } else if (any(category, SAVINGS_KEYWORDS)) {
                savings = (savings == null ? 0 : savings) + value;
            }
        }

        void liabilityRow(List<String> row) {
            String category = cell(row, 0).toLowerCase(Locale.ROOT);
            Double amount = TextPatterns.parseAmount(cell(row, 2));
            if (category.isBlank() || amount == null) return;
            if (category.startsWith("total")) {
                explicitLiabilities = amount;
                return;
            }
            liabilityRows = true;
            liabilitySum += amount;
            if (any(category, CREDIT_CARD_KEYWORDS)) {
                creditCardDebt = (creditCardDebt == null ? 0 : creditCardDebt) + amount;
            } else {
                loans.add(new Loan(cell(row, 0), amount, TextPatterns.parseAmount(cell(row, 3))));
            }
        }

        void summaryRow(List<String> row) {
            String label = cell(row, 0).toLowerCase(Locale.ROOT);
            if (!label.startsWith("total")) return;
            Double value = TextPatterns.parseAmount(cell(row, 1));
            if (value == null) return;
            if (label.contains("asset")) {
                explicitAssets = value;
            } else if (label.contains("liabilit")) {
                explicitLiabilities = value;
            }
        }

        boolean anyData() {
            return assetRows || liabilityRows || explicitAssets != null || explicitLiabilities != null;
        }

        AssetLiabilityExtraction build() {
            Double totalAssets = explicitAssets != null ? explicitAssets : (assetRows ? assetSum : null);
            Double totalLiabilities = explicitLiabilities != null ? explicitLiabilities
                    : (liabilityRows ? liabilitySum : (totalAssets != null ? 0.0 : null));
            return new AssetLiabilityExtraction(properties, vehicles, savings, investments, loans,
                    creditCardDebt, totalAssets, totalLiabilities);
        }
    }
}
