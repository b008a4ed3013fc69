package com.demo.eligibility.service.extraction.decode;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads every sheet of a workbook into rows of cell strings. Numbers are rendered without
 * grouping or currency formatting, dates as ISO-8601.
 */
@Component
public class SpreadsheetDecoder implements DocumentDecoder {

    @Override
    public DecodedDocument decode(Path file) throws DocumentDecodingException {
        try (Workbook wb = WorkbookFactory.create(file.toFile(), null, true)) {
            Map<String, List<List<String>>> sheets = new LinkedHashMap<>();
            for (Sheet sheet : wb) {
                List<List<String>> rows = new ArrayList<>();
                for (Row row : sheet) {
                    List<String> cells = new ArrayList<>();
                    short last = row.getLastCellNum();
                    for (int i = 0; i < last; i++) {
                        Cell cell = row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                        cells.add(cell == null ? "" : render(cell, cell.getCellType()));
                    }
                    rows.add(cells);
                }
                sheets.put(sheet.getSheetName(), rows);
            }
            return DecodedDocument.ofSheets(sheets);
        } catch (IOException | RuntimeException e) {
            throw new DocumentDecodingException("Spreadsheet extraction failed for " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private String render(Cell cell, CellType type) {
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                return NumberToTextConverter.toText(cell.getNumericCellValue());
            case STRING:
                return cell.getStringCellValue().strip();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case FORMULA:
                return render(cell, cell.getCachedFormulaResultType());
            default:
                return "";
        }
    }

    @Override
    public String method() { return "apache-poi"; }
}
