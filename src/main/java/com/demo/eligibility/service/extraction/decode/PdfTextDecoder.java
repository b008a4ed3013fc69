package com.demo.eligibility.service.extraction.decode;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
@Component
public class PdfTextDecoder implements DocumentDecoder {

    private static final int MAX_CHARS = 200_000;

    @Override
    public DecodedDocument decode(Path file) throws DocumentDecodingException {
        try (PDDocument doc = Loader.loadPDF(file.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(doc);
            if (text.length() > MAX_CHARS) {
                log.warn("PDF text of {} truncated to {} chars", file.getFileName(), MAX_CHARS);
                text = text.substring(0, MAX_CHARS);
            }
            log.debug("Extracted {} chars from {}", text.length(), file.getFileName());
            return DecodedDocument.ofText(text);
        } catch (IOException e) {
            throw new DocumentDecodingException("PDF extraction failed for " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String method() { return "pdfbox"; }
}
