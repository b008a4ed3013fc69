package com.demo.eligibility.service.extraction.decode;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
@RequiredArgsConstructor
public class ImageTextDecoder implements DocumentDecoder {

    private final OcrEngine ocrEngine;

    @Override
    public DecodedDocument decode(Path file) throws DocumentDecodingException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new DocumentDecodingException("Cannot read image " + file.getFileName() + ": " + e.getMessage(), e);
        }
        if (bytes.length == 0) {
            throw new DocumentDecodingException("Empty image file: " + file.getFileName());
        }
        return DecodedDocument.ofText(ocrEngine.recognize(bytes));
    }

    @Override
    public String method() { return "ocr:" + ocrEngine.name(); }
}
