package com.demo.eligibility.service.extraction.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

@Component
@RequiredArgsConstructor
public class JsonDocumentDecoder implements DocumentDecoder {

    private final ObjectMapper objectMapper;

    @Override
    public DecodedDocument decode(Path file) throws DocumentDecodingException {
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || root.isMissingNode()) {
                throw new DocumentDecodingException("Empty JSON document: " + file.getFileName());
            }
            return DecodedDocument.ofJson(root);
        } catch (IOException e) {
            throw new DocumentDecodingException("JSON parsing failed for " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String method() { return "jackson"; }
}
