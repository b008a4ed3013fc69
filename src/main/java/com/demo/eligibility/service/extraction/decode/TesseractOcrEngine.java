package com.demo.eligibility.service.extraction.decode;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Tesseract through Tess4J. Images are converted to RGB and small scans are upscaled to
 * {@value #MIN_WIDTH} pixels wide before recognition. Needs the native tesseract library and
 * the trained data for every configured language.
 */
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    static final int MIN_WIDTH = 1000;

    private final String dataPath;
    private final String language;

    public TesseractOcrEngine(String dataPath, String language) {
        this.dataPath = dataPath;
        this.language = language;
    }

    @Override
    public String recognize(byte[] image) throws DocumentDecodingException {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(new ByteArrayInputStream(image));
        } catch (IOException e) {
            throw new DocumentDecodingException("Cannot decode image: " + e.getMessage(), e);
        }
        if (decoded == null) {
            throw new DocumentDecodingException("Unsupported image format");
        }
        BufferedImage prepared = prepare(decoded);

        // instances are not thread-safe, one per call
        ITesseract tesseract = new Tesseract();
        if (dataPath != null && !dataPath.isBlank()) tesseract.setDatapath(dataPath);
        tesseract.setLanguage(language);
        try {
            String text = tesseract.doOCR(prepared);
            log.debug("Tesseract read {} chars ({}x{})", text.length(), prepared.getWidth(), prepared.getHeight());
            return text;
        } catch (TesseractException e) {
            throw new DocumentDecodingException("Tesseract failed: " + e.getMessage(), e);
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            throw new DocumentDecodingException("Tesseract native library not available: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() { return "tesseract"; }

    /** RGB copy, upscaled so the width is at least {@link #MIN_WIDTH} with the aspect ratio kept. */
    static BufferedImage prepare(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        double scale = width < MIN_WIDTH ? (double) MIN_WIDTH / width : 1.0;
        int w = (int) Math.round(width * scale);
        int h = (int) Math.round(height * scale);

        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.drawImage(source, 0, 0, w, h, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
