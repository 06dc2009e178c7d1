package com.shiv.pdfredact.service;

import com.shiv.pdfredact.config.RedactionProperties;
import com.shiv.pdfredact.exception.OcrEngineException;
import com.shiv.pdfredact.service.ocr.OrientationDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Sets each page's /Rotate so that its content reads upright. Blank pages are left alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RotationCorrector {

    private final OrientationDetector detector;
    private final RedactionProperties properties;

    public byte[] correct(byte[] pdf) throws IOException {
        RedactionProperties.Rotation cfg = properties.getRotation();
        if (!cfg.isEnabled()) {
            return pdf;
        }
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            PDFRenderer renderer = new PDFRenderer(doc);
            int rotated = 0;
            for (int i = 0; i < doc.getNumberOfPages(); i++) {
                BufferedImage image = renderer.renderImageWithDPI(i, cfg.getDpi(), ImageType.RGB);
                int angle = isBlank(image, cfg.getBlankThreshold()) ? 0 : detect(image, i);
                image.flush();
                if (angle % 360 != 0) {
                    PDPage page = doc.getPage(i);
                    int newRotation = (page.getRotation() + angle) % 360;
                    log.info("Page {}: rotating by {} (now {})", i + 1, angle, newRotation);
                    page.setRotation(newRotation);
                    rotated++;
                }
            }
            log.debug("Rotation correction touched {} of {} page(s)", rotated, doc.getNumberOfPages());
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    private int detect(BufferedImage image, int pageIndex) {
        try {
            return detector.detectRotation(image);
        } catch (OcrEngineException e) {
            log.warn("Orientation detection failed on page {}, keeping it as is: {}", pageIndex + 1, e.getMessage());
            return 0;
        }
    }

    static boolean isBlank(BufferedImage image, double threshold) {
        long total = 0;
        int w = image.getWidth();
        int h = image.getHeight();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xff;
                int g = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                total += (r * 299 + g * 587 + b * 114) / 1000;
            }
        }
        double mean = (double) total / ((long) w * h);
        return mean / 255.0 > threshold;
    }
}
