package com.shiv.pdfredact.service;

import com.shiv.pdfredact.dto.BurnResult;
import com.shiv.pdfredact.dto.MatchRect;
import com.shiv.pdfredact.dto.OmittedLabel;
import com.shiv.pdfredact.util.PageGeometry;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Burns redactions into a document: the content under each rectangle is removed from the page
 * (text and image pixels), the rectangle is filled white and a short SHA-256 label of the
 * literal is written on top so a reader can verify what was removed.
 */
@Slf4j
@Service
public class RedactionBurner {

    static final float[] LABEL_FONT_SIZES = {10f, 8f, 6f, 5f};
    static final float LABEL_PADDING = 2f;
    static final int LABEL_LENGTH = 8;

    private static final PDFont LABEL_FONT = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

    public BurnResult burn(byte[] pdf, Map<Integer, List<MatchRect>> pageHits) throws IOException {
        int burned = 0;
        List<OmittedLabel> omitted = new ArrayList<>();

        try (PDDocument doc = Loader.loadPDF(pdf)) {
            if (hasHits(pageHits)) {
                RedactionEditor editor = new RedactionEditor(doc, pageHits);
                editor.apply();
                log.debug("Removed {} glyphs and redacted {} images", editor.getRemovedGlyphs(), editor.getRedactedImages());

                for (Map.Entry<Integer, List<MatchRect>> entry : pageHits.entrySet()) {
                    if (entry.getValue().isEmpty()) continue;
                    int pageIndex = entry.getKey();
                    PDPage page = doc.getPage(pageIndex);
                    omitted.addAll(coverAndLabel(doc, page, pageIndex, entry.getValue()));
                    burned += entry.getValue().size();
                }
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return new BurnResult(out.toByteArray(), doc.getNumberOfPages(), burned, omitted);
        }
    }

    private List<OmittedLabel> coverAndLabel(PDDocument doc, PDPage page, int pageIndex, List<MatchRect> rects) throws IOException {
        PageGeometry geometry = PageGeometry.of(page);
        List<OmittedLabel> omitted = new ArrayList<>();

        try (PDPageContentStream cs = new PDPageContentStream(doc, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
            cs.setNonStrokingColor(Color.WHITE);
            for (MatchRect rect : rects) {
                Rectangle2D user = geometry.toUser(rect.getX0(), rect.getY0(), rect.getX1(), rect.getY1());
                cs.addRect((float) user.getX(), (float) user.getY(), (float) user.getWidth(), (float) user.getHeight());
            }
            cs.fill();

            cs.setNonStrokingColor(Color.BLACK);
            for (MatchRect rect : rects) {
                String label = verificationLabel(rect.getLiteral());
                MatchRect box = rect.inflate(LABEL_PADDING);
                float fontSize = fitFontSize(label, box.getWidth(), box.getHeight());
                if (fontSize <= 0) {
                    log.warn("Label {} does not fit a {}x{} box on page {}, drawing none",
                            label, box.getWidth(), box.getHeight(), pageIndex + 1);
                    omitted.add(new OmittedLabel(pageIndex, rect));
                    continue;
                }
                drawLabel(cs, geometry, box, label, fontSize);
            }
        }
        return omitted;
    }

    // centred in the box as displayed; rotated pages get a rotated text matrix so the label reads upright
    private static void drawLabel(PDPageContentStream cs, PageGeometry geometry, MatchRect box,
                                  String label, float fontSize) throws IOException {
        float textWidth = textWidth(label, fontSize);
        float ascent = ascent() * fontSize / 1000f;
        float lineHeight = lineHeight(fontSize);
        float x = box.getX0() + (box.getWidth() - textWidth) / 2f;
        float baseline = box.getY0() + (box.getHeight() - lineHeight) / 2f + ascent;

        Point2D origin = geometry.toUser(x, baseline);
        cs.beginText();
        cs.setFont(LABEL_FONT, fontSize);
        cs.setTextMatrix(Matrix.getRotateInstance(Math.toRadians(geometry.getRotation()),
                (float) origin.getX(), (float) origin.getY()));
        cs.showText(label);
        cs.endText();
    }

    // first size at which the label fits, 0 when none does
    static float fitFontSize(String label, float boxWidth, float boxHeight) throws IOException {
        for (float size : LABEL_FONT_SIZES) {
            if (textWidth(label, size) <= boxWidth && lineHeight(size) <= boxHeight) {
                return size;
            }
        }
        return 0f;
    }

    public static String verificationLabel(String literal) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(literal.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
                if (hex.length() >= LABEL_LENGTH) break;
            }
            return hex.substring(0, LABEL_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static float textWidth(String text, float fontSize) throws IOException {
        return LABEL_FONT.getStringWidth(text) / 1000f * fontSize;
    }

    private static float lineHeight(float fontSize) {
        return (ascent() - descent()) * fontSize / 1000f;
    }

    private static float ascent() {
        PDFontDescriptor fd = LABEL_FONT.getFontDescriptor();
        return fd != null && fd.getAscent() > 0 ? fd.getAscent() : 718f;
    }

    private static float descent() {
        PDFontDescriptor fd = LABEL_FONT.getFontDescriptor();
        return fd != null && fd.getDescent() < 0 ? fd.getDescent() : -207f;
    }

    private static boolean hasHits(Map<Integer, List<MatchRect>> pageHits) {
        for (List<MatchRect> rects : pageHits.values()) {
            if (!rects.isEmpty()) return true;
        }
        return false;
    }
}
