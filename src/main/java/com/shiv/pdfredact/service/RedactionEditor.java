package com.shiv.pdfredact.service;

import com.shiv.pdfredact.dto.MatchRect;
import com.shiv.pdfredact.util.GlyphBoxes;
import com.shiv.pdfredact.util.PageGeometry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSFloat;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.pdmodel.graphics.state.PDTextState;
import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;
import org.apache.pdfbox.util.Vector;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Removes every glyph whose centre lies in a redaction rectangle and whites out the pixels of
 * any image painted under one. Glyphs are taken out of the show-text operators themselves, so
 * nothing of the removed text is left in the content stream.
 */
@Slf4j
class RedactionEditor extends ContentStreamEditor {

    private static final List<String> TEXT_SHOWING_OPERATORS = Arrays.asList(
            OperatorName.SHOW_TEXT, OperatorName.SHOW_TEXT_ADJUSTED,
            OperatorName.SHOW_TEXT_LINE, OperatorName.SHOW_TEXT_LINE_AND_SPACE);

    private final Map<Integer, List<MatchRect>> pageHits;
    private List<MatchRect> pageRects = Collections.emptyList();
    private PageGeometry geometry;

    // glyphs shown by the operator currently executing, in show order
    private final List<Glyph> operatorGlyphs = new ArrayList<>();
    private Glyph pending;

    @Getter
    private int removedGlyphs;
    @Getter
    private int redactedImages;

    RedactionEditor(PDDocument document, Map<Integer, List<MatchRect>> pageHits) {
        super(document);
        this.pageHits = pageHits;
    }

    void apply() throws IOException {
        for (Map.Entry<Integer, List<MatchRect>> entry : pageHits.entrySet()) {
            if (entry.getValue().isEmpty()) continue;
            int page1Based = entry.getKey() + 1;
            setStartPage(page1Based);
            setEndPage(page1Based);
            getText(document);
        }
    }

    @Override
    public void processPage(PDPage page) throws IOException {
        pageRects = pageHits.getOrDefault(getCurrentPageNo() - 1, Collections.emptyList());
        geometry = PageGeometry.of(page);
        super.processPage(page);
    }

    @Override
    protected void nextOperation(Operator operator, List<COSBase> operands) {
        operatorGlyphs.clear();
        pending = null;
    }

    @Override
    protected void showGlyph(Matrix textRenderingMatrix, PDFont font, int code, Vector displacement) throws IOException {
        // a third of an em up from the origin, along the glyph's own vertical axis
        Glyph glyph = new Glyph(
                textRenderingMatrix.getTranslateX() + textRenderingMatrix.getValue(1, 0) / 3f,
                textRenderingMatrix.getTranslateY() + textRenderingMatrix.getValue(1, 1) / 3f);
        operatorGlyphs.add(glyph);
        pending = glyph;
        try {
            super.showGlyph(textRenderingMatrix, font, code, displacement);
        } finally {
            pending = null;
        }
    }

    @Override
    protected void processTextPosition(TextPosition text) {
        if (pending != null) {
            pending.position = text;
        }
        super.processTextPosition(text);
    }

    @Override
    protected void write(ContentStreamWriter writer, Operator operator, List<COSBase> operands) throws IOException {
        String name = operator.getName();
        if (TEXT_SHOWING_OPERATORS.contains(name) && markRemovals()) {
            writePatchedText(writer, name, operands);
            return;
        }
        if (OperatorName.DRAW_OBJECT.equals(name) && !operands.isEmpty() && operands.get(0) instanceof COSName) {
            COSName replacement = redactImage((COSName) operands.get(0));
            if (replacement != null) {
                writer.writeTokens(replacement, operator);
                return;
            }
        }
        super.write(writer, operator, operands);
    }

    private boolean markRemovals() {
        boolean any = false;
        for (Glyph glyph : operatorGlyphs) {
            glyph.removed = insideAnyRect(glyph);
            any |= glyph.removed;
        }
        return any;
    }

    private boolean insideAnyRect(Glyph glyph) {
        float cx, cy;
        if (glyph.position != null) {
            Rectangle2D box = GlyphBoxes.box(glyph.position, geometry);
            cx = (float) box.getCenterX();
            cy = (float) box.getCenterY();
        } else {
            // no unicode mapping, so no text position: approximate from the origin
            Point2D p = geometry.toDisplay(glyph.anchorX, glyph.anchorY);
            cx = (float) p.getX();
            cy = (float) p.getY();
        }
        for (MatchRect rect : pageRects) {
            if (rect.contains(cx, cy)) return true;
        }
        return false;
    }

    // re-emitted as TJ: surviving glyph bytes kept, each removed glyph replaced by its advance
    private void writePatchedText(ContentStreamWriter writer, String name, List<COSBase> operands) throws IOException {
        List<COSBase> parts = new ArrayList<>();
        if (OperatorName.SHOW_TEXT_ADJUSTED.equals(name)) {
            for (COSBase item : (COSArray) operands.get(0)) {
                parts.add(item);
            }
        } else if (OperatorName.SHOW_TEXT_LINE_AND_SPACE.equals(name)) {
            writer.writeTokens(operands.get(0), Operator.getOperator(OperatorName.SET_WORD_SPACING));
            writer.writeTokens(operands.get(1), Operator.getOperator(OperatorName.SET_CHAR_SPACING));
            writer.writeToken(Operator.getOperator(OperatorName.NEXT_LINE));
            parts.add(operands.get(2));
        } else {
            if (OperatorName.SHOW_TEXT_LINE.equals(name)) {
                writer.writeToken(Operator.getOperator(OperatorName.NEXT_LINE));
            }
            parts.add(operands.get(0));
        }

        PDTextState textState = getGraphicsState().getTextState();
        PDFont font = textState.getFont();
        COSArray patched = new COSArray();
        int slot = 0;
        for (COSBase part : parts) {
            if (part instanceof COSNumber) {
                patched.add(part);
                continue;
            }
            if (!(part instanceof COSString)) continue;

            byte[] bytes = ((COSString) part).getBytes();
            ByteArrayInputStream in = new ByteArrayInputStream(bytes);
            ByteArrayOutputStream kept = new ByteArrayOutputStream();
            while (in.available() > 0) {
                int offset = bytes.length - in.available();
                int code = font.readCode(in);
                int length = bytes.length - in.available() - offset;
                Glyph glyph = slot < operatorGlyphs.size() ? operatorGlyphs.get(slot) : null;
                slot++;
                if (glyph != null && glyph.removed) {
                    if (kept.size() > 0) {
                        patched.add(new COSString(kept.toByteArray()));
                        kept.reset();
                    }
                    patched.add(new COSFloat(-advance(font, code, length, textState)));
                    removedGlyphs++;
                } else {
                    kept.write(bytes, offset, length);
                }
            }
            if (kept.size() > 0) {
                patched.add(new COSString(kept.toByteArray()));
            }
        }
        writer.writeTokens(patched, Operator.getOperator(OperatorName.SHOW_TEXT_ADJUSTED));
    }

    // horizontal advance of one glyph in TJ units (thousandths of text space)
    private static float advance(PDFont font, int code, int codeLength, PDTextState state) throws IOException {
        float advance = font.getWidth(code);
        float fontSize = state.getFontSize();
        if (fontSize != 0) {
            float spacing = state.getCharacterSpacing();
            if (codeLength == 1 && code == 32) {
                spacing += state.getWordSpacing();
            }
            advance += spacing * 1000f / fontSize;
        }
        return advance;
    }

    // null when the image touches no rectangle
    private COSName redactImage(COSName name) throws IOException {
        if (pageRects.isEmpty()) return null;
        PDXObject xobject = getResources().getXObject(name);
        if (!(xobject instanceof PDImageXObject)) return null;
        PDImageXObject image = (PDImageXObject) xobject;
        if (image.isStencil()) return null;

        AffineTransform toUnitSquare;
        try {
            toUnitSquare = getGraphicsState().getCurrentTransformationMatrix().createAffineTransform().createInverse();
        } catch (NoninvertibleTransformException e) {
            log.warn("Skipping image {} with a degenerate placement matrix", name.getName());
            return null;
        }

        BufferedImage source = image.getImage();
        int w = source.getWidth();
        int h = source.getHeight();
        BufferedImage copy = null;
        Graphics2D g = null;
        try {
            for (MatchRect rect : pageRects) {
                Rectangle2D user = geometry.toUser(rect.getX0(), rect.getY0(), rect.getX1(), rect.getY1());
                Rectangle2D unit = toUnitSquare.createTransformedShape(user).getBounds2D()
                        .createIntersection(new Rectangle2D.Double(0, 0, 1, 1));
                if (unit.isEmpty()) continue;

                if (copy == null) {
                    copy = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
                    g = copy.createGraphics();
                    g.drawImage(source, 0, 0, null);
                    g.setColor(Color.WHITE);
                }
                // unit square has y up, image rows run top-down
                int px0 = (int) Math.floor(unit.getMinX() * w);
                int px1 = (int) Math.ceil(unit.getMaxX() * w);
                int py0 = (int) Math.floor((1 - unit.getMaxY()) * h);
                int py1 = (int) Math.ceil((1 - unit.getMinY()) * h);
                g.fillRect(px0, py0, px1 - px0, py1 - py0);
            }
        } finally {
            if (g != null) g.dispose();
        }
        if (copy == null) return null;

        PDImageXObject redacted = LosslessFactory.createFromImage(document, copy);
        redactedImages++;
        return getResources().add(redacted, "Im");
    }

    private static class Glyph {
        final float anchorX;
        final float anchorY;
        TextPosition position;
        boolean removed;

        Glyph(float anchorX, float anchorY) {
            this.anchorX = anchorX;
            this.anchorY = anchorY;
        }
    }
}
