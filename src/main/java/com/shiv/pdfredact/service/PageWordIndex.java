package com.shiv.pdfredact.service;

import com.shiv.pdfredact.dto.PositionedWord;
import com.shiv.pdfredact.util.GlyphBoxes;
import com.shiv.pdfredact.util.PageGeometry;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Text geometry of one page, extracted on first use and kept for the rest of the page visit.
 * <p>
 * Two views are kept: the searchable page text with one {@link TextPosition} and one display-space
 * box per char ({@code null} for separators the stripper synthesizes), and the page's words in
 * reading order.
 */
public class PageWordIndex {

    private final PDDocument document;
    private final int pageIndex;
    private PositionCollector collected;

    public PageWordIndex(PDDocument document, int pageIndex) {
        this.document = document;
        this.pageIndex = pageIndex;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public String getText() throws IOException {
        return load().text.toString();
    }

    public List<TextPosition> getPositions() throws IOException {
        return Collections.unmodifiableList(load().positions);
    }

    public List<Rectangle2D> getBoxes() throws IOException {
        return Collections.unmodifiableList(load().boxes);
    }

    public List<PositionedWord> getWords() throws IOException {
        return Collections.unmodifiableList(load().words);
    }

    private PositionCollector load() throws IOException {
        if (collected == null) {
            PositionCollector stripper = new PositionCollector(pageIndex + 1);
            stripper.setSortByPosition(true);
            stripper.getText(document);
            collected = stripper;
        }
        return collected;
    }

    static class PositionCollector extends PDFTextStripper {
        final StringBuilder text = new StringBuilder();
        final List<TextPosition> positions = new ArrayList<>();
        final List<Rectangle2D> boxes = new ArrayList<>();
        final List<PositionedWord> words = new ArrayList<>();
        private final StringBuilder currentText = new StringBuilder();
        private PageGeometry geometry;

        PositionCollector(int page1Based) {
            setStartPage(page1Based);
            setEndPage(page1Based);
        }

        @Override
        public void processPage(PDPage page) throws IOException {
            geometry = PageGeometry.of(page);
            super.processPage(page);
        }

        @Override
        protected void writeString(String ignored, List<TextPosition> textPositions) {
            List<Rectangle2D> current = new ArrayList<>();
            for (TextPosition tp : textPositions) {
                String unicode = tp.getUnicode();
                if (unicode == null || unicode.isEmpty()) continue;
                Rectangle2D box = GlyphBoxes.box(tp, geometry);
                // ligatures map one glyph to several chars
                for (int i = 0; i < unicode.length(); i++) {
                    text.append(unicode.charAt(i));
                    positions.add(tp);
                    boxes.add(box);
                }
                if (unicode.isBlank()) {
                    flushWord(current);
                } else {
                    current.add(box);
                    currentText.append(unicode);
                }
            }
            flushWord(current);
        }

        @Override
        protected void writeWordSeparator() {
            text.append(' ');
            positions.add(null);
            boxes.add(null);
        }

        @Override
        protected void writeLineSeparator() {
            text.append('\n');
            positions.add(null);
            boxes.add(null);
        }

        private void flushWord(List<Rectangle2D> glyphs) {
            if (glyphs.isEmpty()) return;
            Rectangle2D union = new Rectangle2D.Double();
            union.setRect(glyphs.get(0));
            for (Rectangle2D box : glyphs) {
                union.add(box);
            }
            words.add(new PositionedWord((float) union.getMinX(), (float) union.getMinY(),
                    (float) union.getMaxX(), (float) union.getMaxY(), currentText.toString(), words.size()));
            glyphs.clear();
            currentText.setLength(0);
        }
    }
}
