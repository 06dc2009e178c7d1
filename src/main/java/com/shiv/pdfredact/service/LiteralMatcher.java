package com.shiv.pdfredact.service;

import com.shiv.pdfredact.dto.MatchRect;
import com.shiv.pdfredact.dto.PositionedWord;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Service;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Finds every rectangle on a page that shows a literal, case-insensitively.
 * <p>
 * An exact substring pass over the page text always runs. Literals containing a space,
 * underscore or hyphen are additionally rebuilt word by word from the page's positioned words,
 * which catches literals stored as separately placed tokens.
 */
@Service
public class LiteralMatcher {

    static final char[] DELIMITERS = {' ', '_', '-'};
    static final int LOOKAHEAD = 4;
    static final float MIN_LINE_OVERLAP = 0.5f;
    static final float MIN_GAP = -2f;
    static final float MAX_GAP = 50f;

    public List<MatchRect> find(PageWordIndex page, String literal) throws IOException {
        List<MatchRect> out = new ArrayList<>(exactMatches(page.getText(), page.getPositions(), page.getBoxes(), literal));
        if (hasDelimiter(literal)) {
            out.addAll(fallbackMatches(page.getWords(), literal));
        }
        return out;
    }

    static List<MatchRect> exactMatches(String pageText, List<TextPosition> positions, List<Rectangle2D> boxes,
                                        String literal) {
        List<MatchRect> out = new ArrayList<>();
        if (literal.isEmpty()) return out;
        String hay = lowerSameLength(pageText);
        String needle = lowerSameLength(literal);

        int from = 0;
        int idx;
        while ((idx = hay.indexOf(needle, from)) >= 0) {
            out.addAll(boxesForRange(positions, boxes, idx, idx + needle.length(), literal));
            from = idx + needle.length();
        }
        return out;
    }

    static List<MatchRect> fallbackMatches(List<PositionedWord> words, String literal) {
        List<MatchRect> out = new ArrayList<>();
        for (char delimiter : DELIMITERS) {
            if (literal.indexOf(delimiter) < 0) continue;
            List<String> parts = splitParts(literal, delimiter);
            if (parts.size() < 2) continue;

            String first = parts.get(0);
            for (int start = 0; start < words.size(); start++) {
                if (!lower(words.get(start).getText()).contains(first)) continue;
                List<PositionedWord> chain = extendChain(words, start, parts);
                if (chain != null) {
                    out.add(MatchRect.union(chain, literal));
                }
            }
        }
        return out;
    }

    private static List<PositionedWord> extendChain(List<PositionedWord> words, int start, List<String> parts) {
        List<PositionedWord> chain = new ArrayList<>();
        chain.add(words.get(start));
        int current = start;

        for (int p = 1; p < parts.size(); p++) {
            String part = parts.get(p);
            PositionedWord last = chain.get(chain.size() - 1);
            int next = -1;
            for (int offset = 1; offset <= LOOKAHEAD; offset++) {
                int idx = current + offset;
                if (idx >= words.size()) break;
                PositionedWord candidate = words.get(idx);
                if (!lower(candidate.getText()).contains(part)) continue;
                if (!sameLine(last, candidate)) continue;
                if (!closeEnough(last, candidate)) continue;
                next = idx;
                break;
            }
            if (next < 0) return null;
            chain.add(words.get(next));
            current = next;
        }
        return chain;
    }

    static boolean sameLine(PositionedWord last, PositionedWord candidate) {
        float overlap = Math.max(0f, Math.min(last.getY1(), candidate.getY1()) - Math.max(last.getY0(), candidate.getY0()));
        return overlap >= candidate.getHeight() * MIN_LINE_OVERLAP;
    }

    static boolean closeEnough(PositionedWord last, PositionedWord candidate) {
        float gap = candidate.getX0() - last.getX1();
        return gap >= MIN_GAP && gap <= MAX_GAP;
    }

    static boolean hasDelimiter(String literal) {
        for (char d : DELIMITERS) {
            if (literal.indexOf(d) >= 0) return true;
        }
        return false;
    }

    private static List<String> splitParts(String literal, char delimiter) {
        List<String> parts = new ArrayList<>();
        for (String part : literal.split(Pattern.quote(String.valueOf(delimiter)))) {
            if (!part.isEmpty()) parts.add(lower(part));
        }
        return parts;
    }

    // groups the glyphs of [start, end) into one rectangle per text line; lines are told apart in
    // the text's own direction, rectangles are unions of the glyphs' display boxes
    private static List<MatchRect> boxesForRange(List<TextPosition> positions, List<Rectangle2D> boxes,
                                                 int start, int end, String literal) {
        List<MatchRect> out = new ArrayList<>();
        if (start < 0 || end > positions.size()) return out;

        float lineY = Float.NaN;
        float lineDir = Float.NaN;
        Rectangle2D line = null;

        for (int i = start; i < end; i++) {
            TextPosition tp = positions.get(i);
            if (tp == null) continue;
            float y = tp.getYDirAdj();
            boolean newLine = !Float.isNaN(lineY)
                    && (tp.getDir() != lineDir || Math.abs(y - lineY) > tp.getHeightDir() * 0.5f);
            if (newLine && line != null) {
                out.add(toRect(line, literal));
                line = null;
            }
            if (line == null) {
                lineY = y;
                lineDir = tp.getDir();
                line = new Rectangle2D.Double();
                line.setRect(boxes.get(i));
            } else {
                line.add(boxes.get(i));
            }
        }
        if (line != null) out.add(toRect(line, literal));
        return out;
    }

    private static MatchRect toRect(Rectangle2D r, String literal) {
        return new MatchRect((float) r.getMinX(), (float) r.getMinY(), (float) r.getMaxX(), (float) r.getMaxY(), literal);
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    // per-char lowering keeps indices aligned with the position list
    static String lowerSameLength(String s) {
        char[] chars = s.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }
}
