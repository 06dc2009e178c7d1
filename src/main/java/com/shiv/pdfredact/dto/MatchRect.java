package com.shiv.pdfredact.dto;

import lombok.Value;

import java.util.Collection;

/**
 * A rectangle to redact, in page display space (origin top-left, y down), tagged with the
 * literal it satisfies.
 */
@Value
public class MatchRect {
    float x0;
    float y0;
    float x1;
    float y1;
    String literal;

    public float getWidth() {
        return x1 - x0;
    }

    public float getHeight() {
        return y1 - y0;
    }

    public MatchRect inflate(float by) {
        return new MatchRect(x0 - by, y0 - by, x1 + by, y1 + by, literal);
    }

    public boolean contains(float x, float y) {
        return x >= x0 && x <= x1 && y >= y0 && y <= y1;
    }

    public static MatchRect union(Collection<PositionedWord> words, String literal) {
        float minX = Float.MAX_VALUE, minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE, maxY = -Float.MAX_VALUE;
        for (PositionedWord w : words) {
            minX = Math.min(minX, w.getX0());
            minY = Math.min(minY, w.getY0());
            maxX = Math.max(maxX, w.getX1());
            maxY = Math.max(maxY, w.getY1());
        }
        return new MatchRect(minX, minY, maxX, maxY, literal);
    }
}
