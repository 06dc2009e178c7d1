package com.shiv.pdfredact.util;

import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

/**
 * Glyph boxes in display space, built from the glyph's text rendering matrix so that text
 * running in any direction gets the box it is actually painted in.
 */
public final class GlyphBoxes {
    private GlyphBoxes() {}

    public static Rectangle2D box(TextPosition tp, PageGeometry geometry) {
        Matrix m = tp.getTextMatrix();
        float[] along = unit(m.getValue(0, 0), m.getValue(0, 1));
        float[] up = unit(m.getValue(1, 0), m.getValue(1, 1));
        float w = tp.getWidthDirAdj();
        float h = tp.getHeightDir();
        float ox = m.getTranslateX();
        float oy = m.getTranslateY();

        Rectangle2D box = null;
        for (int s = 0; s <= 1; s++) {
            for (int t = 0; t <= 1; t++) {
                Point2D p = geometry.cropToDisplay(
                        ox + s * w * along[0] + t * h * up[0],
                        oy + s * w * along[1] + t * h * up[1]);
                if (box == null) {
                    box = new Rectangle2D.Double(p.getX(), p.getY(), 0, 0);
                } else {
                    box.add(p);
                }
            }
        }
        return box;
    }

    private static float[] unit(float x, float y) {
        float length = (float) Math.hypot(x, y);
        return length == 0 ? new float[]{0f, 0f} : new float[]{x / length, y / length};
    }
}
