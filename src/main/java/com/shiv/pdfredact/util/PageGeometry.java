package com.shiv.pdfredact.util;

import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

/**
 * Converts between display space (what text extraction reports: origin at the top-left of the
 * page as shown, y down) and PDF user space (origin bottom-left of the unrotated crop box, y up).
 */
public final class PageGeometry {

    private final float llx;
    private final float lly;
    private final float width;
    private final float height;
    private final int rotation;

    PageGeometry(PDRectangle cropBox, int rotation) {
        this.llx = cropBox.getLowerLeftX();
        this.lly = cropBox.getLowerLeftY();
        this.width = cropBox.getWidth();
        this.height = cropBox.getHeight();
        this.rotation = ((rotation % 360) + 360) % 360;
    }

    public static PageGeometry of(PDPage page) {
        return new PageGeometry(page.getCropBox(), page.getRotation());
    }

    public int getRotation() {
        return rotation;
    }

    public Point2D toUser(float dx, float dy) {
        float a, b;
        switch (rotation) {
            case 90:  a = dy;          b = dx;          break;
            case 180: a = width - dx;  b = dy;          break;
            case 270: a = width - dy;  b = height - dx; break;
            default:  a = dx;          b = height - dy; break;
        }
        return new Point2D.Float(llx + a, lly + b);
    }

    public Point2D toDisplay(float ux, float uy) {
        float a = ux - llx;
        float b = uy - lly;
        switch (rotation) {
            case 90:  return new Point2D.Float(b, a);
            case 180: return new Point2D.Float(width - a, b);
            case 270: return new Point2D.Float(height - b, width - a);
            default:  return new Point2D.Float(a, height - b);
        }
    }

    // text positions report user space relative to the crop box's lower-left corner
    public Point2D cropToDisplay(float x, float y) {
        return toDisplay(llx + x, lly + y);
    }

    public Rectangle2D toUser(float x0, float y0, float x1, float y1) {
        Point2D p = toUser(x0, y0);
        Rectangle2D r = new Rectangle2D.Double(p.getX(), p.getY(), 0, 0);
        r.add(toUser(x1, y0));
        r.add(toUser(x0, y1));
        r.add(toUser(x1, y1));
        return r;
    }
}
