package com.shiv.pdfredact.util;

import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PageGeometryTest {

    private static final PDRectangle LETTER = PDRectangle.LETTER;   // 612 x 792

    @Test
    @DisplayName("unrotated page flips y against the crop box height")
    void unrotated() {
        PageGeometry g = new PageGeometry(LETTER, 0);

        Point2D p = g.toUser(10, 20);

        assertThat(p.getX()).isCloseTo(10, within(1e-3));
        assertThat(p.getY()).isCloseTo(772, within(1e-3));
    }

    @Test
    @DisplayName("quarter turn maps display x onto user y")
    void rotated90() {
        PageGeometry g = new PageGeometry(LETTER, 90);

        Point2D p = g.toUser(10, 20);

        assertThat(p.getX()).isCloseTo(20, within(1e-3));
        assertThat(p.getY()).isCloseTo(10, within(1e-3));
    }

    @Test
    @DisplayName("crop box offset is added back in user space")
    void cropBoxOffset() {
        PageGeometry g = new PageGeometry(new PDRectangle(50, 40, 500, 700), 0);

        Point2D p = g.toUser(0, 0);

        assertThat(p.getX()).isCloseTo(50, within(1e-3));
        assertThat(p.getY()).isCloseTo(740, within(1e-3));
    }

    @Test
    @DisplayName("display and user space conversions invert each other for every rotation")
    void inverse() {
        for (int rotation : new int[]{0, 90, 180, 270, -90, 450}) {
            PageGeometry g = new PageGeometry(LETTER, rotation);
            Point2D user = g.toUser(123.5f, 45.25f);
            Point2D back = g.toDisplay((float) user.getX(), (float) user.getY());

            assertThat(back.getX()).as("rotation %d", rotation).isCloseTo(123.5, within(1e-3));
            assertThat(back.getY()).as("rotation %d", rotation).isCloseTo(45.25, within(1e-3));
        }
    }

    @Test
    @DisplayName("rectangles keep their size under a half turn")
    void rectangleHalfTurn() {
        PageGeometry g = new PageGeometry(LETTER, 180);

        Rectangle2D r = g.toUser(100, 200, 160, 212);

        assertThat(r.getWidth()).isCloseTo(60, within(1e-3));
        assertThat(r.getHeight()).isCloseTo(12, within(1e-3));
        assertThat(r.getMinX()).isCloseTo(612 - 160, within(1e-3));
        assertThat(r.getMinY()).isCloseTo(200, within(1e-3));
    }

    @Test
    @DisplayName("crop-relative points are shifted by the crop box origin before conversion")
    void cropRelative() {
        PageGeometry g = new PageGeometry(new PDRectangle(20, 30, 500, 700), 0);

        Point2D p = g.cropToDisplay(50, 600);

        assertThat(p.getX()).isCloseTo(50, within(1e-3));
        assertThat(p.getY()).isCloseTo(100, within(1e-3));
    }
}
