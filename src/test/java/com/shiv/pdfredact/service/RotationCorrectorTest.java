package com.shiv.pdfredact.service;

import com.shiv.pdfredact.PdfFixtures;
import com.shiv.pdfredact.config.RedactionProperties;
import com.shiv.pdfredact.exception.OcrEngineException;
import com.shiv.pdfredact.service.ocr.OrientationDetector;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RotationCorrectorTest {

    @Mock
    private OrientationDetector detector;

    private RedactionProperties properties;
    private RotationCorrector corrector;

    @BeforeEach
    void setUp() {
        properties = new RedactionProperties();
        properties.getRotation().setDpi(36);
        corrector = new RotationCorrector(detector, properties);
    }

    // a third of the page is black, well below the blank threshold
    private static byte[] darkPage() throws Exception {
        return PdfFixtures.imagePdf(0, 0, 400);
    }

    private static int rotationOf(byte[] pdf) throws Exception {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            return doc.getPage(0).getRotation();
        }
    }

    @Test
    @DisplayName("detected angle is added to the page rotation")
    void rotates() throws Exception {
        when(detector.detectRotation(any())).thenReturn(90);

        assertThat(rotationOf(corrector.correct(darkPage()))).isEqualTo(90);
    }

    @Test
    @DisplayName("rotation wraps around at 360")
    void wraps() throws Exception {
        byte[] pdf;
        try (PDDocument doc = Loader.loadPDF(darkPage())) {
            doc.getPage(0).setRotation(270);
            pdf = PdfFixtures.save(doc);
        }
        when(detector.detectRotation(any())).thenReturn(180);

        assertThat(rotationOf(corrector.correct(pdf))).isEqualTo(90);
    }

    @Test
    @DisplayName("blank pages are never sent to the detector")
    void blankPage() throws Exception {
        assertThat(rotationOf(corrector.correct(PdfFixtures.blankPdf(1)))).isZero();
        verifyNoInteractions(detector);
    }

    @Test
    @DisplayName("a detector failure leaves the page as it is")
    void detectorFailure() throws Exception {
        when(detector.detectRotation(any())).thenThrow(new OcrEngineException("Too few characters"));

        assertThat(rotationOf(corrector.correct(darkPage()))).isZero();
    }

    @Test
    @DisplayName("disabled correction returns the input untouched")
    void disabled() throws Exception {
        properties.getRotation().setEnabled(false);
        byte[] pdf = darkPage();

        assertThat(corrector.correct(pdf)).isSameAs(pdf);
        verifyNoInteractions(detector);
    }

    @Test
    @DisplayName("blank means mean luminance above the threshold")
    void isBlank() {
        BufferedImage white = filled(Color.WHITE);
        BufferedImage black = filled(Color.BLACK);
        BufferedImage mostlyWhite = filled(Color.WHITE);
        Graphics2D g = mostlyWhite.createGraphics();
        g.setColor(Color.BLACK);
        g.fillRect(0, 0, 10, 1);     // 1% of the pixels
        g.dispose();

        assertThat(RotationCorrector.isBlank(white, 0.98)).isTrue();
        assertThat(RotationCorrector.isBlank(black, 0.98)).isFalse();
        assertThat(RotationCorrector.isBlank(mostlyWhite, 0.98)).isTrue();
        assertThat(RotationCorrector.isBlank(mostlyWhite, 0.995)).isFalse();
    }

    private static BufferedImage filled(Color color) {
        BufferedImage image = new BufferedImage(100, 10, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, 100, 10);
        g.dispose();
        return image;
    }
}
