package com.shiv.pdfredact.service;

import com.shiv.pdfredact.PdfFixtures;
import com.shiv.pdfredact.dto.BurnResult;
import com.shiv.pdfredact.dto.MatchRect;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RedactionBurnerTest {

    private final RedactionBurner burner = new RedactionBurner();
    private final LiteralMatcher matcher = new LiteralMatcher();

    private Map<Integer, List<MatchRect>> hits(byte[] pdf, String literal) throws Exception {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            return Map.of(0, matcher.find(new PageWordIndex(doc, 0), literal));
        }
    }

    @Test
    @DisplayName("verification label is the first 8 hex chars of the literal's SHA-256")
    void verificationLabel() {
        assertThat(RedactionBurner.verificationLabel("secret123")).isEqualTo("fcf730b6");
        assertThat(RedactionBurner.verificationLabel("John Smith")).isEqualTo("ef61a579");
    }

    @Test
    @DisplayName("label falls back to smaller sizes and gives up when nothing fits")
    void fitFontSize() throws Exception {
        assertThat(RedactionBurner.fitFontSize("fcf730b6", 100, 20)).isEqualTo(10f);
        assertThat(RedactionBurner.fitFontSize("fcf730b6", 30, 20)).isEqualTo(6f);
        assertThat(RedactionBurner.fitFontSize("fcf730b6", 100, 4)).isZero();
        assertThat(RedactionBurner.fitFontSize("fcf730b6", 10, 20)).isZero();
    }

    @Test
    @DisplayName("redacted text is gone from the text layer, the rest survives and the label is drawn")
    void removesText() throws Exception {
        byte[] pdf = PdfFixtures.textPdf("Name: secret123 end", "second line stays");

        BurnResult result = burner.burn(pdf, hits(pdf, "secret123"));

        String text = PdfFixtures.text(result.getDocument());
        assertThat(text).doesNotContain("secret123");
        assertThat(text).contains("Name:").contains("end").contains("second line stays");
        assertThat(text).contains("fcf730b6");
        assertThat(result.getBurnedRects()).isEqualTo(1);
        assertThat(result.getPageCount()).isEqualTo(1);
        assertThat(result.getOmittedLabels()).isEmpty();
    }

    @Test
    @DisplayName("burning the same hits twice gives the same text and a single label")
    void burnTwice() throws Exception {
        byte[] pdf = PdfFixtures.textPdf("Name: secret123 end");
        Map<Integer, List<MatchRect>> hits = hits(pdf, "secret123");

        BurnResult once = burner.burn(pdf, hits);
        BurnResult twice = burner.burn(once.getDocument(), hits);

        String first = PdfFixtures.text(once.getDocument());
        String second = PdfFixtures.text(twice.getDocument());
        assertThat(second).isEqualTo(first);
        assertThat(second.split("fcf730b6", -1)).hasSize(2);
        assertThat(twice.getBurnedRects()).isEqualTo(once.getBurnedRects());
    }

    @Test
    @DisplayName("text running upwards over an image is covered where it is painted")
    void verticalTextOverImage() throws Exception {
        byte[] pdf = PdfFixtures.verticalTextOverImagePdf("secret123");
        Map<Integer, List<MatchRect>> hits = hits(pdf, "secret123");
        assertThat(hits.get(0)).hasSize(1);

        // glyphs run up from (300,300) with their tops towards smaller x
        MatchRect rect = hits.get(0).get(0);
        assertThat(rect.getX0()).isLessThan(296f);
        assertThat(rect.getX1()).isGreaterThanOrEqualTo(299f);
        assertThat(rect.getY0()).isLessThan(792f - 340f);
        assertThat(rect.getY1()).isGreaterThanOrEqualTo(791f - 300f);

        BurnResult result = burner.burn(pdf, hits);

        assertThat(PdfFixtures.text(result.getDocument())).doesNotContain("secret123");
        try (PDDocument doc = Loader.loadPDF(result.getDocument())) {
            PDPage page = doc.getPage(0);
            PDImageXObject image = (PDImageXObject) page.getResources().getXObject(drawnXObjects(page).get(0));
            BufferedImage pixels = image.getImage();
            // image pixel = (user - 200) / 2, rows counted from the top at user y 400
            assertThat(pixels.getRGB(48, 40) & 0xffffff).isEqualTo(0xffffff);
            assertThat(pixels.getRGB(48, 30) & 0xffffff).isEqualTo(0xffffff);
            assertThat(pixels.getRGB(10, 10) & 0xffffff).isZero();

            BufferedImage rendered = new PDFRenderer(doc).renderImageWithDPI(0, 72);
            assertThat(rendered.getRGB(296, 792 - 320) & 0xffffff).isEqualTo(0xffffff);
            assertThat(rendered.getRGB(296, 792 - 340) & 0xffffff).isEqualTo(0xffffff);
            assertThat(rendered.getRGB(250, 792 - 250) & 0xffffff).isZero();
        }
    }

    @Test
    @DisplayName("a rectangle too small for any label size is still burned, label recorded as omitted")
    void omittedLabel() throws Exception {
        byte[] pdf = PdfFixtures.textPdf("x");
        MatchRect tiny = new MatchRect(300, 300, 304, 303, "secret123");

        BurnResult result = burner.burn(pdf, Map.of(0, List.of(tiny)));

        assertThat(result.getBurnedRects()).isEqualTo(1);
        assertThat(result.getOmittedLabels()).hasSize(1);
        assertThat(result.getOmittedLabels().get(0).getPageIndex()).isZero();
        assertThat(result.getOmittedLabels().get(0).getRect()).isEqualTo(tiny);
        assertThat(PdfFixtures.text(result.getDocument())).doesNotContain("fcf730b6");
    }

    @Test
    @DisplayName("no hits leaves the text layer untouched")
    void noHits() throws Exception {
        byte[] pdf = PdfFixtures.textPdf("nothing to hide");

        BurnResult result = burner.burn(pdf, Collections.emptyMap());

        assertThat(result.getBurnedRects()).isZero();
        assertThat(PdfFixtures.text(result.getDocument())).isEqualTo(PdfFixtures.text(pdf));
    }

    @Test
    @DisplayName("pages without hits keep their text")
    void otherPagesUntouched() throws Exception {
        byte[] pdf = PdfFixtures.pagesPdf("secret123 here", "secret123 there");
        List<MatchRect> firstPage;
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            firstPage = matcher.find(new PageWordIndex(doc, 0), "secret123");
        }

        BurnResult result = burner.burn(pdf, Map.of(0, firstPage));

        try (PDDocument doc = Loader.loadPDF(result.getDocument())) {
            assertThat(new PageWordIndex(doc, 0).getText()).doesNotContain("secret123");
            assertThat(new PageWordIndex(doc, 1).getText()).contains("secret123 there");
        }
    }

    @Test
    @DisplayName("image pixels under a rectangle are painted white in a replacement image")
    void redactsImagePixels() throws Exception {
        // image covers user (100,500)-(200,600), i.e. display y 192..292
        byte[] pdf = PdfFixtures.imagePdf(100, 500, 100);
        MatchRect rect = new MatchRect(125, 217, 175, 267, "secret123");

        BurnResult result = burner.burn(pdf, Map.of(0, List.of(rect)));

        try (PDDocument doc = Loader.loadPDF(result.getDocument())) {
            PDPage page = doc.getPage(0);
            List<COSName> drawn = drawnXObjects(page);
            assertThat(drawn).hasSize(1);

            PDImageXObject image = (PDImageXObject) page.getResources().getXObject(drawn.get(0));
            BufferedImage pixels = image.getImage();
            assertThat(pixels.getRGB(50, 50) & 0xffffff).isEqualTo(0xffffff);
            assertThat(pixels.getRGB(2, 2) & 0xffffff).isZero();
            assertThat(pixels.getRGB(97, 97) & 0xffffff).isZero();
        }

        try (PDDocument original = Loader.loadPDF(pdf)) {
            COSName originalName = drawnXObjects(original.getPage(0)).get(0);
            try (PDDocument doc = Loader.loadPDF(result.getDocument())) {
                assertThat(drawnXObjects(doc.getPage(0))).doesNotContain(originalName);
            }
        }
    }

    @Test
    @DisplayName("images away from every rectangle are left as they are")
    void imageOutsideRect() throws Exception {
        byte[] pdf = PdfFixtures.imagePdf(100, 500, 100);
        MatchRect elsewhere = new MatchRect(400, 600, 450, 620, "secret123");
        COSName originalName;
        try (PDDocument original = Loader.loadPDF(pdf)) {
            originalName = drawnXObjects(original.getPage(0)).get(0);
        }

        BurnResult result = burner.burn(pdf, Map.of(0, List.of(elsewhere)));

        try (PDDocument doc = Loader.loadPDF(result.getDocument())) {
            assertThat(drawnXObjects(doc.getPage(0))).containsExactly(originalName);
        }
    }

    private static List<COSName> drawnXObjects(PDPage page) throws Exception {
        List<Object> tokens = new PDFStreamParser(page).parse();
        List<COSName> names = new ArrayList<>();
        for (int i = 1; i < tokens.size(); i++) {
            Object token = tokens.get(i);
            if (token instanceof Operator && "Do".equals(((Operator) token).getName())
                    && tokens.get(i - 1) instanceof COSName) {
                names.add((COSName) tokens.get(i - 1));
            }
        }
        return names;
    }
}
