package com.shiv.pdfredact.service;

import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDStream;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDTransparencyGroup;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Text stripper that re-writes every content stream it parses, operator by operator.
 * <p>
 * Subclasses see each top-level operator twice: {@link #nextOperation} before it is executed
 * and {@link #write} after, with the graphics state as the operator left it. The default write
 * copies the operator unchanged. Form XObjects painted by the page are re-written the same way.
 */
public class ContentStreamEditor extends PDFTextStripper {

    protected final PDDocument document;
    private final Deque<ContentStreamWriter> writers = new ArrayDeque<>();
    private boolean inOperator = false;

    public ContentStreamEditor(PDDocument document) {
        this.document = document;
    }

    @Override
    public void processPage(PDPage page) throws IOException {
        int pageNo = getCurrentPageNo();
        if (pageNo < getStartPage() || pageNo > getEndPage()) {
            super.processPage(page);
            return;
        }
        PDStream stream = new PDStream(document);
        try (OutputStream out = stream.createOutputStream(COSName.FLATE_DECODE)) {
            writers.push(new ContentStreamWriter(out));
            try {
                super.processPage(page);
            } finally {
                writers.pop();
            }
        }
        page.setContents(stream);
    }

    @Override
    public void showForm(PDFormXObject form) throws IOException {
        ByteArrayOutputStream buffer = beginForm();
        boolean outer = inOperator;
        inOperator = false;
        try {
            super.showForm(form);
        } finally {
            inOperator = outer;
            writers.pop();
        }
        endForm(form, buffer);
    }

    @Override
    public void showTransparencyGroup(PDTransparencyGroup form) throws IOException {
        ByteArrayOutputStream buffer = beginForm();
        boolean outer = inOperator;
        inOperator = false;
        try {
            super.showTransparencyGroup(form);
        } finally {
            inOperator = outer;
            writers.pop();
        }
        endForm(form, buffer);
    }

    private ByteArrayOutputStream beginForm() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        writers.push(new ContentStreamWriter(buffer));
        return buffer;
    }

    // the form stream is still being parsed while operators are written, so it is replaced afterwards
    private void endForm(PDFormXObject form, ByteArrayOutputStream buffer) throws IOException {
        try (OutputStream out = form.getStream().createOutputStream(COSName.FLATE_DECODE)) {
            out.write(buffer.toByteArray());
        }
    }

    @Override
    protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
        if (inOperator) {
            super.processOperator(operator, operands);
        } else {
            inOperator = true;
            try {
                nextOperation(operator, operands);
                super.processOperator(operator, operands);
                write(writers.peek(), operator, operands);
            } finally {
                inOperator = false;
            }
        }
    }

    protected void nextOperation(Operator operator, List<COSBase> operands) {
    }

    protected void write(ContentStreamWriter writer, Operator operator, List<COSBase> operands) throws IOException {
        writer.writeTokens(operands);
        writer.writeToken(operator);
    }
}
