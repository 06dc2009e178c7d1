package com.shiv.pdfredact.service;

import com.shiv.pdfredact.dto.EvidenceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

@Slf4j
@Service
public class TextEvidenceMeter {

    public EvidenceSnapshot measure(byte[] pdf, List<String> literals) {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            PDFTextStripper stripper = new PDFTextStripper();
            int chars = 0;
            int hits = 0;
            for (int p = 1; p <= doc.getNumberOfPages(); p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                String pageText = stripper.getText(doc);
                chars += pageText.length();
                hits += countHits(pageText, literals);
            }
            return new EvidenceSnapshot(chars, hits);
        } catch (IOException e) {
            log.error("Could not measure text evidence: {}", e.getMessage(), e);
            return new EvidenceSnapshot(0, 0);
        }
    }

    // case-sensitive, non-overlapping
    static int countHits(String text, List<String> literals) {
        int hits = 0;
        for (String literal : literals) {
            if (literal == null || literal.isBlank()) continue;
            int from = 0;
            int idx;
            while ((idx = text.indexOf(literal, from)) >= 0) {
                hits++;
                from = idx + literal.length();
            }
        }
        return hits;
    }
}
