package com.shiv.pdfredact.service;

import com.shiv.pdfredact.dto.BurnResult;
import com.shiv.pdfredact.dto.MatchRect;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentRedactor {

    private final LiteralMatcher matcher;
    private final RedactionBurner burner;

    public BurnResult redact(byte[] pdf, List<String> literals) throws IOException {
        return redact(pdf, literals, new CancellationToken());
    }

    public BurnResult redact(byte[] pdf, List<String> literals, CancellationToken token) throws IOException {
        return burner.burn(pdf, findHits(pdf, literals, token));
    }

    Map<Integer, List<MatchRect>> findHits(byte[] pdf, List<String> literals, CancellationToken token) throws IOException {
        Map<Integer, List<MatchRect>> hits = new TreeMap<>();
        if (literals.isEmpty()) return hits;

        try (PDDocument doc = Loader.loadPDF(pdf)) {
            for (int i = 0; i < doc.getNumberOfPages(); i++) {
                token.checkpoint("redaction");
                PageWordIndex index = new PageWordIndex(doc, i);
                List<MatchRect> pageHits = new ArrayList<>();
                for (String literal : literals) {
                    pageHits.addAll(matcher.find(index, literal));
                }
                if (!pageHits.isEmpty()) {
                    log.debug("Page {}: {} match rect(s)", i + 1, pageHits.size());
                    hits.put(i, pageHits);
                }
            }
        }
        return hits;
    }
}
