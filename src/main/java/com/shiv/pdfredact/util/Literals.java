package com.shiv.pdfredact.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class Literals {
    private Literals() {}

    public static List<String> normalize(List<String> literals) {
        Set<String> out = new LinkedHashSet<>();
        if (literals == null) return new ArrayList<>();
        for (String literal : literals) {
            if (literal == null) continue;
            String trimmed = literal.trim();
            if (!trimmed.isEmpty()) out.add(trimmed);
        }
        return new ArrayList<>(out);
    }

    public static List<String> fromCsv(String words) {
        if (words == null) return new ArrayList<>();
        return normalize(Arrays.asList(words.split(",")));
    }
}
