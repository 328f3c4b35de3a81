package com.jeevanfit.backend.insight.service;

import java.text.Normalizer;
import java.text.Normalizer.Form;
import java.util.List;
import java.util.Locale;

/**
 * 判斷兩段文字（rationale / summary）是否「幾乎相同」：
 * 1) NFKD 去重音 → NFKC
 * 2) 去標點、小寫、壓縮空白
 * 3) 以 code point 計算 Jaro-Winkler（共同前綴最多 4、scaling 0.1），門檻 0.92
 */
final class RationaleSimilarity {

    static final double NEAR_IDENTICAL = 0.92;

    private static final int MAX_PREFIX = 4;
    private static final double PREFIX_SCALE = 0.1;

    private RationaleSimilarity() {}

    static boolean nearIdentical(List<String> a, List<String> b) {
        return nearIdentical(String.join(" ", a), String.join(" ", b));
    }

    static boolean nearIdentical(String a, String b) {
        return similarity(normalize(a), normalize(b)) >= NEAR_IDENTICAL;
    }

    static String normalize(String s) {
        if (s == null || s.isEmpty()) return "";
        String t = Normalizer.normalize(s, Form.NFKD);

        StringBuilder sb = new StringBuilder(t.length());
        t.codePoints()
                .filter(cp -> Character.getType(cp) != Character.NON_SPACING_MARK)
                .forEach(sb::appendCodePoint);
        t = Normalizer.normalize(sb, Form.NFKC);

        t = t.replaceAll("[\\p{Punct}→·]", " ");
        return t.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    static double similarity(String s1, String s2) {
        if (s1 == null || s2 == null) return 0d;
        if (s1.equals(s2)) return 1d;

        int[] a = s1.codePoints().toArray();
        int[] b = s2.codePoints().toArray();
        if (a.length == 0 || b.length == 0) return 0d;

        int window = Math.max(0, Math.max(a.length, b.length) / 2 - 1);
        boolean[] usedA = new boolean[a.length];
        boolean[] usedB = new boolean[b.length];
        int matches = markMatches(a, b, window, usedA, usedB);
        if (matches == 0) return 0d;

        double m = matches;
        double halfTranspositions = outOfOrder(a, b, usedA, usedB) / 2.0;
        double jaro = (m / a.length + m / b.length + (m - halfTranspositions) / m) / 3.0;

        return jaro + PREFIX_SCALE * commonPrefix(a, b) * (1 - jaro);
    }

    /** 在視窗內為 a 的每個字找 b 裡第一個還沒配對的相同字 */
    private static int markMatches(int[] a, int[] b, int window, boolean[] usedA, boolean[] usedB) {
        int matches = 0;
        for (int i = 0; i < a.length; i++) {
            int hi = Math.min(i + window + 1, b.length);
            for (int j = Math.max(0, i - window); j < hi; j++) {
                if (usedB[j] || a[i] != b[j]) continue;
                usedA[i] = true;
                usedB[j] = true;
                matches++;
                break;
            }
        }
        return matches;
    }

    /** 配對到的字依序比對，順序不同的個數 */
    private static int outOfOrder(int[] a, int[] b, boolean[] usedA, boolean[] usedB) {
        int count = 0;
        int j = 0;
        for (int i = 0; i < a.length; i++) {
            if (!usedA[i]) continue;
            while (!usedB[j]) j++;
            if (a[i] != b[j++]) count++;
        }
        return count;
    }

    private static int commonPrefix(int[] a, int[] b) {
        int limit = Math.min(MAX_PREFIX, Math.min(a.length, b.length));
        int n = 0;
        while (n < limit && a[n] == b[n]) n++;
        return n;
    }
}
