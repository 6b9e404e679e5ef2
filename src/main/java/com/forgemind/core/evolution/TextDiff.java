package com.forgemind.core.evolution;

import java.util.ArrayList;
import java.util.List;

/**
 * Line diff based on the longest common subsequence. Unchanged lines are prefixed with
 * two spaces, removed lines with {@code "- "} and added lines with {@code "+ "}.
 */
public final class TextDiff {

    private TextDiff() {}

    public static String lines(String before, String after) {
        String[] a = split(before);
        String[] b = split(after);
        int[][] lcs = new int[a.length + 1][b.length + 1];
        for (int i = a.length - 1; i >= 0; i--) {
            for (int j = b.length - 1; j >= 0; j--) {
                lcs[i][j] = a[i].equals(b[j]) ? lcs[i + 1][j + 1] + 1 : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }
        List<String> out = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < a.length && j < b.length) {
            if (a[i].equals(b[j])) {
                out.add("  " + a[i++]);
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                out.add("- " + a[i++]);
            } else {
                out.add("+ " + b[j++]);
            }
        }
        while (i < a.length) out.add("- " + a[i++]);
        while (j < b.length) out.add("+ " + b[j++]);
        return String.join("\n", out);
    }

    public static boolean identical(String before, String after) {
        return String.valueOf(before).equals(String.valueOf(after));
    }

    private static String[] split(String text) {
        return text == null || text.isEmpty() ? new String[0] : text.split("\\R", -1);
    }
}
