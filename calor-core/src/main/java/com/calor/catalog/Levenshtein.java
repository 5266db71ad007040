package com.calor.catalog;

final class Levenshtein {

    private Levenshtein() {
    }

    /**
     * Case-insensitive edit distance using two rolling rows.
     */
    static int distance(String s1, String s2) {
        if (s1 == null || s1.isEmpty()) {
            return s2 == null ? 0 : s2.length();
        }
        if (s2 == null || s2.isEmpty()) {
            return s1.length();
        }

        int m = s1.length();
        int n = s2.length();
        int[] prev = new int[n + 1];
        int[] curr = new int[n + 1];

        for (int j = 0; j <= n; j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= m; i++) {
            curr[0] = i;
            char a = Character.toLowerCase(s1.charAt(i - 1));
            for (int j = 1; j <= n; j++) {
                int cost = a == Character.toLowerCase(s2.charAt(j - 1)) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }

        return prev[n];
    }
}
