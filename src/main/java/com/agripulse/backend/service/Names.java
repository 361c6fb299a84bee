package com.agripulse.backend.service;

import java.util.Locale;

/**
 * Display helpers for commodity and place names.
 */
public final class Names {

    private Names() {
    }

    /**
     * Place names: "NEW delhi" -> "New Delhi".
     */
    public static String titleCase(String s) {
        if (s == null || s.isBlank()) {
            return s;
        }
        String[] words = s.trim().toLowerCase(Locale.ROOT).split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1));
        }
        return sb.toString();
    }

    /**
     * Commodity display form, as data.gov.in filters expect it: only the first
     * letter is upper case. "basmati RICE" -> "Basmati rice".
     */
    public static String capitalize(String s) {
        if (s == null || s.isBlank()) {
            return s;
        }
        String t = s.trim().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(t.charAt(0)) + t.substring(1);
    }
}
