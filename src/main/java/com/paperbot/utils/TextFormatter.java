package com.paperbot.utils;

import org.jsoup.Jsoup;

import java.util.regex.Pattern;

public final class TextFormatter {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HTML_TAG = Pattern.compile("</?(?:b|i|em|strong|sub|sup|p|br|span|a|div)(?:\\s[^<>]*)?/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\n\t]]");

    private TextFormatter() {
    }

    public static String compactWhitespace(String s) {
        if (s == null) {
            return "";
        }
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /**
     * Feed titles and abstracts occasionally carry inline HTML; keep only text.
     * Plain {@code <} in formulas such as {@code $a<b$} is left alone.
     */
    public static String toPlainText(String s) {
        if (s == null || s.isBlank()) {
            return "";
        }
        String t = HTML_TAG.matcher(s).find() ? Jsoup.parse(s).text() : s;
        t = CONTROL_CHARS.matcher(t).replaceAll("");
        return compactWhitespace(t);
    }

    public static String truncate(String text, int maxLen) {
        String t = text == null ? "" : text;
        if (maxLen <= 3) {
            return t.substring(0, Math.min(Math.max(maxLen, 0), t.length()));
        }
        if (t.length() <= maxLen) {
            return t;
        }
        return t.substring(0, maxLen - 3).stripTrailing() + "...";
    }
}
