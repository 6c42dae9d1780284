package com.paperbot.core;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword heuristic for survey / tutorial / beginner style papers.
 */
public final class EducationalClassifier {
    private static final List<String> PATTERNS = List.of(
            "\\bsurveys?\\b",
            "\\btutorials?\\b",
            "\\breviews?\\b",
            "\\bprimer\\b",
            "\\bintroduction\\b",
            "\\bintroductory\\b",
            "\\blecture\\s*notes?\\b",
            "\\bnotes?\\b",
            "\\bpedagogical\\b",
            "\\boverviews?\\b",
            "\\ba\\s+guide\\b",
            "\\bbeginners?\\b",
            "\\bfor\\s+beginners?\\b",
            "\\bfundamentals?\\b",
            "\\bfoundations?\\b",
            "\\bfrom\\s+scratch\\b",
            "\\bstep\\s*by\\s*step\\b",
            "\\bhow\\s+to\\b",
            "\\bexplainer\\b",
            "\\broadmap\\b"
    );
    private static final Pattern EDUCATIONAL = Pattern.compile(
            String.join("|", PATTERNS),
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );
    private static final Pattern SEPARATORS = Pattern.compile("[-_/]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public boolean isEducational(String title, String summary) {
        return EDUCATIONAL.matcher(normalize(title, summary)).find();
    }

    static String normalize(String title, String summary) {
        String text = (title == null ? "" : title) + "\n" + (summary == null ? "" : summary);
        text = text.toLowerCase(Locale.ROOT);
        text = SEPARATORS.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
