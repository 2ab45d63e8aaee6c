package dev.jobmatcher.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text normalization, keyword extraction and keyword-set similarity for resumes and job
 * descriptions.
 */
@Service
public class TextAnalysisService {

    public static final int DEFAULT_MIN_KEYWORD_LENGTH = 2;

    private static final Pattern DISALLOWED_CHARS = Pattern.compile("[^a-z0-9\\s+#.]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern ACRONYM = Pattern.compile("\\b[A-Z]{2,}\\b");
    private static final Pattern DOTTED_NAME = Pattern.compile("\\b\\w+\\.\\w+\\b");
    private static final Pattern PLUS_PLUS_NAME = Pattern.compile("\\b\\w+\\+\\+(?!\\w)");
    private static final Pattern SHARP_NAME = Pattern.compile("\\b\\w+#(?!\\w)");

    private static final Pattern YEARS = Pattern.compile(
            "(\\d+\\.?\\d*)\\s*\\+?\\s*(?:years?|yrs?)", Pattern.CASE_INSENSITIVE);

    static final Set<String> STOP_WORDS = Set.copyOf(List.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "were", "been",
            "be", "have", "has", "had", "do", "does", "did", "will", "would",
            "should", "could", "may", "might", "must", "can", "this", "that",
            "these", "those", "i", "you", "he", "she", "it", "we", "they",
            "what", "which", "who", "when", "where", "why", "how", "all", "each",
            "every", "both", "few", "more", "most", "other", "some", "such", "no",
            "not", "only", "own", "same", "so", "than", "too", "very", "just",
            "also", "now", "here", "there", "then", "once", "any", "about", "into",
            "through", "during", "before", "after", "above", "below", "between",
            "under", "again", "further", "while", "our", "your", "their", "its",
            "my", "his", "her", "am", "being", "having", "doing", "work", "working",
            "experience", "using", "used", "including", "include", "includes"));

    /**
     * Lowercase, replace everything outside {@code [a-z0-9 +#.]} with spaces and collapse
     * whitespace. Null or blank input gives an empty string.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String cleaned = DISALLOWED_CHARS.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    public Set<String> extractKeywords(String text) {
        return extractKeywords(text, DEFAULT_MIN_KEYWORD_LENGTH);
    }

    /**
     * Distinct non-stop-word tokens of at least {@code minLength} characters, in order of
     * first appearance.
     */
    public Set<String> extractKeywords(String text, int minLength) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Collections.emptySet();
        }

        Set<String> keywords = new LinkedHashSet<>();
        for (String word : normalized.split(" ")) {
            if (word.length() >= minLength && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    /**
     * Percentage of {@code reference}'s vocabulary that also appears in {@code text}.
     * Not symmetric.
     */
    public double keywordOverlap(String text, String reference) {
        Set<String> referenceKeywords = extractKeywords(reference);
        if (referenceKeywords.isEmpty()) {
            return 0;
        }

        Set<String> textKeywords = extractKeywords(text);
        long overlap = referenceKeywords.stream()
                .filter(textKeywords::contains)
                .count();
        return overlap * 100.0 / referenceKeywords.size();
    }

    /**
     * Jaccard similarity of the two keyword sets, as a percentage.
     */
    public double similarity(String first, String second) {
        Set<String> firstKeywords = extractKeywords(first);
        Set<String> secondKeywords = extractKeywords(second);
        if (firstKeywords.isEmpty() || secondKeywords.isEmpty()) {
            return 0;
        }

        long intersection = firstKeywords.stream()
                .filter(secondKeywords::contains)
                .count();
        Set<String> union = new LinkedHashSet<>(firstKeywords);
        union.addAll(secondKeywords);
        return intersection * 100.0 / union.size();
    }

    /**
     * Acronyms, dotted names (node.js), and C++/C# style names, lower-cased.
     */
    public Set<String> extractTechnicalTerms(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptySet();
        }

        Set<String> terms = new LinkedHashSet<>();
        collect(ACRONYM, text, terms);
        collect(DOTTED_NAME, text, terms);
        collect(PLUS_PLUS_NAME, text, terms);
        collect(SHARP_NAME, text, terms);
        return terms;
    }

    /**
     * Every "N years" / "N+ yrs" figure mentioned in the text.
     */
    public List<Double> extractYears(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<Double> years = new ArrayList<>();
        Matcher matcher = YEARS.matcher(text);
        while (matcher.find()) {
            years.add(Double.parseDouble(matcher.group(1)));
        }
        return years;
    }

    private static void collect(Pattern pattern, String text, Set<String> into) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            into.add(matcher.group().toLowerCase(Locale.ROOT));
        }
    }
}
