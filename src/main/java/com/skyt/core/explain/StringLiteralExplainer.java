package com.skyt.core.explain;

import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regular-expression literals in the candidate that are close variants of a
 * canon literal. A pair whose character classes differ is reported as
 * {@link DifferenceType#REGEX_CHARACTER_CLASS_DIFFERENCE}; any other variation
 * as {@link DifferenceType#REGEX_PATTERN_VARIATION}.
 *
 * Similarity is driven by shared escape sequences ({@code \d}, {@code \w}, ...):
 * a negated class never matches a non-negated one, identical escape sets score
 * at least 0.9, partial overlap at most 0.5. Pairs need 0.7 to count.
 */
@Component
public class StringLiteralExplainer implements PropertyExplainer {

    public static final String HINT_REPLACEMENTS = "replacements";

    private static final double  MATCH_THRESHOLD = 0.7;
    private static final String  REGEX_CHARS     = "[]\\+*.^$|?{}";
    private static final Pattern ESCAPE          = Pattern.compile("\\\\[a-zA-Z]");
    private static final Pattern CHAR_CLASS      = Pattern.compile("\\[([^\\]]+)\\]");

    @Override
    public PropertyKind getPropertyKind() {
        return PropertyKind.STRING_LITERALS;
    }

    @Override
    public PropertyDifference explain(PropertyValue candidateValue, PropertyValue canonValue,
                                      ExplanationContext context) {
        List<StringLiteralExpr> candidateLiterals = literals(context.getCandidate());
        List<StringLiteralExpr> canonLiterals     = literals(context.getCanon());

        Map<String, String> replacements = new LinkedHashMap<>();
        List<String> summaries = new ArrayList<>();
        boolean classDifference = false;

        for (StringLiteralExpr literal : candidateLiterals) {
            String pattern = literal.asString();
            if (!looksLikeRegex(pattern) || replacements.containsKey(literal.getValue())) continue;

            StringLiteralExpr match = bestMatch(pattern, canonLiterals);
            if (match == null) continue;

            Set<String> candidateClasses = characterClasses(pattern);
            Set<String> canonClasses     = characterClasses(match.asString());
            boolean classesDiffer = !candidateClasses.isEmpty() && !canonClasses.isEmpty()
                    && !candidateClasses.equals(canonClasses);
            classDifference |= classesDiffer;

            replacements.put(literal.getValue(), match.getValue());
            summaries.add(classesDiffer
                    ? "character classes differ: " + candidateClasses + " vs " + canonClasses
                      + " (" + pattern + " to " + match.asString() + ")"
                    : pattern + " to " + match.asString());
        }

        if (replacements.isEmpty()) {
            return null;
        }
        DifferenceType type = classDifference
                ? DifferenceType.REGEX_CHARACTER_CLASS_DIFFERENCE
                : DifferenceType.REGEX_PATTERN_VARIATION;
        return PropertyDifference.builder(type)
                .explanation("Regex pattern variations: " + String.join("; ", summaries))
                .hints(TransformationHints.builder().putMap(HINT_REPLACEMENTS, replacements).build())
                .candidateDetail(String.valueOf(candidateValue))
                .canonDetail(String.valueOf(canonValue))
                .build();
    }

    // =========================================================================
    // Similarity
    // =========================================================================

    private StringLiteralExpr bestMatch(String pattern, List<StringLiteralExpr> canonLiterals) {
        StringLiteralExpr best = null;
        double bestScore = 0.0;
        for (StringLiteralExpr canon : canonLiterals) {
            String canonPattern = canon.asString();
            if (!looksLikeRegex(canonPattern) || canonPattern.equals(pattern)) continue;
            double score = similarity(pattern, canonPattern);
            if (score > bestScore && score >= MATCH_THRESHOLD) {
                bestScore = score;
                best = canon;
            }
        }
        return best;
    }

    static boolean looksLikeRegex(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (REGEX_CHARS.indexOf(s.charAt(i)) >= 0) return true;
        }
        return false;
    }

    static double similarity(String a, String b) {
        if (a.equals(b)) return 1.0;
        if (a.contains("[^") != b.contains("[^")) return 0.0;

        Set<String> aEscapes = escapes(a);
        Set<String> bEscapes = escapes(b);
        if (aEscapes.isEmpty() || bEscapes.isEmpty()) return 0.0;

        Set<String> shared = new TreeSet<>(aEscapes);
        shared.retainAll(bEscapes);
        if (shared.isEmpty()) return 0.0;

        if (aEscapes.equals(bEscapes)) {
            double lengthSimilarity = 1.0 - Math.min(
                    (double) Math.abs(a.length() - b.length()) / Math.max(a.length(), b.length()), 1.0);
            return 0.9 + lengthSimilarity * 0.1;
        }
        return (double) shared.size() / Math.max(aEscapes.size(), bEscapes.size()) * 0.5;
    }

    private static Set<String> escapes(String pattern) {
        Set<String> found = new TreeSet<>();
        Matcher m = ESCAPE.matcher(pattern);
        while (m.find()) found.add(m.group());
        return found;
    }

    /** Tokens inside every {@code [...]}: ranges like {@code a-z}, escapes like {@code \d}, single chars. */
    static Set<String> characterClasses(String pattern) {
        Set<String> tokens = new TreeSet<>();
        Matcher m = CHAR_CLASS.matcher(pattern);
        while (m.find()) {
            String content = m.group(1);
            int i = 0;
            while (i < content.length()) {
                char c = content.charAt(i);
                if (c == '^') {
                    i++;
                } else if (c == '\\' && i + 1 < content.length()) {
                    tokens.add("\\" + content.charAt(i + 1));
                    i += 2;
                } else if (i + 2 < content.length() && content.charAt(i + 1) == '-') {
                    tokens.add(c + "-" + content.charAt(i + 2));
                    i += 3;
                } else {
                    tokens.add(String.valueOf(c));
                    i++;
                }
            }
        }
        return tokens;
    }

    private static List<StringLiteralExpr> literals(ParsedSource source) {
        return source.getCompilationUnit().findAll(StringLiteralExpr.class);
    }
}
