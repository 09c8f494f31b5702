package com.track.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Applies {@link NormalizationRule}s to track text.
 * Rules run in priority order (lower number first) after accent folding;
 * the result is lower-cased, trimmed and whitespace-collapsed.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes text for comparison: accent folding, field rules, lower case, collapsed whitespace.
     */
    public String normalize(String text, TextField field) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String result = applyRules(foldAccents(text), field);
        return collapse(result.toLowerCase(Locale.ROOT));
    }

    /**
     * Applies the field rules only, keeping case and accents. Used to sanitize search text.
     */
    public String sanitize(String text, TextField field) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return collapse(applyRules(text, field));
    }

    private String applyRules(String text, TextField field) {
        String result = text;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(field)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }
        return result;
    }

    static String foldAccents(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
