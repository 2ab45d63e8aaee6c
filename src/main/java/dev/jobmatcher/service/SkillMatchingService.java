package dev.jobmatcher.service;

import dev.jobmatcher.config.SkillCatalog;
import dev.jobmatcher.model.SkillAnalysis;
import dev.jobmatcher.model.SkillMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Synonym-aware skill matching between a resume and a job posting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkillMatchingService {

    private static final double REQUIRED_SHARE = 0.7;
    private static final double PREFERRED_SHARE = 0.3;

    private static final Map<String, String> ALIAS_OWNER = buildAliasOwners();

    private static final List<String> VOCABULARY_PHRASES = SkillCatalog.TECH_VOCABULARY.stream()
            .filter(term -> term.contains(" "))
            .sorted()
            .toList();

    private final TextAnalysisService textAnalysisService;

    /**
     * Map a skill name to its canonical form: abbreviation expansion first, then alias to
     * owning canonical skill.
     */
    public String canonicalize(String skill) {
        if (skill == null || skill.isBlank()) {
            return "";
        }
        String lower = skill.trim().toLowerCase(Locale.ROOT);
        String expanded = SkillCatalog.ABBREVIATIONS.getOrDefault(lower, lower);
        if (SkillCatalog.SYNONYMS.containsKey(expanded)) {
            return expanded;
        }
        return ALIAS_OWNER.getOrDefault(expanded, expanded);
    }

    /**
     * Distinct canonical skills, in input order.
     */
    public List<String> canonicalSkills(Collection<String> skills) {
        if (skills == null) {
            return List.of();
        }
        Set<String> canonical = new LinkedHashSet<>();
        for (String skill : skills) {
            String name = canonicalize(skill);
            if (!name.isEmpty()) {
                canonical.add(name);
            }
        }
        return List.copyOf(canonical);
    }

    /**
     * Every name the given skills are known by: the raw name, its canonical form and all of
     * the canonical form's synonyms.
     */
    public Set<String> normalizeSkills(Collection<String> skills) {
        Set<String> normalized = new LinkedHashSet<>();
        if (skills == null) {
            return normalized;
        }
        for (String skill : skills) {
            String canonical = canonicalize(skill);
            if (canonical.isEmpty()) {
                continue;
            }
            normalized.add(skill.trim().toLowerCase(Locale.ROOT));
            normalized.addAll(formsOf(canonical));
        }
        return normalized;
    }

    /**
     * Match job skills against resume skills at canonical-skill level. A job skill counts as
     * matched when the resume lists it under any of its names.
     * <p>
     * An empty resume or job list gives a 0 match with every job skill missing.
     */
    public SkillMatch matchWithSynonyms(Collection<String> resumeSkills, Collection<String> jobSkills) {
        List<String> required = canonicalSkills(jobSkills);
        if (resumeSkills == null || resumeSkills.isEmpty() || required.isEmpty()) {
            return new SkillMatch(List.of(), required, 0);
        }

        Set<String> resumeForms = normalizeSkills(resumeSkills);
        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String skill : required) {
            boolean found = formsOf(skill).stream().anyMatch(resumeForms::contains);
            if (found) {
                matched.add(skill);
            } else {
                missing.add(skill);
            }
        }

        double matchPct = (double) matched.size() / required.size();
        return new SkillMatch(List.copyOf(matched), List.copyOf(missing), matchPct);
    }

    /**
     * Match resume skills against required and preferred skills. The overall skill score
     * weighs required skills at 70% and preferred at 30%.
     */
    public SkillAnalysis matchSkills(Collection<String> resumeSkills,
                                     Collection<String> requiredSkills,
                                     Collection<String> preferredSkills) {
        SkillMatch required = matchWithSynonyms(resumeSkills, requiredSkills);
        SkillMatch preferred = matchWithSynonyms(resumeSkills, preferredSkills);

        double requiredPercentage = required.matchPct() * 100;
        double preferredPercentage = preferred.matchPct() * 100;
        double overall = requiredPercentage * REQUIRED_SHARE + preferredPercentage * PREFERRED_SHARE;

        return new SkillAnalysis(
                required.matched(),
                preferred.matched(),
                required.missing(),
                preferred.missing(),
                Scores.round2(requiredPercentage),
                Scores.round2(preferredPercentage),
                Scores.round2(overall),
                required.matched().size() + preferred.matched().size(),
                required.missing().size() + preferred.missing().size());
    }

    /**
     * Pick recognized technical skills out of free text. Used when a posting has no
     * structured skill list.
     */
    public List<String> extractSkillsFromText(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        Set<String> candidates = new LinkedHashSet<>(textAnalysisService.extractTechnicalTerms(text));
        for (String keyword : textAnalysisService.extractKeywords(text)) {
            candidates.add(keyword);
            // "java." at the end of a sentence
            if (keyword.endsWith(".")) {
                candidates.add(keyword.substring(0, keyword.length() - 1));
            }
        }

        Set<String> skills = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (SkillCatalog.TECH_VOCABULARY.contains(candidate)) {
                skills.add(candidate);
            }
        }

        String padded = " " + textAnalysisService.normalize(text) + " ";
        for (String phrase : VOCABULARY_PHRASES) {
            if (padded.contains(" " + phrase + " ")) {
                skills.add(phrase);
            }
        }

        log.debug("Extracted {} skills from {} chars of text", skills.size(), text.length());
        return List.copyOf(skills);
    }

    private static Set<String> formsOf(String canonical) {
        Set<String> forms = new LinkedHashSet<>();
        forms.add(canonical);
        forms.addAll(SkillCatalog.SYNONYMS.getOrDefault(canonical, List.of()));
        return forms;
    }

    private static Map<String, String> buildAliasOwners() {
        Map<String, String> owners = new HashMap<>();
        SkillCatalog.SYNONYMS.forEach((canonical, aliases) ->
                aliases.forEach(alias -> owners.putIfAbsent(alias, canonical)));
        return Map.copyOf(owners);
    }
}
