package dev.jobmatcher.service;

import dev.jobmatcher.config.ScoringConfig;
import dev.jobmatcher.model.HardFilterResult;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.ResumeProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stage-one eligibility gates: location, work authorization, experience and education.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HardFilterService {

    private final ScoringConfig scoringConfig;

    /**
     * Run all four gates. Every gate is evaluated even after one fails so that all failure
     * reasons are reported.
     *
     * @param resume The candidate resume
     * @param job    The job posting
     * @return HardFilterResult with per-gate flags and failure reasons
     */
    public HardFilterResult evaluate(ResumeProfile resume, JobPosting job) {
        List<String> failureReasons = new ArrayList<>();

        // Location gate is disabled
        boolean locationMatch = true;

        boolean workAuthMatch = checkWorkAuthorization(resume.getWorkAuthorization(), job.getDescription());
        if (!workAuthMatch) {
            failureReasons.add("Work authorization requirement not clearly stated");
        }

        boolean experienceMatch = checkExperience(resume.getYearsOfExperience(), job.getMinExperience());
        if (!experienceMatch) {
            failureReasons.add("Experience requirement not met: Requires " + formatYears(job.getMinExperience())
                    + "+ years, resume shows " + formatYears(resume.getYearsOfExperience()) + " years");
        }

        boolean educationMatch = checkEducation(resume, job.getRequiredEducation());
        if (!educationMatch) {
            failureReasons.add("Education requirement not met: " + job.getRequiredEducation());
        }

        HardFilterResult result = HardFilterResult.of(locationMatch, workAuthMatch, experienceMatch,
                educationMatch, failureReasons);
        if (!result.passed()) {
            log.debug("Job '{}' failed hard filters: {}", job.getTitle(), failureReasons);
        }
        return result;
    }

    /**
     * Passes when the description names no work-authorization keyword; otherwise the resume's
     * work-authorization text must name one.
     */
    public boolean checkWorkAuthorization(String resumeWorkAuth, String jobDescription) {
        String description = lower(jobDescription);
        boolean jobRequiresAuth = scoringConfig.getWorkAuthKeywords().stream()
                .anyMatch(keyword -> description.contains(lower(keyword)));
        if (!jobRequiresAuth) {
            return true;
        }

        String resumeAuth = lower(resumeWorkAuth);
        if (resumeAuth.isEmpty()) {
            return false;
        }
        return scoringConfig.getWorkAuthKeywords().stream()
                .anyMatch(keyword -> resumeAuth.contains(lower(keyword)));
    }

    /**
     * Entry-level postings always pass; otherwise the candidate needs at least the configured
     * share of the minimum.
     */
    public boolean checkExperience(double resumeYears, double minRequired) {
        if (minRequired <= scoringConfig.getEntryLevelMaxExperience()) {
            return true;
        }
        return resumeYears >= minRequired * scoringConfig.getMinExperienceMatchRatio();
    }

    public boolean checkEducation(ResumeProfile resume, String requiredEducation) {
        if (requiredEducation == null || requiredEducation.isBlank()) {
            return true;
        }

        int requiredLevel = requiredDegreeLevel(requiredEducation);
        if (requiredLevel == 0) {
            return true;
        }
        if (!hasAnyEducation(resume)) {
            return false;
        }
        return candidateDegreeLevel(resume) >= requiredLevel;
    }

    /**
     * Level of the first degree fragment, in table order, contained in the requirement.
     * 0 when none matches.
     */
    public int requiredDegreeLevel(String requiredEducation) {
        String requirement = lower(requiredEducation);
        for (Map.Entry<String, Integer> degree : scoringConfig.getDegreeLevels().entrySet()) {
            if (requirement.contains(degree.getKey())) {
                return degree.getValue();
            }
        }
        return 0;
    }

    /**
     * Highest level found in the resume's highest degree and education entries.
     */
    public int candidateDegreeLevel(ResumeProfile resume) {
        int level = levelOf(resume.getHighestDegree());
        for (String entry : ResumeText.orEmpty(resume.getEducation())) {
            level = Math.max(level, levelOf(entry));
        }
        return level;
    }

    public boolean hasAnyEducation(ResumeProfile resume) {
        boolean hasDegree = resume.getHighestDegree() != null && !resume.getHighestDegree().isBlank();
        return hasDegree || !ResumeText.orEmpty(resume.getEducation()).isEmpty();
    }

    private int levelOf(String text) {
        String value = lower(text);
        if (value.isEmpty()) {
            return 0;
        }
        int level = 0;
        for (Map.Entry<String, Integer> degree : scoringConfig.getDegreeLevels().entrySet()) {
            if (value.contains(degree.getKey())) {
                level = Math.max(level, degree.getValue());
            }
        }
        return level;
    }

    private static String lower(String text) {
        return text != null ? text.toLowerCase(Locale.ROOT) : "";
    }

    // 5.0 -> "5", 2.5 -> "2.5"
    static String formatYears(double years) {
        if (years == Math.rint(years)) {
            return String.valueOf((long) years);
        }
        return String.valueOf(years);
    }
}
