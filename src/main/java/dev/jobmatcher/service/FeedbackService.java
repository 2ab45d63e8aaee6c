package dev.jobmatcher.service;

import dev.jobmatcher.model.HardFilterResult;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.RelevanceScore;
import dev.jobmatcher.model.ResumeProfile;
import dev.jobmatcher.model.SkillAnalysis;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable feedback and improvement tips for an analyzed (resume, job) pair.
 */
@Service
public class FeedbackService {

    static final int MAX_RECOMMENDATIONS = 5;
    private static final int TOP_MISSING_SKILLS = 3;

    public String feedback(HardFilterResult hardFilters, RelevanceScore relevance, SkillAnalysis skillAnalysis) {
        if (!hardFilters.passed()) {
            return "Resume did not pass initial screening. Issues: "
                    + String.join(", ", hardFilters.failureReasons());
        }
        if (relevance == null) {
            return "Unable to calculate relevance score.";
        }

        StringBuilder feedback = new StringBuilder(band(relevance.weightedTotal()));

        if (relevance.skillsScore() < 70) {
            feedback.append(String.format(Locale.ROOT, " Your skills match score is %.0f%%.", relevance.skillsScore()));
        }
        if (skillAnalysis.totalMissing() > 0) {
            feedback.append(" You're missing ").append(skillAnalysis.totalMissing())
                    .append(" required/preferred skills.");
        }
        if (relevance.experienceScore() < 70) {
            feedback.append(" Consider highlighting more relevant experience.");
        }
        return feedback.toString();
    }

    /**
     * Ordered improvement tips, at most {@value #MAX_RECOMMENDATIONS}. Score-based tips need
     * a relevance score.
     */
    public List<String> recommendations(SkillAnalysis skillAnalysis, RelevanceScore relevance,
                                        ResumeProfile resume, JobPosting job) {
        List<String> tips = new ArrayList<>();
        List<String> missingRequired = skillAnalysis.missingRequired();

        if (!missingRequired.isEmpty()) {
            List<String> top = missingRequired.subList(0, Math.min(TOP_MISSING_SKILLS, missingRequired.size()));
            tips.add("Acquire or highlight these critical skills: " + String.join(", ", top));
        }

        if (relevance != null) {
            if (relevance.experienceScore() < 70) {
                tips.add("Emphasize experience more relevant to this role in your resume");
            }
            if (relevance.projectsScore() < 50 && !"manager".equalsIgnoreCase(job.getRoleType())) {
                tips.add("Add relevant projects that demonstrate required skills");
            }
            if (relevance.keywordsScore() < 60) {
                tips.add("Include more industry-specific keywords from the job description");
            }
            boolean noSummary = resume.getSummary() == null || resume.getSummary().isEmpty();
            if (noSummary || relevance.summaryScore() < 50) {
                tips.add("Write or improve your professional summary to align with this role");
            }
        }

        if (ResumeText.orEmpty(resume.getCertifications()).isEmpty() && !missingRequired.isEmpty()) {
            tips.add("Consider getting certifications in missing skill areas");
        }

        return List.copyOf(tips.subList(0, Math.min(MAX_RECOMMENDATIONS, tips.size())));
    }

    private static String band(double weightedTotal) {
        if (weightedTotal >= 80) {
            return "Excellent match! Your profile aligns very well with the job requirements.";
        }
        if (weightedTotal >= 60) {
            return "Good match! You meet most of the requirements with room for improvement.";
        }
        if (weightedTotal >= 40) {
            return "Moderate match. Consider strengthening key areas to improve your chances.";
        }
        return "Limited match. Significant gaps exist between your profile and requirements.";
    }
}
