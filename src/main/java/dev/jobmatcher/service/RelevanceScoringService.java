package dev.jobmatcher.service;

import dev.jobmatcher.config.RoleWeights;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.RelevanceScore;
import dev.jobmatcher.model.ResumeProfile;
import dev.jobmatcher.model.ScoringWeights;
import dev.jobmatcher.model.SkillAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Stage-two weighted relevance score. Only meaningful for pairs that passed the hard filters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelevanceScoringService {

    private static final double YEARS_SHARE = 0.4;
    private static final double HISTORY_SHARE = 0.6;
    private static final double POINTS_PER_PROJECT = 5;
    private static final double MAX_PROJECT_BONUS = 20;
    private static final double NEUTRAL_SUMMARY_SCORE = 50;
    private static final double PARTIAL_EDUCATION_SCORE = 50;

    private final TextAnalysisService textAnalysisService;
    private final HardFilterService hardFilterService;

    /**
     * Calculate the six sub-scores and their weighted total.
     *
     * @param resume        The candidate resume
     * @param job           The job posting
     * @param skillAnalysis Skill match for this pair, supplies the skills sub-score
     * @param customWeights Weights to use instead of the role table, or null
     * @return RelevanceScore with sub-scores and total rounded to 2 decimals
     */
    public RelevanceScore score(ResumeProfile resume, JobPosting job, SkillAnalysis skillAnalysis,
                                ScoringWeights customWeights) {
        ScoringWeights weights = customWeights != null ? customWeights : RoleWeights.forRole(job.getRoleType());

        double skills = skillAnalysis.overallSkillScore();
        double experience = scoreExperience(resume, job);
        double projects = scoreProjects(resume, job);
        double keywords = scoreKeywords(resume, job);
        double summary = scoreSummary(resume, job);
        double education = scoreEducation(resume, job);

        double weightedTotal = skills * weights.skills()
                + experience * weights.experience()
                + projects * weights.projects()
                + keywords * weights.keywords()
                + summary * weights.summary()
                + education * weights.education();

        log.debug("Relevance for '{}': skills={} experience={} projects={} keywords={} summary={} education={} total={}",
                job.getTitle(), skills, experience, projects, keywords, summary, education, weightedTotal);

        return new RelevanceScore(
                Scores.round2(skills),
                Scores.round2(experience),
                Scores.round2(projects),
                Scores.round2(keywords),
                Scores.round2(summary),
                Scores.round2(education),
                Scores.round2(weightedTotal),
                weights);
    }

    double scoreExperience(ResumeProfile resume, JobPosting job) {
        double minExperience = Math.max(job.getMinExperience(), 1);
        double years = Math.max(resume.getYearsOfExperience(), 0);
        double yearsScore = Scores.cap100(years / minExperience * 100);

        String history = ResumeText.join(resume.getWorkExperience());
        double historyRelevance = textAnalysisService.similarity(history, job.getDescription());

        return Scores.cap100(yearsScore * YEARS_SHARE + historyRelevance * HISTORY_SHARE);
    }

    double scoreProjects(ResumeProfile resume, JobPosting job) {
        List<String> projects = ResumeText.orEmpty(resume.getProjects());
        if (projects.isEmpty()) {
            return 0;
        }

        double relevance = textAnalysisService.similarity(ResumeText.join(projects), job.getDescription());
        double bonus = Math.min(projects.size() * POINTS_PER_PROJECT, MAX_PROJECT_BONUS);
        return Scores.cap100(relevance + bonus);
    }

    double scoreKeywords(ResumeProfile resume, JobPosting job) {
        String resumeText = ResumeText.combine(
                ResumeText.join(resume.getSkills()),
                ResumeText.join(resume.getWorkExperience()),
                ResumeText.join(resume.getProjects()),
                resume.getSummary());
        return Scores.cap100(textAnalysisService.keywordOverlap(resumeText, job.getDescription()));
    }

    double scoreSummary(ResumeProfile resume, JobPosting job) {
        // Whitespace-only counts as present and scores on similarity
        if (resume.getSummary() == null || resume.getSummary().isEmpty()) {
            return NEUTRAL_SUMMARY_SCORE;
        }
        return textAnalysisService.similarity(resume.getSummary(), job.getDescription());
    }

    double scoreEducation(ResumeProfile resume, JobPosting job) {
        if (job.getRequiredEducation() == null || job.getRequiredEducation().isBlank()) {
            return 100;
        }
        if (!hardFilterService.hasAnyEducation(resume)) {
            return 0;
        }
        if (hardFilterService.checkEducation(resume, job.getRequiredEducation())) {
            return 100;
        }
        return PARTIAL_EDUCATION_SCORE;
    }
}
