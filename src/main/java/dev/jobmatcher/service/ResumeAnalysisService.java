package dev.jobmatcher.service;

import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.exception.InvalidRequestException;
import dev.jobmatcher.model.AnalysisResult;
import dev.jobmatcher.model.BatchScoreResult;
import dev.jobmatcher.model.HardFilterResult;
import dev.jobmatcher.model.JobPosting;
import dev.jobmatcher.model.QuickScore;
import dev.jobmatcher.model.RelevanceScore;
import dev.jobmatcher.model.ResumeProfile;
import dev.jobmatcher.model.ScoringWeights;
import dev.jobmatcher.model.SkillAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entry point for resume-versus-job analysis: full two-stage analysis, quick scoring for
 * search results and the skill utilities built on top of them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeAnalysisService {

    private static final double QUICK_SKILL_SHARE = 0.6;
    private static final double QUICK_KEYWORD_SHARE = 0.4;
    private static final double WEIGHT_SUM_TOLERANCE = 0.001;

    private final HardFilterService hardFilterService;
    private final RelevanceScoringService relevanceScoringService;
    private final SkillMatchingService skillMatchingService;
    private final TextAnalysisService textAnalysisService;
    private final FeedbackService feedbackService;
    private final SearchConfig searchConfig;

    public AnalysisResult analyze(ResumeProfile resume, JobPosting job) {
        return analyze(resume, job, null);
    }

    /**
     * Two-stage analysis. The relevance score is only computed when the hard filters pass;
     * otherwise the overall match is 0.
     *
     * @param resume        The candidate resume
     * @param job           The job posting
     * @param customWeights Weights overriding the role table, or null
     * @return AnalysisResult with filters, scores, skill breakdown, feedback and tips
     * @throws InvalidRequestException if resume or job is missing, the resume reports negative
     *                                 experience, or the weights are invalid
     */
    public AnalysisResult analyze(ResumeProfile resume, JobPosting job, ScoringWeights customWeights) {
        if (resume == null) {
            throw new InvalidRequestException("Resume data is required");
        }
        if (job == null) {
            throw new InvalidRequestException("Job description is required");
        }
        validateResume(resume);
        if (customWeights != null) {
            validateWeights(customWeights);
        }

        HardFilterResult hardFilters = hardFilterService.evaluate(resume, job);
        SkillAnalysis skillAnalysis = skillMatchingService.matchSkills(
                resume.getSkills(), job.getRequiredSkills(), job.getPreferredSkills());

        RelevanceScore relevance = null;
        double overallMatch = 0;
        if (hardFilters.passed()) {
            relevance = relevanceScoringService.score(resume, job, skillAnalysis, customWeights);
            overallMatch = relevance.weightedTotal();
        }

        String feedback = feedbackService.feedback(hardFilters, relevance, skillAnalysis);
        List<String> recommendations = feedbackService.recommendations(skillAnalysis, relevance, resume, job);
        String roleType = job.getRoleType() != null ? job.getRoleType() : "default";

        return new AnalysisResult(
                hardFilters,
                relevance,
                Scores.round2(overallMatch),
                skillAnalysis.matchedRequired(),
                skillAnalysis.missingRequired(),
                skillAnalysis,
                feedback,
                recommendations,
                Instant.now(),
                roleType);
    }

    /**
     * Lightweight score for search listings: skills and keyword overlap only, no hard
     * filters. Skills come from the description when the posting lists none.
     */
    public QuickScore quickScore(ResumeProfile resume, JobPosting job) {
        if (resume == null || job == null) {
            throw new InvalidRequestException("Resume and job data are required");
        }
        validateResume(resume);

        List<String> jobSkills = job.getRequiredSkills();
        if (jobSkills == null || jobSkills.isEmpty()) {
            jobSkills = skillMatchingService.extractSkillsFromText(job.getDescription());
        }

        SkillAnalysis skillAnalysis = skillMatchingService.matchSkills(resume.getSkills(), jobSkills, List.of());

        String resumeText = ResumeText.combine(
                ResumeText.join(resume.getSkills()),
                ResumeText.join(resume.getWorkExperience()),
                resume.getSummary());
        double keywordMatch = textAnalysisService.keywordOverlap(resumeText, job.getDescription());

        double score = skillAnalysis.overallSkillScore() * QUICK_SKILL_SHARE + keywordMatch * QUICK_KEYWORD_SHARE;

        return new QuickScore(
                Scores.round2(score),
                skillAnalysis.matchedRequired(),
                skillAnalysis.missingRequired(),
                skillAnalysis.requiredMatchPercentage(),
                Scores.round2(keywordMatch));
    }

    /**
     * Quick-score up to {@code search.max-batch-score-jobs} jobs. A failing job is reported
     * with its error and ranked as 0; the others are still scored.
     */
    public BatchScoreResult batchScore(ResumeProfile resume, List<JobPosting> jobs) {
        if (resume == null || jobs == null) {
            throw new InvalidRequestException("Resume and jobs array are required");
        }

        List<JobPosting> toScore = jobs.subList(0, Math.min(jobs.size(), searchConfig.getMaxBatchScoreJobs()));
        List<BatchScoreResult.Item> items = new ArrayList<>(toScore.size());

        for (int i = 0; i < toScore.size(); i++) {
            JobPosting job = toScore.get(i);
            try {
                QuickScore score = quickScore(resume, job);
                items.add(new BatchScoreResult.Item(i, idOf(job), titleOf(job), companyOf(job), score, null));
            } catch (RuntimeException e) {
                log.warn("Batch scoring failed for job #{}: {}", i, e.getMessage());
                items.add(new BatchScoreResult.Item(i, idOf(job), titleOf(job), companyOf(job), null, e.getMessage()));
            }
        }

        items.sort(Comparator.comparingDouble(BatchScoreResult.Item::score).reversed());
        log.info("Batch scored {} of {} jobs", items.size(), jobs.size());
        return new BatchScoreResult(jobs.size(), items.size(), List.copyOf(items));
    }

    public List<String> extractSkills(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidRequestException("Text is required");
        }
        return skillMatchingService.extractSkillsFromText(text);
    }

    public SkillAnalysis matchSkills(List<String> resumeSkills, List<String> requiredSkills,
                                     List<String> preferredSkills) {
        if (resumeSkills == null || requiredSkills == null) {
            throw new InvalidRequestException("Resume skills and required skills are required");
        }
        return skillMatchingService.matchSkills(resumeSkills, requiredSkills,
                preferredSkills != null ? preferredSkills : List.of());
    }

    public void validateResume(ResumeProfile resume) {
        if (resume.getYearsOfExperience() < 0 || Double.isNaN(resume.getYearsOfExperience())) {
            throw new InvalidRequestException(
                    "Years of experience must not be negative, got " + resume.getYearsOfExperience());
        }
    }

    /**
     * Custom weights must each lie in [0, 1] and sum to 1.
     */
    public void validateWeights(ScoringWeights weights) {
        double[] values = {weights.skills(), weights.experience(), weights.projects(),
                weights.keywords(), weights.summary(), weights.education()};
        for (double value : values) {
            if (value < 0 || value > 1) {
                throw new InvalidRequestException("Scoring weights must be between 0 and 1: " + weights);
            }
        }
        if (Math.abs(weights.sum() - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new InvalidRequestException("Scoring weights must sum to 1.0, got " + weights.sum());
        }
    }

    private static String idOf(JobPosting job) {
        return job != null ? job.getId() : null;
    }

    private static String titleOf(JobPosting job) {
        return job != null ? job.getTitle() : null;
    }

    private static String companyOf(JobPosting job) {
        return job != null ? job.getCompany() : null;
    }
}
