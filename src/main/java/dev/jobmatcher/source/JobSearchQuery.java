package dev.jobmatcher.source;

/**
 * Parameters of one provider search. Only {@code keyword} is required.
 *
 * @param experienceHint requester's years of experience, used to label experience fit
 */
public record JobSearchQuery(
        String keyword,
        String location,
        Integer experienceHint,
        int page,
        int pageCount,
        String company,
        String platform) {

    public static JobSearchQuery firstPage(String keyword, String location, Integer experienceHint,
                                           String company, String platform) {
        return new JobSearchQuery(keyword, location, experienceHint, 1, 1, company, platform);
    }
}
