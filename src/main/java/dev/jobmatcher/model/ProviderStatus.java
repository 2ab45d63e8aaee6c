package dev.jobmatcher.model;

/**
 * Reachability and request quota of the job provider. Quota values are passed through as the
 * provider reports them and may be null.
 */
public record ProviderStatus(
        boolean available,
        String requestsLimit,
        String requestsRemaining,
        String requestsReset,
        String error) {

    public static ProviderStatus available(String requestsLimit, String requestsRemaining, String requestsReset) {
        return new ProviderStatus(true, requestsLimit, requestsRemaining, requestsReset, null);
    }

    public static ProviderStatus unavailable(String error) {
        return new ProviderStatus(false, null, null, null, error);
    }
}
