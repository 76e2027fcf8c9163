package anyrun.core.model.analysis;

/**
 * Paging parameters for the analysis history.
 *
 * <p>Values are checked before the request is sent, not here, so that an out-of-range page
 * surfaces as a validation error from the client.
 *
 * @param team  list the team's history instead of the user's
 * @param skip  number of entries to skip
 * @param limit page size, between 1 and 100
 */
public record AnalysisListRequest(boolean team, int skip, int limit) {

    public static final int DEFAULT_LIMIT = 25;
    public static final int MAX_LIMIT = 100;

    public static AnalysisListRequest defaults() {
        return new AnalysisListRequest(false, 0, DEFAULT_LIMIT);
    }

    public AnalysisListRequest withTeam(boolean team) {
        return new AnalysisListRequest(team, skip, limit);
    }

    public AnalysisListRequest page(int skip, int limit) {
        return new AnalysisListRequest(team, skip, limit);
    }
}
