package scraper;

// Final result of fetching one URL: content on success, null content otherwise.
public record FetchOutcome(String url, FetchStatus status, String content, String detail, int attempts) {

    public static FetchOutcome success(String url, String content, int attempts) {
        return new FetchOutcome(url, FetchStatus.OK, content, null, attempts);
    }

    public static FetchOutcome absent(String url, AttemptResult last, int attempts) {
        FetchStatus status = last == null ? FetchStatus.FAILED : last.status();
        String detail = last == null ? "no attempt made" : last.detail();
        return new FetchOutcome(url, status, null, detail, attempts);
    }

    public boolean isSuccess() {
        return status == FetchStatus.OK;
    }
}
