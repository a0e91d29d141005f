package scraper;

// How a single fetch attempt (or a whole retry sequence) ended.
public enum FetchStatus {
    OK,
    HTTP_STATUS,
    TIMEOUT,
    FAILED
}
