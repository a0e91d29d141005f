package scraper;

// Result of one network attempt. Body is set only for OK.
public record AttemptResult(FetchStatus status, String body, String detail) {

    public static AttemptResult ok(String body) {
        return new AttemptResult(FetchStatus.OK, body, null);
    }

    public static AttemptResult httpStatus(int statusCode) {
        return new AttemptResult(FetchStatus.HTTP_STATUS, null, "status " + statusCode);
    }

    public static AttemptResult timeout(String detail) {
        return new AttemptResult(FetchStatus.TIMEOUT, null, detail);
    }

    public static AttemptResult failed(String detail) {
        return new AttemptResult(FetchStatus.FAILED, null, detail);
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }
}
