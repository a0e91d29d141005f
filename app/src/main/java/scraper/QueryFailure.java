package scraper;

// One query that was not stored, and why. Duplicated queries each get their own entry.
public record QueryFailure(String query, String error) {
}
