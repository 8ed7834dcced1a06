package dev.jobmatcher.model;

/**
 * Result of writing a match to the ledger. Duplicates are an expected outcome, not an error.
 */
public record InsertOutcome(Status status, String matchId, String reason) {

    public enum Status {
        CREATED,
        ALREADY_EXISTS,
        FAILED
    }

    public static InsertOutcome created(String matchId) {
        return new InsertOutcome(Status.CREATED, matchId, null);
    }

    public static InsertOutcome alreadyExists() {
        return new InsertOutcome(Status.ALREADY_EXISTS, null, null);
    }

    public static InsertOutcome failed(String reason) {
        return new InsertOutcome(Status.FAILED, null, reason);
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }
}
