package com.baykanat.triggers.domain.exception;

public class ReplayLimitExceededException extends RuntimeException {

    public ReplayLimitExceededException(String eventId, int maxReplays) {
        super("Replay limit of " + maxReplays + " reached for event " + eventId);
    }
}
