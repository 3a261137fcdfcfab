package com.altrii.mdm.modules.push.domain;

public record PushResult(
        Outcome outcome,
        int statusCode,
        String apnsId,
        String failureReason
) {

    public enum Outcome {
        DELIVERED,
        REJECTED,
        SKIPPED
    }

    public static PushResult delivered(int statusCode, String apnsId) {
        return new PushResult(Outcome.DELIVERED, statusCode, apnsId, null);
    }

    public static PushResult rejected(int statusCode, String failureReason) {
        return new PushResult(Outcome.REJECTED, statusCode, null, failureReason);
    }

    public static PushResult skipped(String reason) {
        return new PushResult(Outcome.SKIPPED, 0, null, reason);
    }

    public boolean delivered() {
        return outcome == Outcome.DELIVERED;
    }
}
