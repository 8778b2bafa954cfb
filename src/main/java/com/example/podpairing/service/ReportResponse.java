package com.example.podpairing.service;

/**
 * @param winnerId             set when a win was recorded
 * @param removedParticipantId set when a drop-out removed the participant
 * @param tableNumber          table the report applied to, when any
 */
public record ReportResponse(ReportOutcomeResult result, String winnerId, String removedParticipantId,
                             Integer tableNumber, String message) {

    public static ReportResponse of(ReportOutcomeResult result, String message) {
        return new ReportResponse(result, null, null, null, message);
    }

    public boolean isSuccess() {
        return result == ReportOutcomeResult.SUCCESS;
    }
}
