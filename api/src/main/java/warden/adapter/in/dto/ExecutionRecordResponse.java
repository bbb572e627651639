package warden.adapter.in.dto;

import java.time.Instant;

import warden.core.model.session.ExecutionRecord;

public record ExecutionRecordResponse(
        String recordId,
        String sessionKeyId,
        String walletId,
        String userId,
        String action,
        long amount,
        Instant timestamp,
        String outcome,
        String reason) {

    public static ExecutionRecordResponse fromModel(ExecutionRecord model) {
        return new ExecutionRecordResponse(
                model.recordId(),
                model.sessionKeyId(),
                model.walletId(),
                model.userId(),
                model.action(),
                model.amount(),
                model.timestamp(),
                model.outcome().name(),
                model.reason());
    }
}
