package me.ele.jarch.combiner.combine;

import me.ele.jarch.combiner.pg.proto.ResponseKind;

/**
 * One callback per {@link ResponseKind}. Payloads exclude the tag and length header.
 */
public interface ResponseHandler {
    void onCopyOutComplete(byte[] payload);

    void onCommandComplete(byte[] payload);

    void onRowDescription(byte[] payload);

    void onParameterStatus(byte[] payload);

    void onCopyInResponse(byte[] payload);

    void onCopyOutResponse(byte[] payload);

    void onCopyOutDataRow(byte[] payload);

    void onDataRow(byte[] payload);

    void onErrorResponse(byte[] payload);

    /**
     * NoticeResponse and NotificationResponse
     */
    void onNotification(ResponseKind kind, byte[] payload);

    /**
     * EmptyQueryResponse and tags the combiner does not know
     */
    void onUnexpected(ResponseKind kind, byte[] payload);
}
