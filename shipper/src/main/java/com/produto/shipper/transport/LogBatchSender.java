package com.produto.shipper.transport;

import com.produto.shipper.model.LokiPushRequest;

/**
 * Delivers one encoded batch to the log backend.
 */
public interface LogBatchSender {

    /**
     * Sends the request, returning normally only when the backend accepted it.
     *
     * @throws LokiPushException on network errors, timeouts or non-2xx responses
     */
    void send(LokiPushRequest request);
}
