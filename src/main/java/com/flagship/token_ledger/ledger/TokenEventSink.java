package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.event.TokenEvent;

import java.util.List;

/**
 * Receives the notifications of an operation before its state changes are applied.
 *
 * Implementations must accept either all events of the batch or none of them and must
 * signal failure by throwing, which aborts the operation.
 */
@FunctionalInterface
public interface TokenEventSink {

    void append(List<TokenEvent> events);
}
