package com.flagship.cashback_ledger.notification;

import java.util.Map;

/**
 * Outbound notification port. Delivery is fire-and-forget: implementations
 * must not block the caller and must not throw for delivery problems.
 */
public interface OrderNotifier {

    void notify(String accountId, String event, Map<String, Object> payload);
}
