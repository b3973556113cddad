package com.flagship.cashback_ledger.settlement;

import lombok.Value;

@Value
public class OrderItem {
    String productId;
    String title;
    long pricePaise;
    long commissionPaise;
    int quantity;
    String campaignId;
}
