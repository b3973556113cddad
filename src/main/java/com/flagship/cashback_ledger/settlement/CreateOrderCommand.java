package com.flagship.cashback_ledger.settlement;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class CreateOrderCommand {
    String shopperId;
    String mediatorId;
    String brandOwnerId;
    @Singular
    List<OrderItem> items;
    long commissionPaise;
    long cashbackPaise;
    String actorId;
}
