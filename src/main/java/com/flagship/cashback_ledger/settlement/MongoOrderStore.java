package com.flagship.cashback_ledger.settlement;

import com.flagship.cashback_ledger.replication.PrimaryWriteHooks;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Order store backed by the {@code orders} collection.
 *
 * Every write goes through {@code findAndModify} on a single document, so each
 * one is reported to the replication hooks by id. Freezing by account is done
 * document by document for the same reason.
 */
@Repository
@RequiredArgsConstructor
public class MongoOrderStore implements OrderStore {

    private final MongoTemplate mongoTemplate;
    private final PrimaryWriteHooks writeHooks;

    @Override
    public Order insert(Order order) {
        return mongoTemplate.insert(OrderDocument.fromDomain(order)).toDomain();
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(mongoTemplate.findById(orderId, OrderDocument.class))
                .map(OrderDocument::toDomain);
    }

    @Override
    public Optional<Order> compareAndTransition(String orderId, OrderStatus expectedStatus, long expectedVersion,
                                                OrderStatus next, OrderLogEntry entry, String settlementRef,
                                                OrderEvent pendingEffects) {
        Query query = Query.query(Criteria.where("_id").is(orderId)
                .and(OrderDocument.STATUS).is(expectedStatus)
                .and(OrderDocument.VERSION).is(expectedVersion)
                .and(OrderDocument.DELETED_AT).is(null)
                .and(OrderDocument.FROZEN).ne(true));

        Update update = new Update()
                .set(OrderDocument.STATUS, next)
                .inc(OrderDocument.VERSION, 1)
                .push(OrderDocument.EVENTS, OrderDocument.Event.fromDomain(entry))
                .set(OrderDocument.UPDATED_AT, entry.getAt());
        if (settlementRef != null) {
            update.set(OrderDocument.SETTLEMENT_REF, settlementRef);
        }
        if (pendingEffects != null) {
            update.set(OrderDocument.PENDING_EFFECTS, pendingEffects);
        } else {
            update.unset(OrderDocument.PENDING_EFFECTS);
        }

        return updateAndNotify(query, update);
    }

    @Override
    public Optional<Order> confirmEffects(String orderId, OrderEvent event) {
        Query query = Query.query(Criteria.where("_id").is(orderId)
                .and(OrderDocument.PENDING_EFFECTS).is(event));
        Update update = new Update()
                .unset(OrderDocument.PENDING_EFFECTS)
                .inc(OrderDocument.VERSION, 1)
                .set(OrderDocument.UPDATED_AT, Instant.now());
        return updateAndNotify(query, update);
    }

    @Override
    public List<String> freezeOrdersOf(String accountId, String reason, OrderLogEntry entry) {
        Query query = Query.query(freezableCriteria()
                .and(OrderDocument.FROZEN).ne(true)
                .orOperator(
                        Criteria.where(OrderDocument.SHOPPER_ID).is(accountId),
                        Criteria.where(OrderDocument.MEDIATOR_ID).is(accountId),
                        Criteria.where(OrderDocument.BRAND_OWNER_ID).is(accountId)));
        query.fields().include("_id");

        List<String> frozen = new ArrayList<>();
        for (OrderDocument candidate : mongoTemplate.find(query, OrderDocument.class)) {
            Query one = Query.query(freezableCriteria()
                    .and("_id").is(candidate.getId())
                    .and(OrderDocument.FROZEN).ne(true));
            Update update = new Update()
                    .set(OrderDocument.FROZEN, true)
                    .set(OrderDocument.FROZEN_AT, entry.getAt())
                    .set(OrderDocument.FROZEN_REASON, reason)
                    .inc(OrderDocument.VERSION, 1)
                    .push(OrderDocument.EVENTS, OrderDocument.Event.fromDomain(entry))
                    .set(OrderDocument.UPDATED_AT, entry.getAt());
            updateAndNotify(one, update).ifPresent(order -> frozen.add(order.getId()));
        }
        return frozen;
    }

    @Override
    public Optional<Order> reactivate(String orderId, OrderLogEntry entry) {
        Query query = Query.query(freezableCriteria()
                .and("_id").is(orderId)
                .and(OrderDocument.FROZEN).is(true));
        Update update = new Update()
                .set(OrderDocument.FROZEN, false)
                .set(OrderDocument.REACTIVATED_AT, entry.getAt())
                .inc(OrderDocument.VERSION, 1)
                .push(OrderDocument.EVENTS, OrderDocument.Event.fromDomain(entry))
                .set(OrderDocument.UPDATED_AT, entry.getAt());
        return updateAndNotify(query, update);
    }

    @Override
    public Optional<Order> softDelete(String orderId, OrderLogEntry entry) {
        Query query = Query.query(Criteria.where("_id").is(orderId)
                .and(OrderDocument.DELETED_AT).is(null));
        Update update = new Update()
                .set(OrderDocument.DELETED_AT, entry.getAt())
                .inc(OrderDocument.VERSION, 1)
                .push(OrderDocument.EVENTS, OrderDocument.Event.fromDomain(entry))
                .set(OrderDocument.UPDATED_AT, entry.getAt());
        return updateAndNotify(query, update);
    }

    private static Criteria freezableCriteria() {
        List<OrderStatus> terminal = Arrays.stream(OrderStatus.values())
                .filter(OrderStatus::isTerminal)
                .toList();
        return Criteria.where(OrderDocument.DELETED_AT).is(null)
                .and(OrderDocument.STATUS).nin(terminal);
    }

    private Optional<Order> updateAndNotify(Query query, Update update) {
        OrderDocument updated = mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), OrderDocument.class);
        if (updated == null) {
            return Optional.empty();
        }
        writeHooks.afterUpsert(ReplicatedEntity.ORDER, updated.getId());
        return Optional.of(updated.toDomain());
    }
}
