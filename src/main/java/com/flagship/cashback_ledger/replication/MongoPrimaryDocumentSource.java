package com.flagship.cashback_ledger.replication;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoPrimaryDocumentSource implements PrimaryDocumentSource {

    private final MongoTemplate mongoTemplate;

    @Override
    public <D> Optional<D> findById(Class<D> documentType, String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, documentType));
    }

    @Override
    public <D> long count(Class<D> documentType, Query filter) {
        return mongoTemplate.count(Query.of(filter).limit(0).skip(0), documentType);
    }

    @Override
    public <D> List<D> find(Class<D> documentType, Query filter, int limit) {
        return mongoTemplate.find(Query.of(filter).limit(limit), documentType);
    }
}
