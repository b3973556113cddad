package com.flagship.cashback_ledger.replication;

import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Optional;

/**
 * Read access to primary-store documents for the replicator.
 */
public interface PrimaryDocumentSource {

    <D> Optional<D> findById(Class<D> documentType, String id);

    <D> long count(Class<D> documentType, Query filter);

    /**
     * Returns at most {@code limit} matching documents. The filter is not modified.
     */
    <D> List<D> find(Class<D> documentType, Query filter, int limit);
}
