package com.flagship.cashback_ledger.replication;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes one primary document type into its shadow table, keyed by the
 * primary id ({@code mongo_id}).
 *
 * Writers must be idempotent: the same document may be written many times
 * and in any order relative to other documents.
 */
public interface ShadowWriter<D> {

    String foreignIdOf(D document);

    /**
     * Monotonic version of the primary document, stored as {@code source_version}.
     */
    long sourceVersionOf(D document);

    void upsert(D document);

    /**
     * Removes the shadow row, if any.
     */
    void delete(String foreignId);

    /**
     * @return {@code source_version} of the shadow rows that exist, keyed by foreign id
     */
    Map<String, Long> shadowVersions(Collection<String> foreignIds);

    /**
     * Foreign ids of shadow rows in ascending order, starting after {@code afterForeignId}.
     *
     * @param afterForeignId Last id of the previous page, or null for the first page
     */
    List<String> shadowIdsAfter(String afterForeignId, int limit);
}
