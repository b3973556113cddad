package com.flagship.cashback_ledger.replication;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReplicationSyncStateRepository extends JpaRepository<ReplicationSyncStateEntity, String> {

    List<ReplicationSyncStateEntity> findByStatusNot(String status);
}
