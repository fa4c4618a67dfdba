package com.flagship.pos_engine.sale;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TransactionLineItemRepository extends JpaRepository<TransactionLineItemEntity, UUID> {

    List<TransactionLineItemEntity> findByTransactionIdOrderBySequenceNumberAsc(UUID transactionId);

    @Modifying
    @Query("DELETE FROM TransactionLineItemEntity l WHERE l.transactionId = :transactionId")
    int deleteByTransactionId(@Param("transactionId") UUID transactionId);
}
