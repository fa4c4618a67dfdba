package com.flagship.pos_engine.sale;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    Optional<TransactionEntity> findByIdAndMerchantId(UUID id, UUID merchantId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TransactionEntity t WHERE t.id = :id AND t.merchantId = :merchantId")
    Optional<TransactionEntity> findByIdAndMerchantIdForUpdate(@Param("id") UUID id,
                                                              @Param("merchantId") UUID merchantId);

    List<TransactionEntity> findByMerchantIdOrderByCreatedAtDesc(UUID merchantId);

    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.merchantId = :merchantId
          AND t.createdAt >= :from
          AND t.createdAt < :to
        ORDER BY t.createdAt DESC
        """)
    List<TransactionEntity> findByMerchantIdCreatedBetween(@Param("merchantId") UUID merchantId,
                                                         @Param("from") Instant from,
                                                         @Param("to") Instant to);
}
