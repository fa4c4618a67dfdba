package com.flagship.pos_engine.inventory;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StockItemRepository extends JpaRepository<StockItemEntity, UUID> {

    Optional<StockItemEntity> findByIdAndMerchantId(UUID id, UUID merchantId);

    /**
     * SELECT ... FOR UPDATE on one stock item row.
     * The lock is held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StockItemEntity s WHERE s.id = :id AND s.merchantId = :merchantId")
    Optional<StockItemEntity> findByIdAndMerchantIdForUpdate(@Param("id") UUID id,
                                                            @Param("merchantId") UUID merchantId);

    List<StockItemEntity> findByMerchantIdOrderByNameAscCreatedAtAsc(UUID merchantId);
}
