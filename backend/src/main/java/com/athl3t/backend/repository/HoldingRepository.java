package com.athl3t.backend.repository;

import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.Holding;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface HoldingRepository extends JpaRepository<Holding, Long> {

    Optional<Holding> findByUserIdAndAssetTypeAndAssetName(Long userId, AssetType assetType, String assetName);

    List<Holding> findByUserIdOrderByAssetTypeAscAssetNameAsc(Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select h from Holding h where h.userId = :userId and h.assetType = :assetType and h.assetName = :assetName")
    Optional<Holding> findForUpdate(@Param("userId") Long userId,
                                    @Param("assetType") AssetType assetType,
                                    @Param("assetName") String assetName);
}
