package com.athl3t.backend.repository;

import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.LedgerTransaction;
import com.athl3t.backend.model.TransactionKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {

    List<LedgerTransaction> findByUserIdOrderByOccurredAtDescIdDesc(Long userId);

    List<LedgerTransaction> findByUserIdAndAssetTypeAndAssetNameAndKindIn(Long userId,
                                                                          AssetType assetType,
                                                                          String assetName,
                                                                          Collection<TransactionKind> kinds);
}
