package com.athl3t.backend.service;

import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.InsufficientHoldingsException;
import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.Holding;
import com.athl3t.backend.repository.HoldingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Share counts per (user, asset). Rows are created on the first increase and
 * deleted when they reach zero, so every stored quantity is positive.
 * <p>
 * Callers hold the owner's account lock before mutating, which also serializes
 * the insert of a not-yet-existing row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HoldingsRegistry {

    private final HoldingRepository holdingRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public int increase(Long userId, AssetType assetType, String assetName, int quantity) {
        requireQuantity(quantity);
        String name = normalizeName(assetName);
        Holding holding = holdingRepository.findForUpdate(userId, requireType(assetType), name)
                .orElseGet(() -> Holding.builder()
                        .userId(userId)
                        .assetType(assetType)
                        .assetName(name)
                        .quantity(0)
                        .build());
        holding.setQuantity(Math.addExact(holding.getQuantity(), quantity));
        holdingRepository.save(holding);
        return holding.getQuantity();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int decrease(Long userId, AssetType assetType, String assetName, int quantity) {
        requireQuantity(quantity);
        String name = normalizeName(assetName);
        Holding holding = holdingRepository.findForUpdate(userId, requireType(assetType), name)
                .orElseThrow(() -> new InsufficientHoldingsException(userId, assetType, name, quantity, 0));
        if (holding.getQuantity() < quantity) {
            throw new InsufficientHoldingsException(userId, assetType, name, quantity, holding.getQuantity());
        }
        int remaining = holding.getQuantity() - quantity;
        if (remaining == 0) {
            holdingRepository.delete(holding);
            // flush so a later insert of the same key in this transaction does not precede the delete
            holdingRepository.flush();
            log.debug("Pruned empty holding {} {} for user {}", assetType, name, userId);
        } else {
            holding.setQuantity(remaining);
            holdingRepository.save(holding);
        }
        return remaining;
    }

    @Transactional(readOnly = true)
    public int quantity(Long userId, AssetType assetType, String assetName) {
        return holdingRepository.findByUserIdAndAssetTypeAndAssetName(userId, requireType(assetType), normalizeName(assetName))
                .map(Holding::getQuantity)
                .orElse(0);
    }

    @Transactional(readOnly = true)
    public List<Holding> holdings(Long userId) {
        return holdingRepository.findByUserIdOrderByAssetTypeAscAssetNameAsc(userId);
    }

    static String normalizeName(String assetName) {
        if (assetName == null || assetName.isBlank()) {
            throw new BadRequestException("Asset name is required");
        }
        return assetName.trim();
    }

    private static AssetType requireType(AssetType assetType) {
        if (assetType == null) {
            throw new BadRequestException("Asset type is required");
        }
        return assetType;
    }

    private static void requireQuantity(int quantity) {
        if (quantity <= 0) {
            throw new BadRequestException("Quantity must be greater than zero");
        }
    }
}
