package com.athl3t.backend.service;

import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.ForbiddenException;
import com.athl3t.backend.exception.InsufficientHoldingsException;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.exception.StaleOfferException;
import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.LedgerTransaction;
import com.athl3t.backend.model.TradeOffer;
import com.athl3t.backend.model.TradeOfferAsset;
import com.athl3t.backend.model.TradeOfferStatus;
import com.athl3t.backend.model.TransactionKind;
import com.athl3t.backend.repository.AccountRepository;
import com.athl3t.backend.repository.TradeOfferAssetRepository;
import com.athl3t.backend.repository.TradeOfferRepository;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Peer-to-peer asset swaps. Holdings are checked when an offer is made and
 * checked again, under both account locks, when it is accepted; the swap
 * itself is all-or-nothing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeOfferService {

    private static final int MAX_DESCRIPTION = 500;

    private final TradeOfferRepository offerRepository;
    private final TradeOfferAssetRepository assetRepository;
    private final AccountRepository accountRepository;
    private final AccountLedgerService ledger;
    private final HoldingsRegistry holdingsRegistry;
    private final TransactionLogService transactionLog;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Transactional
    public TradeOfferDetails createOffer(Long initiatorId, List<OfferAsset> offered, List<OfferAsset> requested,
                                         Long counterpartyId, String description) {
        List<OfferAsset> give = normalize(offered, "offered");
        List<OfferAsset> take = normalize(requested, "requested");
        if (give.isEmpty() && take.isEmpty()) {
            throw new BadRequestException("An offer must include at least one asset");
        }
        Set<String> giveKeys = give.stream().map(OfferAsset::key).collect(Collectors.toSet());
        if (take.stream().map(OfferAsset::key).anyMatch(giveKeys::contains)) {
            throw new BadRequestException("An asset cannot be both offered and requested");
        }
        if (description != null && description.length() > MAX_DESCRIPTION) {
            throw new BadRequestException("Description is limited to " + MAX_DESCRIPTION + " characters");
        }
        if (!accountRepository.existsById(initiatorId)) {
            throw new NotFoundException("Account not found: " + initiatorId);
        }
        if (counterpartyId != null) {
            if (counterpartyId.equals(initiatorId)) {
                throw new BadRequestException("Cannot send an offer to yourself");
            }
            if (!accountRepository.existsById(counterpartyId)) {
                throw new NotFoundException("Account not found: " + counterpartyId);
            }
        }
        for (OfferAsset asset : give) {
            int held = holdingsRegistry.quantity(initiatorId, asset.assetType(), asset.assetName());
            if (held < asset.quantity()) {
                throw new InsufficientHoldingsException(initiatorId, asset.assetType(), asset.assetName(),
                        asset.quantity(), held);
            }
        }

        TradeOffer offer = offerRepository.save(TradeOffer.builder()
                .initiatorId(initiatorId)
                .counterpartyId(counterpartyId)
                .description(description == null || description.isBlank() ? null : description.trim())
                .status(TradeOfferStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .updatedAt(LocalDateTime.now(clock))
                .build());
        List<TradeOfferAsset> offeredRows = saveAssets(offer.getId(), TradeOfferAsset.Direction.OFFERED, give);
        List<TradeOfferAsset> requestedRows = saveAssets(offer.getId(), TradeOfferAsset.Direction.REQUESTED, take);
        log.info("User {} created offer {} to {} ({} offered, {} requested)", initiatorId, offer.getId(),
                counterpartyId == null ? "anyone" : counterpartyId, offeredRows.size(), requestedRows.size());
        return new TradeOfferDetails(offer, offeredRows, requestedRows);
    }

    @Transactional
    public TradeOfferDetails acceptOffer(Long offerId, Long acceptorId) {
        TradeOffer offer = lockPending(offerId);
        if (offer.getInitiatorId().equals(acceptorId)) {
            throw new ForbiddenException("Cannot accept your own offer");
        }
        if (!offer.isOpen() && !offer.getCounterpartyId().equals(acceptorId)) {
            throw new ForbiddenException("Offer " + offerId + " is addressed to another user");
        }
        Long initiatorId = offer.getInitiatorId();
        ledger.lockAccounts(initiatorId, acceptorId);

        List<TradeOfferAsset> assets = assetRepository.findByOfferIdOrderByIdAsc(offerId);
        Map<TradeOfferAsset.Direction, List<TradeOfferAsset>> byDirection = assets.stream()
                .collect(Collectors.groupingBy(TradeOfferAsset::getDirection));
        List<TradeOfferAsset> offered = byDirection.getOrDefault(TradeOfferAsset.Direction.OFFERED, List.of());
        List<TradeOfferAsset> requested = byDirection.getOrDefault(TradeOfferAsset.Direction.REQUESTED, List.of());

        for (TradeOfferAsset asset : offered) {
            int held = holdingsRegistry.quantity(initiatorId, asset.getAssetType(), asset.getAssetName());
            if (held < asset.getQuantity()) {
                throw new StaleOfferException("Offer " + offerId + " is stale: initiator now holds " + held + " of "
                        + asset.getAssetName() + ", offered " + asset.getQuantity());
            }
        }
        for (TradeOfferAsset asset : requested) {
            int held = holdingsRegistry.quantity(acceptorId, asset.getAssetType(), asset.getAssetName());
            if (held < asset.getQuantity()) {
                throw new InsufficientHoldingsException(acceptorId, asset.getAssetType(), asset.getAssetName(),
                        asset.getQuantity(), held);
            }
        }

        for (TradeOfferAsset asset : offered) {
            transfer(initiatorId, acceptorId, asset);
        }
        for (TradeOfferAsset asset : requested) {
            transfer(acceptorId, initiatorId, asset);
        }
        offer.setStatus(TradeOfferStatus.ACCEPTED);
        offer.setAcceptedBy(acceptorId);
        offer.setUpdatedAt(LocalDateTime.now(clock));
        offerRepository.save(offer);
        ledgerMetrics.recordOfferAccepted();
        log.info("Offer {} accepted by {}: {} assets to acceptor, {} to initiator {}", offerId, acceptorId,
                offered.size(), requested.size(), initiatorId);
        return new TradeOfferDetails(offer, offered, requested);
    }

    @Transactional
    public TradeOfferDetails rejectOffer(Long offerId, Long userId) {
        TradeOffer offer = lockPending(offerId);
        if (offer.isOpen() || !offer.getCounterpartyId().equals(userId)) {
            throw new ForbiddenException("Only the recipient of offer " + offerId + " can reject it");
        }
        return transition(offer, TradeOfferStatus.REJECTED, userId);
    }

    @Transactional
    public TradeOfferDetails cancelOffer(Long offerId, Long userId) {
        TradeOffer offer = lockPending(offerId);
        if (!offer.getInitiatorId().equals(userId)) {
            throw new ForbiddenException("Only the creator of offer " + offerId + " can cancel it");
        }
        return transition(offer, TradeOfferStatus.CANCELLED, userId);
    }

    /**
     * Pending offers the user can act on: addressed to them, or open to anyone.
     */
    @Transactional(readOnly = true)
    public List<TradeOfferDetails> pendingOffersFor(Long userId) {
        return withAssets(offerRepository.findActionableFor(userId, TradeOfferStatus.PENDING));
    }

    @Transactional(readOnly = true)
    public List<TradeOfferDetails> offersBy(Long userId) {
        return withAssets(offerRepository.findByInitiatorIdOrderByCreatedAtDescIdDesc(userId));
    }

    private void transfer(Long fromUserId, Long toUserId, TradeOfferAsset asset) {
        AssetType type = asset.getAssetType();
        String name = asset.getAssetName();
        int quantity = asset.getQuantity();
        // the giver's cost basis travels with the shares; null when they never paid a price
        BigDecimal costBasis = transactionLog.averageCost(fromUserId, type, name, null);
        holdingsRegistry.decrease(fromUserId, type, name, quantity);
        holdingsRegistry.increase(toUserId, type, name, quantity);
        LocalDateTime now = LocalDateTime.now(clock);
        transactionLog.record(LedgerTransaction.builder()
                .occurredAt(now)
                .userId(fromUserId)
                .kind(TransactionKind.TRADE_OUT)
                .assetType(type)
                .assetName(name)
                .quantity(quantity)
                .costBasisPrice(costBasis)
                .profitLoss(MoneyUtils.ZERO)
                .build());
        transactionLog.record(LedgerTransaction.builder()
                .occurredAt(now)
                .userId(toUserId)
                .kind(TransactionKind.TRADE_IN)
                .assetType(type)
                .assetName(name)
                .unitPrice(costBasis)
                .quantity(quantity)
                .costBasisPrice(costBasis)
                .profitLoss(MoneyUtils.ZERO)
                .build());
    }

    private TradeOffer lockPending(Long offerId) {
        TradeOffer offer = offerRepository.findByIdForUpdate(offerId)
                .orElseThrow(() -> new NotFoundException("Offer not found: " + offerId));
        if (offer.getStatus() != TradeOfferStatus.PENDING) {
            throw new StaleOfferException("Offer " + offerId + " is already " + offer.getStatus());
        }
        return offer;
    }

    private TradeOfferDetails transition(TradeOffer offer, TradeOfferStatus status, Long userId) {
        offer.setStatus(status);
        offer.setUpdatedAt(LocalDateTime.now(clock));
        offerRepository.save(offer);
        log.info("Offer {} {} by user {}", offer.getId(), status, userId);
        return withAssets(List.of(offer)).get(0);
    }

    private List<TradeOfferDetails> withAssets(List<TradeOffer> offers) {
        if (offers.isEmpty()) {
            return List.of();
        }
        Map<Long, List<TradeOfferAsset>> assetsByOffer = assetRepository
                .findByOfferIdInOrderByIdAsc(offers.stream().map(TradeOffer::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(TradeOfferAsset::getOfferId));
        List<TradeOfferDetails> details = new ArrayList<>(offers.size());
        for (TradeOffer offer : offers) {
            List<TradeOfferAsset> assets = assetsByOffer.getOrDefault(offer.getId(), List.of());
            details.add(new TradeOfferDetails(offer,
                    assets.stream().filter(a -> a.getDirection() == TradeOfferAsset.Direction.OFFERED).toList(),
                    assets.stream().filter(a -> a.getDirection() == TradeOfferAsset.Direction.REQUESTED).toList()));
        }
        return details;
    }

    private List<TradeOfferAsset> saveAssets(Long offerId, TradeOfferAsset.Direction direction, List<OfferAsset> assets) {
        List<TradeOfferAsset> saved = new ArrayList<>(assets.size());
        for (OfferAsset asset : assets) {
            saved.add(assetRepository.save(TradeOfferAsset.builder()
                    .offerId(offerId)
                    .direction(direction)
                    .assetType(asset.assetType())
                    .assetName(asset.assetName())
                    .quantity(asset.quantity())
                    .build()));
        }
        return saved;
    }

    private static List<OfferAsset> normalize(List<OfferAsset> assets, String side) {
        if (assets == null) {
            return List.of();
        }
        List<OfferAsset> normalized = new ArrayList<>(assets.size());
        Set<String> seen = new HashSet<>();
        for (OfferAsset asset : assets) {
            if (asset == null || asset.assetType() == null) {
                throw new BadRequestException("Every " + side + " asset needs a type");
            }
            if (asset.quantity() <= 0) {
                throw new BadRequestException("Quantities must be greater than zero");
            }
            OfferAsset clean = new OfferAsset(asset.assetType(), HoldingsRegistry.normalizeName(asset.assetName()),
                    asset.quantity());
            if (!seen.add(clean.key())) {
                throw new BadRequestException("Duplicate " + side + " asset: " + clean.assetName());
            }
            normalized.add(clean);
        }
        return normalized;
    }

    public record OfferAsset(AssetType assetType, String assetName, int quantity) {

        String key() {
            return assetType + ":" + assetName;
        }
    }
}
