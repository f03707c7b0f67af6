package com.ptl.domain.model;

import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redemption book of one tranche: per-epoch aggregates, per-lender request lists
 * and per-lender disbursement cursors.
 *
 * Epoch aggregates are written only through {@link #applySettlement(EpochSettlement)};
 * request lists and cursors are written only on behalf of their own lender.
 */
@Slf4j
public class RedemptionLedger {

    private final TrancheType tranche;
    private final List<Long> epochIds = new ArrayList<>();
    private final Map<Long, EpochInfo> epochInfos = new HashMap<>();
    private int firstUnprocessedEpochIndex;
    private final Map<String, List<RedemptionRequest>> lenderRequests = new HashMap<>();
    private final Map<String, DisbursementCursor> cursors = new HashMap<>();

    public RedemptionLedger(TrancheType tranche) {
        this.tranche = tranche;
    }

    public TrancheType getTranche() {
        return tranche;
    }

    public void addRequest(String lender, BigInteger shares, long currentEpochId) {
        FixedPointMath.requirePositive(shares, "shares");

        // Validate everything before touching state
        EpochInfo current = lastEpochIfCurrent(currentEpochId);
        EpochInfo updatedEpoch = current == null
                ? EpochInfo.open(currentEpochId, shares)
                : current.withSharesRequested(current.getTotalSharesRequested().add(shares));

        List<RedemptionRequest> requests = lenderRequests.computeIfAbsent(lender, k -> new ArrayList<>());
        RedemptionRequest last = requests.isEmpty() ? null : requests.get(requests.size() - 1);
        if (last != null && last.getEpochId() == currentEpochId) {
            RedemptionRequest merged = last.withSharesRequested(
                    FixedPointMath.checked(last.getSharesRequested().add(shares), "sharesRequested"));
            requests.set(requests.size() - 1, merged);
        } else {
            requests.add(new RedemptionRequest(currentEpochId, shares));
        }
        cursors.putIfAbsent(lender, DisbursementCursor.INITIAL);

        if (current == null) {
            epochIds.add(currentEpochId);
        }
        epochInfos.put(currentEpochId, updatedEpoch);
        log.debug("{} epoch {} now has {} shares requested", tranche, currentEpochId,
                updatedEpoch.getTotalSharesRequested());
    }

    /**
     * Shares the lender can still cancel: their latest request, if it targets the open epoch.
     */
    public BigInteger cancellableShares(String lender, long currentEpochId) {
        List<RedemptionRequest> requests = lenderRequests.get(lender);
        if (requests == null || requests.isEmpty()) {
            return BigInteger.ZERO;
        }
        RedemptionRequest last = requests.get(requests.size() - 1);
        return last.getEpochId() == currentEpochId ? last.getSharesRequested() : BigInteger.ZERO;
    }

    public void cancelRequest(String lender, BigInteger shares, long currentEpochId) {
        FixedPointMath.requirePositive(shares, "shares");
        BigInteger cancellable = cancellableShares(lender, currentEpochId);
        if (cancellable.signum() == 0) {
            throw new PreconditionViolationException(
                    "Lender " + lender + " has no redemption request in the current epoch " + currentEpochId);
        }
        if (shares.compareTo(cancellable) > 0) {
            throw new PreconditionViolationException(
                    "Cannot cancel " + shares + " shares, only " + cancellable + " are cancellable");
        }

        List<RedemptionRequest> requests = lenderRequests.get(lender);
        RedemptionRequest last = requests.get(requests.size() - 1);
        BigInteger remaining = last.getSharesRequested().subtract(shares);
        if (remaining.signum() == 0) {
            requests.remove(requests.size() - 1);
        } else {
            requests.set(requests.size() - 1, last.withSharesRequested(remaining));
        }

        EpochInfo epoch = epochInfos.get(currentEpochId);
        BigInteger epochRemaining = epoch.getTotalSharesRequested().subtract(shares);
        if (epochRemaining.signum() == 0) {
            epochInfos.remove(currentEpochId);
            epochIds.remove(epochIds.size() - 1);
        } else {
            epochInfos.put(currentEpochId, epoch.withSharesRequested(epochRemaining));
        }
    }

    /**
     * Epochs not yet fulfilled, oldest first.
     */
    public List<EpochInfo> unprocessedEpochs() {
        List<EpochInfo> result = new ArrayList<>();
        for (int i = firstUnprocessedEpochIndex; i < epochIds.size(); i++) {
            result.add(epochInfos.get(epochIds.get(i)));
        }
        return result;
    }

    public EpochInfo getEpochInfo(long epochId) {
        return epochInfos.get(epochId);
    }

    public List<RedemptionRequest> getRequests(String lender) {
        return Collections.unmodifiableList(lenderRequests.getOrDefault(lender, List.of()));
    }

    public DisbursementCursor getCursor(String lender) {
        return cursors.getOrDefault(lender, DisbursementCursor.INITIAL);
    }

    /**
     * Replaces the touched epoch aggregates and advances past every fulfilled epoch.
     * All epochs are checked before any is written.
     */
    public void applySettlement(EpochSettlement settlement) {
        if (settlement.getTranche() != tranche) {
            throw new PreconditionViolationException(
                    "Settlement for " + settlement.getTranche() + " sent to the " + tranche + " ledger");
        }
        for (EpochInfo updated : settlement.getEpochsProcessed()) {
            EpochInfo existing = epochInfos.get(updated.getEpochId());
            if (existing == null || existing.isFulfilled()) {
                throw new PreconditionViolationException(
                        "Epoch " + updated.getEpochId() + " is not pending in the " + tranche + " ledger");
            }
            if (!existing.getTotalSharesRequested().equals(updated.getTotalSharesRequested())
                    || updated.getTotalSharesProcessed().compareTo(existing.getTotalSharesProcessed()) < 0) {
                throw new PreconditionViolationException(
                        "Settlement for epoch " + updated.getEpochId() + " does not extend its current state");
            }
        }
        for (EpochInfo updated : settlement.getEpochsProcessed()) {
            epochInfos.put(updated.getEpochId(), updated);
        }
        while (firstUnprocessedEpochIndex < epochIds.size()
                && epochInfos.get(epochIds.get(firstUnprocessedEpochIndex)).isFulfilled()) {
            firstUnprocessedEpochIndex++;
        }
    }

    /**
     * Walks the lender's requests from their cursor and pro-rates every settled epoch.
     * Pure: the cursor is only moved by {@link #commitCursor(String, DisbursementCursor)}.
     */
    public WithdrawableAmount computeWithdrawable(String lender) {
        List<RedemptionRequest> requests = lenderRequests.getOrDefault(lender, List.of());
        DisbursementCursor cursor = getCursor(lender);

        int index = cursor.getRequestsIndex();
        BigInteger partialShares = cursor.getPartialSharesProcessed();
        BigInteger partialAmount = cursor.getPartialAmountProcessed();
        BigInteger shares = BigInteger.ZERO;
        BigInteger amount = BigInteger.ZERO;

        while (index < requests.size()) {
            RedemptionRequest request = requests.get(index);
            EpochInfo epoch = epochInfos.get(request.getEpochId());
            BigInteger sharesProcessed = FixedPointMath.mulDiv(request.getSharesRequested(),
                    epoch.getTotalSharesProcessed(), epoch.getTotalSharesRequested());
            BigInteger amountProcessed = FixedPointMath.mulDiv(request.getSharesRequested(),
                    epoch.getTotalAmountProcessed(), epoch.getTotalSharesRequested());

            shares = shares.add(sharesProcessed.subtract(partialShares));
            amount = amount.add(amountProcessed.subtract(partialAmount));

            if (epoch.isFulfilled()) {
                index++;
                partialShares = BigInteger.ZERO;
                partialAmount = BigInteger.ZERO;
            } else {
                // Nothing after a partially settled (or open) epoch can be settled yet
                partialShares = sharesProcessed;
                partialAmount = amountProcessed;
                break;
            }
        }

        return new WithdrawableAmount(shares, amount, new DisbursementCursor(index, partialShares, partialAmount));
    }

    /**
     * Stores the lender's new cursor. An unchanged cursor is not written, so lenders
     * without requests never gain an entry.
     */
    public void commitCursor(String lender, DisbursementCursor cursor) {
        if (cursor.equals(getCursor(lender))) {
            return;
        }
        cursors.put(lender, cursor);
    }

    public boolean hasCursor(String lender) {
        return cursors.containsKey(lender);
    }

    private EpochInfo lastEpochIfCurrent(long currentEpochId) {
        if (epochIds.isEmpty()) {
            return null;
        }
        long lastId = epochIds.get(epochIds.size() - 1);
        return lastId == currentEpochId ? epochInfos.get(lastId) : null;
    }
}
