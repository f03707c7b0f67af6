package com.ptl.application.port.in;

import com.ptl.domain.model.TrancheType;
import com.ptl.domain.model.WithdrawableAmount;

import java.math.BigInteger;

/**
 * Input port for lender-facing redemption operations of a tranche vault.
 */
public interface RedemptionUseCase {

    /**
     * Queues shares for redemption in the current epoch; the shares move into escrow.
     */
    void addRedemptionRequest(TrancheType tranche, String lender, BigInteger shares);

    /**
     * Only the lender's latest request can be cancelled, and only while its epoch is still open.
     */
    void cancelRedemptionRequest(TrancheType tranche, String lender, BigInteger shares);

    BigInteger cancellableRedemptionShares(TrancheType tranche, String lender);

    /**
     * Side-effect free; repeated calls return the same figures until the next disbursement or epoch close.
     */
    WithdrawableAmount withdrawableAssets(TrancheType tranche, String lender);

    /**
     * Pays out everything withdrawable and moves the lender's cursor.
     * @return Amount paid
     */
    BigInteger disburse(TrancheType tranche, String lender);
}
