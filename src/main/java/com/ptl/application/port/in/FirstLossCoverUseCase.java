package com.ptl.application.port.in;

import java.math.BigInteger;

/**
 * Input port for first-loss-cover providers.
 */
public interface FirstLossCoverUseCase {

    /**
     * @return Cover shares minted to the provider
     */
    BigInteger depositCover(int coverIndex, String provider, BigInteger assets);

    /**
     * @return Assets paid to the provider
     */
    BigInteger redeemCover(int coverIndex, String provider, BigInteger shares);
}
