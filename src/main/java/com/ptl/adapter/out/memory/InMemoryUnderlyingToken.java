package com.ptl.adapter.out.memory;

import com.ptl.application.port.out.UnderlyingToken;
import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory balances of the underlying asset.
 * Accounts are plain strings: lenders, cover providers and the pool's own accounts.
 */
@Slf4j
public class InMemoryUnderlyingToken implements UnderlyingToken {

    private final Map<String, BigInteger> balances = new HashMap<>();

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public void transfer(String from, String to, BigInteger amount) {
        FixedPointMath.checked(amount, "amount");
        BigInteger fromBalance = balanceOf(from);
        if (fromBalance.compareTo(amount) < 0) {
            throw new PreconditionViolationException(
                    "Account " + from + " holds " + fromBalance + ", cannot transfer " + amount);
        }
        BigInteger toBalance = FixedPointMath.checked(balanceOf(to).add(amount), "balance of " + to);
        balances.put(from, fromBalance.subtract(amount));
        balances.put(to, toBalance);
    }

    /**
     * Credits an account from outside the pool, e.g. the opening balances loaded from configuration.
     */
    public void mint(String account, BigInteger amount) {
        balances.put(account, FixedPointMath.checked(balanceOf(account).add(amount), "balance of " + account));
        log.debug("Minted {} to {}", amount, account);
    }
}
