package com.ptl.adapter.out.memory;

import com.ptl.application.port.out.TrancheShareLedger;
import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.TrancheType;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory share token of one tranche.
 */
public class InMemoryTrancheShareLedger implements TrancheShareLedger {

    private final TrancheType tranche;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryTrancheShareLedger(TrancheType tranche) {
        this.tranche = tranche;
    }

    @Override
    public BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public void mint(String account, BigInteger shares) {
        BigInteger newSupply = FixedPointMath.checked(totalSupply.add(shares), tranche + ".totalSupply");
        balances.put(account, balanceOf(account).add(shares));
        totalSupply = newSupply;
    }

    @Override
    public void burn(String account, BigInteger shares) {
        BigInteger balance = requireBalance(account, shares);
        putBalance(account, balance.subtract(shares));
        totalSupply = totalSupply.subtract(shares);
    }

    @Override
    public void transfer(String from, String to, BigInteger shares) {
        BigInteger balance = requireBalance(from, shares);
        putBalance(from, balance.subtract(shares));
        balances.put(to, balanceOf(to).add(shares));
    }

    private BigInteger requireBalance(String account, BigInteger shares) {
        BigInteger balance = balanceOf(account);
        if (balance.compareTo(shares) < 0) {
            throw new PreconditionViolationException(
                    account + " holds " + balance + " " + tranche + " shares, needs " + shares);
        }
        return balance;
    }

    private void putBalance(String account, BigInteger balance) {
        if (balance.signum() == 0) {
            balances.remove(account);
        } else {
            balances.put(account, balance);
        }
    }
}
