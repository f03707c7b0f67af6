package com.ptl.config;

import com.ptl.domain.policy.TranchesPolicyType;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class PoolConfigTest {

    @Test
    void from_shouldFallBackToDefaults() {
        PoolConfig config = PoolConfig.from(new JsonObject());

        assertEquals(PoolConfig.DEFAULT_PORT, config.httpPort());
        assertEquals(PoolConfig.PoolSettings.defaults(), config.pool());
        assertEquals(PoolConfig.FeeSettings.none(), config.fees());
        assertTrue(config.firstLossCovers().isEmpty());
        assertTrue(config.openingBalances().isEmpty());
    }

    @Test
    void from_shouldReadNestedAndFlatPorts() {
        assertEquals(9000, PoolConfig.from(new JsonObject().put("http", new JsonObject().put("port", 9000))).httpPort());
        assertEquals(9100, PoolConfig.from(new JsonObject()
                .put("http.port", 9100)
                .put("http", new JsonObject().put("port", 9000))).httpPort());
    }

    @Test
    void from_shouldParseLargeAmountsFromStrings() {
        JsonObject json = new JsonObject()
                .put("pool", new JsonObject()
                        .put("tranchesPolicy", "fixed_senior_yield")
                        .put("fixedSeniorYieldBps", 800)
                        .put("liquidityCap", "79228162514264337593543950335")
                        .put("flexWindowEpochs", 2))
                .put("firstLossCovers", new JsonArray()
                        .add(new JsonObject()
                                .put("name", "borrower")
                                .put("coverRatePerLossBps", 10000)
                                .put("coverCapPerLoss", 1000)))
                .put("openingBalances", new JsonObject().put("alice", "5000"));

        PoolConfig config = PoolConfig.from(json);

        assertEquals(TranchesPolicyType.FIXED_SENIOR_YIELD, config.pool().tranchesPolicy());
        assertEquals(new BigInteger("79228162514264337593543950335"), config.pool().liquidityCap());
        assertEquals(2, config.pool().flexWindowEpochs());
        assertEquals(BigInteger.valueOf(1000), config.firstLossCovers().get(0).coverCapPerLoss());
        assertEquals(BigInteger.valueOf(5000), config.openingBalances().get("alice"));
    }

    @Test
    void from_shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.from(new JsonObject()
                .put("pool", new JsonObject().put("riskAdjustmentBps", 10001))));
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.from(new JsonObject()
                .put("pool", new JsonObject().put("tranchesPolicy", "MEZZANINE"))));
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.from(new JsonObject()
                .put("fees", new JsonObject().put("poolOwnerRewardBps", 6000).put("eaRewardBps", 5000))));
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.from(new JsonObject()
                .put("openingBalances", new JsonObject().put("alice", "lots"))));
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.from(new JsonObject()
                .put("firstLossCovers", new JsonArray()
                        .add(new JsonObject().put("name", "a"))
                        .add(new JsonObject().put("name", "a")))));
    }

    @Test
    void poolAssembly_shouldWireTheConfiguredPool() {
        JsonObject json = new JsonObject()
                .put("pool", new JsonObject().put("tranchesPolicy", "FIXED_SENIOR_YIELD").put("fixedSeniorYieldBps", 1000))
                .put("firstLossCovers", new JsonArray().add(new JsonObject().put("name", "borrower")))
                .put("openingBalances", new JsonObject().put("alice", 700));

        PoolAssembly pool = new PoolAssembly(PoolConfig.from(json), Clock.systemUTC());

        assertEquals(BigInteger.valueOf(700), pool.balanceOf("alice"));
        assertEquals(1, pool.getTrancheLedger().getFirstLossCovers().size());
        assertTrue(pool.getTranchesPolicy().getSeniorYieldTracker().isPresent());
        assertEquals(1L, pool.getEpochSettlementUseCase().currentEpochId());
    }
}
