package com.ptl.config;

import com.ptl.domain.model.FirstLossCoverConfig;
import com.ptl.domain.policy.TranchesPolicyType;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, validated pool configuration.
 * Parsed once from the merged ConfigRetriever JSON and handed to the HTTP verticle.
 *
 * Amounts are read from strings or numbers so values beyond the JSON long range survive.
 */
public record PoolConfig(
        int httpPort,
        PoolSettings pool,
        FeeSettings fees,
        List<CoverSettings> firstLossCovers,
        Map<String, BigInteger> openingBalances) {

    public static final int DEFAULT_PORT = 8080;

    public record PoolSettings(
            TranchesPolicyType tranchesPolicy,
            int riskAdjustmentBps,
            int fixedSeniorYieldBps,
            int maxSeniorJuniorRatioBps,
            BigInteger liquidityCap,
            BigInteger minDepositAmount,
            int flexWindowEpochs,
            long epochCloseIntervalMs) {

        public PoolSettings {
            Objects.requireNonNull(tranchesPolicy, "tranchesPolicy must not be null");
            requireBps(riskAdjustmentBps, "riskAdjustmentBps");
            if (fixedSeniorYieldBps < 0) {
                throw new IllegalArgumentException("fixedSeniorYieldBps must not be negative");
            }
            if (maxSeniorJuniorRatioBps <= 0) {
                throw new IllegalArgumentException("maxSeniorJuniorRatioBps must be positive");
            }
            requireAmount(liquidityCap, "liquidityCap");
            requireAmount(minDepositAmount, "minDepositAmount");
            if (flexWindowEpochs < 0) {
                throw new IllegalArgumentException("flexWindowEpochs must not be negative");
            }
            if (epochCloseIntervalMs < 0) {
                throw new IllegalArgumentException("epochCloseIntervalMs must not be negative");
            }
        }

        public static PoolSettings defaults() {
            return new PoolSettings(TranchesPolicyType.RISK_ADJUSTED, 2000, 0, 40000,
                    BigInteger.ZERO, BigInteger.ONE, 0, 0L);
        }
    }

    public record FeeSettings(int protocolFeeBps, int poolOwnerRewardBps, int eaRewardBps) {

        public FeeSettings {
            requireBps(protocolFeeBps, "protocolFeeBps");
            requireBps(poolOwnerRewardBps, "poolOwnerRewardBps");
            requireBps(eaRewardBps, "eaRewardBps");
            if (poolOwnerRewardBps + eaRewardBps > 10_000) {
                throw new IllegalArgumentException("poolOwnerRewardBps + eaRewardBps must not exceed 10000");
            }
        }

        public static FeeSettings none() {
            return new FeeSettings(0, 0, 0);
        }
    }

    public record CoverSettings(
            String name,
            int coverRatePerLossBps,
            BigInteger coverCapPerLoss,
            int riskYieldMultiplierBps,
            BigInteger minLiquidity,
            BigInteger maxLiquidity) {

        public CoverSettings {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("first loss cover name must be provided");
            }
            requireBps(coverRatePerLossBps, "coverRatePerLossBps");
            requireAmount(coverCapPerLoss, "coverCapPerLoss");
            if (riskYieldMultiplierBps < 0) {
                throw new IllegalArgumentException("riskYieldMultiplierBps must not be negative");
            }
            requireAmount(minLiquidity, "minLiquidity");
            requireAmount(maxLiquidity, "maxLiquidity");
        }

        public FirstLossCoverConfig toCoverConfig() {
            return FirstLossCoverConfig.builder()
                    .coverRatePerLossBps(coverRatePerLossBps)
                    .coverCapPerLoss(coverCapPerLoss)
                    .riskYieldMultiplierBps(riskYieldMultiplierBps)
                    .minLiquidity(minLiquidity)
                    .maxLiquidity(maxLiquidity)
                    .build();
        }
    }

    public PoolConfig {
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("http.port must be 0-65535");
        }
        Objects.requireNonNull(pool, "pool settings must not be null");
        Objects.requireNonNull(fees, "fee settings must not be null");
        firstLossCovers = List.copyOf(firstLossCovers);
        long distinctNames = firstLossCovers.stream().map(CoverSettings::name).distinct().count();
        if (distinctNames != firstLossCovers.size()) {
            throw new IllegalArgumentException("first loss cover names must be unique");
        }
        openingBalances = Collections.unmodifiableMap(new LinkedHashMap<>(openingBalances));
    }

    /**
     * Parse and validate configuration from the merged config JSON.
     * @throws IllegalArgumentException if validation fails
     */
    public static PoolConfig from(JsonObject json) {
        JsonObject http = json.getJsonObject("http", new JsonObject());
        int port = json.getInteger("http.port", http.getInteger("port", DEFAULT_PORT));

        PoolSettings defaults = PoolSettings.defaults();
        JsonObject poolJson = json.getJsonObject("pool", new JsonObject());
        PoolSettings pool = new PoolSettings(
                TranchesPolicyType.fromValue(poolJson.getString("tranchesPolicy", defaults.tranchesPolicy().getValue())),
                poolJson.getInteger("riskAdjustmentBps", defaults.riskAdjustmentBps()),
                poolJson.getInteger("fixedSeniorYieldBps", defaults.fixedSeniorYieldBps()),
                poolJson.getInteger("maxSeniorJuniorRatioBps", defaults.maxSeniorJuniorRatioBps()),
                amount(poolJson, "liquidityCap", defaults.liquidityCap()),
                amount(poolJson, "minDepositAmount", defaults.minDepositAmount()),
                poolJson.getInteger("flexWindowEpochs", defaults.flexWindowEpochs()),
                poolJson.getLong("epochCloseIntervalMs", defaults.epochCloseIntervalMs()));

        JsonObject feesJson = json.getJsonObject("fees", new JsonObject());
        FeeSettings fees = new FeeSettings(
                feesJson.getInteger("protocolFeeBps", 0),
                feesJson.getInteger("poolOwnerRewardBps", 0),
                feesJson.getInteger("eaRewardBps", 0));

        List<CoverSettings> covers = new ArrayList<>();
        JsonArray coversJson = json.getJsonArray("firstLossCovers", new JsonArray());
        for (int i = 0; i < coversJson.size(); i++) {
            JsonObject coverJson = coversJson.getJsonObject(i);
            covers.add(new CoverSettings(
                    coverJson.getString("name"),
                    coverJson.getInteger("coverRatePerLossBps", 0),
                    amount(coverJson, "coverCapPerLoss", BigInteger.ZERO),
                    coverJson.getInteger("riskYieldMultiplierBps", 0),
                    amount(coverJson, "minLiquidity", BigInteger.ZERO),
                    amount(coverJson, "maxLiquidity", BigInteger.ZERO)));
        }

        Map<String, BigInteger> balances = new LinkedHashMap<>();
        JsonObject balancesJson = json.getJsonObject("openingBalances", new JsonObject());
        for (String account : balancesJson.fieldNames()) {
            balances.put(account, amount(balancesJson, account, BigInteger.ZERO));
        }

        return new PoolConfig(port, pool, fees, covers, balances);
    }

    private static BigInteger amount(JsonObject json, String key, BigInteger defaultValue) {
        Object raw = json.getValue(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return new BigInteger(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer amount, got: " + raw, e);
        }
    }

    private static void requireBps(int bps, String name) {
        if (bps < 0 || bps > 10_000) {
            throw new IllegalArgumentException(name + " must be within 0-10000");
        }
    }

    private static void requireAmount(BigInteger amount, String name) {
        Objects.requireNonNull(amount, name + " must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }
}
