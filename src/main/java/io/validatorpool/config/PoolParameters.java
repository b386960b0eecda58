package io.validatorpool.config;

import io.validatorpool.model.Address;
import io.validatorpool.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Engine parameters fixed at construction. Periods are in seconds; amounts are in the staked asset's
 * smallest unit.
 */
public record PoolParameters(
        long minBondAmount,
        long nonPenaltyPeriod,
        long penaltyPeriod,
        long finalizationPeriod,
        Address publicRoundAddress,
        Address checkpointStorage,
        Address disputeContract,
        Address rewardVault,
        long rewardGasLimit
) {
    public static final long DEFAULT_MIN_BOND_AMOUNT = 100L;
    public static final long DEFAULT_NON_PENALTY_PERIOD = 1_800L;
    public static final long DEFAULT_PENALTY_PERIOD = 1_800L;
    public static final long DEFAULT_FINALIZATION_PERIOD = 604_800L;
    public static final long DEFAULT_REWARD_GAS_LIMIT = 100_000L;

    public PoolParameters {
        if (minBondAmount <= 0L) {
            throw new IllegalArgumentException("minBondAmount must be positive");
        }
        if (nonPenaltyPeriod < 0L || penaltyPeriod < 0L || finalizationPeriod < 0L) {
            throw new IllegalArgumentException("periods must not be negative");
        }
        if (nonPenaltyPeriod + penaltyPeriod <= 0L) {
            throw new IllegalArgumentException("round duration must be positive");
        }
        if (rewardGasLimit <= 0L) {
            throw new IllegalArgumentException("rewardGasLimit must be positive");
        }
        Objects.requireNonNull(publicRoundAddress, "publicRoundAddress");
        Objects.requireNonNull(checkpointStorage, "checkpointStorage");
        Objects.requireNonNull(disputeContract, "disputeContract");
        Objects.requireNonNull(rewardVault, "rewardVault");
    }

    public static PoolParameters defaults(Address checkpointStorage, Address disputeContract, Address rewardVault) {
        return new PoolParameters(
                DEFAULT_MIN_BOND_AMOUNT,
                DEFAULT_NON_PENALTY_PERIOD,
                DEFAULT_PENALTY_PERIOD,
                DEFAULT_FINALIZATION_PERIOD,
                Address.maxValue(),
                checkpointStorage,
                disputeContract,
                rewardVault,
                DEFAULT_REWARD_GAS_LIMIT
        );
    }

    public long roundDuration() {
        return nonPenaltyPeriod + penaltyPeriod;
    }

    public static PoolParameters load(ValidatorPoolConfig config) {
        return load(config.settingsFile());
    }

    public static PoolParameters load(Path settingsFile) {
        if (!Files.exists(settingsFile)) {
            throw new IllegalArgumentException("Missing pool settings file: " + settingsFile);
        }
        SettingsFile file;
        try {
            file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load pool settings: " + settingsFile, e);
        }
        return fromFile(file, settingsFile);
    }

    private static PoolParameters fromFile(SettingsFile file, Path source) {
        return new PoolParameters(
                file.minBondAmount() == null ? DEFAULT_MIN_BOND_AMOUNT : file.minBondAmount(),
                file.nonPenaltyPeriod() == null ? DEFAULT_NON_PENALTY_PERIOD : file.nonPenaltyPeriod(),
                file.penaltyPeriod() == null ? DEFAULT_PENALTY_PERIOD : file.penaltyPeriod(),
                file.finalizationPeriod() == null ? DEFAULT_FINALIZATION_PERIOD : file.finalizationPeriod(),
                file.publicRoundAddress() == null || file.publicRoundAddress().isBlank()
                        ? Address.maxValue()
                        : Address.of(file.publicRoundAddress()),
                requiredAddress(file.checkpointStorage(), "checkpointStorage", source),
                requiredAddress(file.disputeContract(), "disputeContract", source),
                requiredAddress(file.rewardVault(), "rewardVault", source),
                file.rewardGasLimit() == null ? DEFAULT_REWARD_GAS_LIMIT : file.rewardGasLimit()
        );
    }

    private static Address requiredAddress(String raw, String key, Path source) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Pool settings " + source + " missing required key: " + key);
        }
        return Address.of(raw);
    }

    private record SettingsFile(
            Long minBondAmount,
            Long nonPenaltyPeriod,
            Long penaltyPeriod,
            Long finalizationPeriod,
            String publicRoundAddress,
            String checkpointStorage,
            String disputeContract,
            String rewardVault,
            Long rewardGasLimit
    ) {
    }
}
