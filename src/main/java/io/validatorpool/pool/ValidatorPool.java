package io.validatorpool.pool;

import io.validatorpool.bond.BondRegistry;
import io.validatorpool.config.PoolParameters;
import io.validatorpool.config.ValidatorPoolConfig;
import io.validatorpool.error.ErrorKind;
import io.validatorpool.error.ValidatorPoolException;
import io.validatorpool.ledger.BalanceLedger;
import io.validatorpool.ledger.MembershipChange;
import io.validatorpool.model.Address;
import io.validatorpool.model.Assignment;
import io.validatorpool.model.Bond;
import io.validatorpool.model.Checkpoint;
import io.validatorpool.model.RewardNotification;
import io.validatorpool.observability.PoolEventLog;
import io.validatorpool.observability.PoolEventLog.PoolEvent;
import io.validatorpool.observability.PrometheusFormatter;
import io.validatorpool.oracle.CheckpointOracle;
import io.validatorpool.penalty.PenaltyCalculator;
import io.validatorpool.reward.RewardBridge;
import io.validatorpool.reward.RewardNotifier;
import io.validatorpool.rotation.RotationScheduler;
import io.validatorpool.storage.Database;
import io.validatorpool.storage.Transactions;
import io.validatorpool.vault.StakeVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stake-bonding and validator-rotation engine.
 *
 * <p>Every entry point is {@code synchronized} and runs as one SQLite transaction: either all of its ledger,
 * validator-set, bond, rotation and outbox writes commit, or none do. Time is always the caller-supplied
 * {@code now} in epoch seconds. Events are appended to the {@link PoolEventLog} only after commit, and reward
 * notifications queued by a release are flushed to the bridge right after; neither step can fail a committed call.
 */
public final class ValidatorPool {
    private static final Logger log = LoggerFactory.getLogger(ValidatorPool.class);

    private final ValidatorPoolConfig config;
    private final PoolParameters params;
    private final CheckpointOracle oracle;
    private final StakeVault vault;
    private final Database database;
    private final BalanceLedger ledger;
    private final RotationScheduler rotation;
    private final BondRegistry bonds;
    private final PenaltyCalculator penalties;
    private final RewardNotifier rewardNotifier;
    private final PoolEventLog eventLog;

    public ValidatorPool(
            ValidatorPoolConfig config,
            PoolParameters params,
            CheckpointOracle oracle,
            StakeVault vault,
            RewardBridge bridge
    ) {
        this.config = config;
        this.params = params;
        this.oracle = oracle;
        this.vault = vault;
        this.database = new Database(config);
        this.rotation = new RotationScheduler(params.roundDuration());
        this.ledger = new BalanceLedger(params.minBondAmount(), rotation::onRemoved);
        this.bonds = new BondRegistry();
        this.penalties = new PenaltyCalculator(params.nonPenaltyPeriod(), params.penaltyPeriod());
        this.rewardNotifier = new RewardNotifier(database, bridge, params.rewardVault(), params.rewardGasLimit());
        this.eventLog = new PoolEventLog(config.eventLogFile(), config.namespace());
    }

    public void init() {
        database.init();
        log.info("Validator pool ready at {} (namespace={}, minBond={}, round={}s)",
                config.rootDir(), config.namespace(), params.minBondAmount(), params.roundDuration());
    }

    public PoolParameters parameters() {
        return params;
    }

    public PoolEventLog eventLog() {
        return eventLog;
    }

    // ---- balance ledger ----

    public synchronized LedgerOutcome deposit(Address depositor, long amount, long now) {
        if (amount <= 0L) {
            throw ValidatorPoolException.belowMinimum("deposit amount must be positive: " + amount);
        }
        List<PoolEvent> events = new ArrayList<>();
        boolean[] pulled = {false};
        LedgerOutcome out;
        try {
            out = Transactions.inTransaction(database, "deposit", c -> {
                MembershipChange change = ledger.credit(c, depositor, amount, now);
                vault.pull(depositor, amount);
                pulled[0] = true;
                events.add(PoolEvent.of("validator.deposited", depositor, now, details("amount", amount)));
                recordMembership(events, depositor, change, now);
                return ledgerOutcome(c, depositor, change);
            });
        } catch (RuntimeException e) {
            if (pulled[0]) {
                vault.push(depositor, amount);
            }
            throw e;
        }
        recordEvents(events);
        log.debug("Deposit {} by {} -> balance {} ({})", amount, depositor, out.balance(), out.change());
        return out;
    }

    public synchronized LedgerOutcome withdraw(Address owner, long amount, long now) {
        if (amount <= 0L) {
            throw ValidatorPoolException.belowMinimum("withdraw amount must be positive: " + amount);
        }
        List<PoolEvent> events = new ArrayList<>();
        boolean[] pushed = {false};
        LedgerOutcome out;
        try {
            out = Transactions.inTransaction(database, "withdraw", c -> {
                MembershipChange change = ledger.debit(c, owner, amount, now);
                vault.push(owner, amount);
                pushed[0] = true;
                events.add(PoolEvent.of("validator.withdrawn", owner, now, details("amount", amount)));
                recordMembership(events, owner, change, now);
                return ledgerOutcome(c, owner, change);
            });
        } catch (RuntimeException e) {
            if (pushed[0]) {
                vault.pull(owner, amount);
            }
            throw e;
        }
        recordEvents(events);
        log.debug("Withdraw {} by {} -> balance {} ({})", amount, owner, out.balance(), out.change());
        return out;
    }

    public synchronized long balanceOf(Address address) {
        return Transactions.read(database, "read balance", c -> ledger.balanceOf(c, address));
    }

    public synchronized boolean isValidator(Address address) {
        return Transactions.read(database, "read validator membership", c -> ledger.isValidator(c, address));
    }

    public synchronized long validatorCount() {
        return Transactions.read(database, "read validator count", ledger::validatorCount);
    }

    public synchronized List<Address> validators() {
        return Transactions.read(database, "list validators", ledger::validators);
    }

    // ---- rotation scheduler ----

    public synchronized Assignment nextValidator(long now) {
        long deadline = oracle.expectedDeadline(oracle.nextExpectedBlockNumber());
        return Transactions.read(database, "select next validator",
                c -> rotation.select(now, deadline, ledger.validators(c), rotation.cursor(c)));
    }

    /**
     * {@link #nextValidator} flattened to an address, with the public round mapped to the configured sentinel.
     */
    public synchronized Address nextValidatorAddress(long now) {
        return nextValidator(now).toAddress(params.publicRoundAddress());
    }

    // ---- bond registry ----

    public synchronized BondCreateOutcome createBond(Address caller, long checkpointIndex, long amount, long expiresAt, long now) {
        requireCaller(caller, params.checkpointStorage(), "createBond");
        if (amount <= 0L || amount < params.minBondAmount()) {
            throw ValidatorPoolException.belowMinimum(
                    "bond amount " + amount + " is below the minimum " + params.minBondAmount());
        }
        Checkpoint checkpoint = requireCheckpoint(checkpointIndex);
        Address submitter = checkpoint.submitter();
        List<PoolEvent> events = new ArrayList<>();
        BondCreateOutcome out = Transactions.inTransaction(database, "create bond", c -> {
            if (bonds.find(c, checkpointIndex).isPresent()) {
                throw new ValidatorPoolException(ErrorKind.BOND_ALREADY_EXISTS,
                        "bond already exists for checkpoint " + checkpointIndex);
            }
            // the turn moves before the set changes, so joins and removals below rebase from the next slot
            rotation.advance(c, ledger.validatorCount(c), now);
            ReleaseOutcome released = null;
            Optional<Bond> oldest = bonds.oldest(c);
            if (oldest.isPresent() && oldest.get().expiredAt(now)) {
                released = releaseInTransaction(c, oldest.get(), now, events);
            }
            MembershipChange change = ledger.debit(c, submitter, amount, now);
            Bond bond = new Bond(checkpointIndex, amount, expiresAt, submitter);
            bonds.insert(c, bond, now);
            long cursor = rotation.cursor(c);
            events.add(PoolEvent.of("bond.created", submitter, now, details(
                    "checkpoint_index", checkpointIndex,
                    "amount", amount,
                    "expires_at", expiresAt)));
            recordMembership(events, submitter, change, now);
            return new BondCreateOutcome(bond, released, cursor);
        });
        recordEvents(events);
        log.info("Bond created for checkpoint {} by {} (amount={}, expiresAt={})",
                checkpointIndex, submitter, amount, expiresAt);
        if (out.lazilyReleased() != null) {
            logRelease(out.lazilyReleased());
            flushAfterCommit(now);
        }
        return out;
    }

    /**
     * Releases the oldest pending bond once it has expired.
     */
    public synchronized ReleaseOutcome unbond(long now) {
        List<PoolEvent> events = new ArrayList<>();
        ReleaseOutcome out = Transactions.inTransaction(database, "unbond", c -> {
            Bond oldest = bonds.oldest(c).orElseThrow(() ->
                    new ValidatorPoolException(ErrorKind.NO_SUCH_BOND, "no pending bond to release"));
            return releaseInTransaction(c, oldest, now, events);
        });
        recordEvents(events);
        logRelease(out);
        flushAfterCommit(now);
        return out;
    }

    public synchronized BondIncreaseOutcome increaseBond(Address caller, Address challenger, long checkpointIndex, long now) {
        requireCaller(caller, params.disputeContract(), "increaseBond");
        List<PoolEvent> events = new ArrayList<>();
        BondIncreaseOutcome out = Transactions.inTransaction(database, "increase bond", c -> {
            Bond bond = bonds.require(c, checkpointIndex);
            long added = bond.amount();
            MembershipChange change = ledger.debit(c, challenger, added, now);
            Bond increased = bonds.updateAmount(c, bond, Math.multiplyExact(added, 2L), now);
            events.add(PoolEvent.of("bond.increased", challenger, now, details(
                    "checkpoint_index", checkpointIndex,
                    "added", added,
                    "amount", increased.amount())));
            recordMembership(events, challenger, change, now);
            return new BondIncreaseOutcome(checkpointIndex, challenger, added, increased);
        });
        recordEvents(events);
        log.info("Bond for checkpoint {} increased by {} to {} by challenger {}",
                checkpointIndex, out.added(), out.bond().amount(), challenger);
        return out;
    }

    public synchronized Bond getBond(long checkpointIndex) {
        return Transactions.read(database, "read bond", c -> bonds.require(c, checkpointIndex));
    }

    public synchronized Optional<Bond> oldestPendingBond() {
        return Transactions.read(database, "read oldest bond", bonds::oldest);
    }

    public synchronized List<Bond> pendingBonds(int limit) {
        return Transactions.read(database, "list pending bonds", c -> bonds.pending(c, limit));
    }

    // ---- reward path, stats ----

    public synchronized RewardNotifier.FlushOutcome flushRewardNotifications(long now) {
        return rewardNotifier.flush(now);
    }

    public synchronized PoolStats stats() {
        return Transactions.read(database, "load pool stats", c -> {
            BondRegistry.BondTotals totals = bonds.totals(c);
            return new PoolStats(
                    ledger.validatorCount(c),
                    ledger.totalBalance(c),
                    totals.totalBonded(),
                    totals.pendingCount(),
                    totals.oldestIndex(),
                    rotation.cursor(c),
                    rewardNotifier.pendingCount(c),
                    params.minBondAmount()
            );
        });
    }

    public String metricsText() {
        String ns = ValidatorPoolConfig.DEFAULT_NAMESPACE.equals(config.namespace()) ? null : config.namespace();
        return PrometheusFormatter.format(stats(), ns);
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    // ---- internals ----

    private ReleaseOutcome releaseInTransaction(Connection c, Bond bond, long now, List<PoolEvent> events) throws SQLException {
        if (!bond.expiredAt(now)) {
            throw new ValidatorPoolException(ErrorKind.NOT_YET_EXPIRED,
                    "bond for checkpoint " + bond.checkpointIndex() + " expires at " + bond.expiresAt() + ", now " + now);
        }
        Checkpoint checkpoint = requireCheckpoint(bond.checkpointIndex());
        long deadline = oracle.expectedDeadline(checkpoint.l2BlockNumber());
        long penalty = penalties.penalty(checkpoint.timestamp(), deadline);
        RewardNotification notification = new RewardNotification(
                bond.submitter(),
                bond.checkpointIndex(),
                checkpoint.l2BlockNumber(),
                penalty,
                params.penaltyPeriod()
        );
        long outboxId = rewardNotifier.enqueue(c, notification, now);
        MembershipChange change = ledger.credit(c, bond.submitter(), bond.amount(), now);
        bonds.delete(c, bond.checkpointIndex());
        events.add(PoolEvent.of("bond.released", bond.submitter(), now, details(
                "checkpoint_index", bond.checkpointIndex(),
                "amount", bond.amount(),
                "penalty", penalty,
                "l2_block_number", checkpoint.l2BlockNumber())));
        recordMembership(events, bond.submitter(), change, now);
        return new ReleaseOutcome(bond.checkpointIndex(), bond.submitter(), bond.amount(), penalty,
                checkpoint.l2BlockNumber(), outboxId);
    }

    /**
     * Committed state is authoritative; a failing event log must not turn a committed call into an error.
     */
    private void recordEvents(List<PoolEvent> events) {
        try {
            eventLog.appendAll(events);
        } catch (RuntimeException e) {
            log.warn("Pool event log append failed, {} committed event(s) not recorded: {}",
                    events.size(), e.getMessage(), e);
        }
    }

    private void flushAfterCommit(long now) {
        try {
            rewardNotifier.flush(now);
        } catch (RuntimeException e) {
            log.warn("Reward outbox flush failed, notifications stay pending: {}", e.getMessage(), e);
        }
    }

    private Checkpoint requireCheckpoint(long checkpointIndex) {
        return oracle.getCheckpoint(checkpointIndex).orElseThrow(() -> new ValidatorPoolException(
                ErrorKind.UNKNOWN_CHECKPOINT, "checkpoint storage has no checkpoint " + checkpointIndex));
    }

    private static void requireCaller(Address caller, Address expected, String operation) {
        if (caller == null || !caller.equals(expected)) {
            throw ValidatorPoolException.unauthorized(operation + " called by " + caller + ", expected " + expected);
        }
    }

    private LedgerOutcome ledgerOutcome(Connection c, Address address, MembershipChange change) throws SQLException {
        return new LedgerOutcome(
                address,
                ledger.balanceOf(c, address),
                ledger.isValidator(c, address),
                ledger.validatorCount(c),
                change
        );
    }

    private static void recordMembership(List<PoolEvent> events, Address address, MembershipChange change, long now) {
        if (change == MembershipChange.JOINED) {
            events.add(PoolEvent.of("validator.joined", address, now, Map.of()));
        } else if (change == MembershipChange.LEFT) {
            events.add(PoolEvent.of("validator.left", address, now, Map.of()));
        }
    }

    private static void logRelease(ReleaseOutcome out) {
        log.info("Bond for checkpoint {} released to {} (amount={}, penalty={})",
                out.checkpointIndex(), out.submitter(), out.amount(), out.penalty());
    }

    private static Map<String, Object> details(Object... kv) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            out.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return out;
    }

    public record LedgerOutcome(
            Address address,
            long balance,
            boolean validator,
            long validatorCount,
            MembershipChange change
    ) {
    }

    public record BondCreateOutcome(Bond bond, ReleaseOutcome lazilyReleased, long rotationCursor) {
    }

    public record ReleaseOutcome(
            long checkpointIndex,
            Address submitter,
            long amount,
            long penalty,
            long l2BlockNumber,
            long outboxId
    ) {
    }

    public record BondIncreaseOutcome(long checkpointIndex, Address challenger, long added, Bond bond) {
    }

    public record PoolStats(
            long validatorCount,
            long totalFreeBalance,
            long totalBonded,
            long pendingBonds,
            long oldestPendingIndex,
            long rotationCursor,
            long pendingRewardNotifications,
            long minBondAmount
    ) {
    }
}
