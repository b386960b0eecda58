package io.validatorpool.reward;

import io.validatorpool.model.Address;
import io.validatorpool.model.BridgeMessage;
import io.validatorpool.model.RewardNotification;
import io.validatorpool.storage.Database;
import io.validatorpool.storage.Transactions;
import io.validatorpool.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Transactional outbox in front of the {@link RewardBridge}.
 *
 * <p>{@link #enqueue} runs inside the release transaction, so a notification exists exactly when the bond
 * release committed. {@link #flush} hands committed rows to the bridge in insertion order and marks them
 * sent; a bridge failure stops the flush and leaves the remaining rows for the next one.
 */
public final class RewardNotifier {
    private static final Logger log = LoggerFactory.getLogger(RewardNotifier.class);
    private static final int FLUSH_BATCH = 64;

    private final Database database;
    private final RewardBridge bridge;
    private final Address rewardVault;
    private final long gasLimit;

    public RewardNotifier(Database database, RewardBridge bridge, Address rewardVault, long gasLimit) {
        this.database = database;
        this.bridge = bridge;
        this.rewardVault = rewardVault;
        this.gasLimit = gasLimit;
    }

    public long enqueue(Connection c, RewardNotification notification, long now) throws SQLException {
        String payload = Jsons.toCompactJson(notification);
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO reward_outbox(checkpoint_index,beneficiary,l2_block_number,penalty,penalty_period,target,gas_limit,payload,created_at) "
                        + "VALUES(?,?,?,?,?,?,?,?,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, notification.checkpointIndex());
            ps.setString(2, notification.beneficiary().value());
            ps.setLong(3, notification.l2BlockNumber());
            ps.setLong(4, notification.penalty());
            ps.setLong(5, notification.penaltyPeriod());
            ps.setString(6, rewardVault.value());
            ps.setLong(7, gasLimit);
            ps.setString(8, payload);
            ps.setLong(9, now);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        }
    }

    public FlushOutcome flush(long now) {
        List<BridgeMessage> batch = pending(FLUSH_BATCH);
        int sent = 0;
        String lastError = null;
        for (BridgeMessage message : batch) {
            try {
                bridge.send(message);
            } catch (RuntimeException e) {
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("Reward bridge rejected outbox message {}, {} left pending: {}",
                        message.outboxId(), batch.size() - sent, lastError);
                break;
            }
            markSent(message.outboxId(), now);
            sent++;
        }
        if (sent > 0) {
            log.debug("Flushed {} reward notification(s) to {}", sent, rewardVault);
        }
        return new FlushOutcome(sent, pendingCount(), lastError);
    }

    public List<BridgeMessage> pending(int limit) {
        return Transactions.read(database, "list pending reward notifications", c -> {
            List<BridgeMessage> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id,target,payload,gas_limit,created_at FROM reward_outbox WHERE sent_at IS NULL ORDER BY id ASC LIMIT ?")) {
                ps.setInt(1, Math.max(1, limit));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new BridgeMessage(
                                rs.getLong("id"),
                                Address.of(rs.getString("target")),
                                rs.getString("payload"),
                                rs.getLong("gas_limit"),
                                rs.getLong("created_at")
                        ));
                    }
                }
            }
            return out;
        });
    }

    public int pendingCount() {
        return Transactions.read(database, "count pending reward notifications", this::pendingCount);
    }

    public int pendingCount(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM reward_outbox WHERE sent_at IS NULL");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private void markSent(long outboxId, long now) {
        Transactions.inTransaction(database, "mark reward notification sent", c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE reward_outbox SET sent_at=? WHERE id=? AND sent_at IS NULL")) {
                ps.setLong(1, now);
                ps.setLong(2, outboxId);
                return ps.executeUpdate();
            }
        });
    }

    public record FlushOutcome(int sent, int stillPending, String lastError) {
    }
}
