package io.validatorpool.observability;

import io.validatorpool.pool.ValidatorPool;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(ValidatorPool.PoolStats stats) {
        return format(stats, null);
    }

    public static String format(ValidatorPool.PoolStats stats, String namespace) {
        String labelName = namespace == null || namespace.isBlank() ? null : "namespace";
        String labelValue = labelName == null ? null : namespace.trim();
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "validatorpool_validators", "Addresses whose free balance meets the minimum bond", labelName, labelValue, stats.validatorCount());
        appendGauge(sb, "validatorpool_free_balance_total", "Sum of unbonded balances held by the pool", labelName, labelValue, stats.totalFreeBalance());
        appendGauge(sb, "validatorpool_bonded_total", "Sum of stake locked in pending bonds", labelName, labelValue, stats.totalBonded());
        appendGauge(sb, "validatorpool_pending_bonds", "Bonds awaiting release", labelName, labelValue, stats.pendingBonds());
        appendGauge(sb, "validatorpool_oldest_pending_checkpoint", "Checkpoint index of the oldest pending bond (-1 when none)", labelName, labelValue, stats.oldestPendingIndex());
        appendGauge(sb, "validatorpool_rotation_cursor", "Validator set position of the next validator on turn", labelName, labelValue, stats.rotationCursor());
        appendGauge(sb, "validatorpool_reward_outbox_pending", "Reward notifications not yet handed to the bridge", labelName, labelValue, stats.pendingRewardNotifications());
        appendGauge(sb, "validatorpool_min_bond_amount", "Configured minimum bond amount", labelName, labelValue, stats.minBondAmount());
        return sb.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
