package io.b2mash.credstore.quota;

import java.util.UUID;

/**
 * Effective limits and current usage of one tenant.
 *
 * @param writesThisMinute write requests admitted in the current rate window
 * @param readsThisMinute read requests admitted in the current rate window
 */
public record QuotaStatus(
    UUID tenantId,
    QuotaLimits limits,
    int secretCount,
    int writesThisMinute,
    int readsThisMinute,
    boolean provisioned) {}
