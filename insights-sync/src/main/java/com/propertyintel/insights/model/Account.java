package com.propertyintel.insights.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * A tenant whose listings are synced independently.
 *
 * Lifecycle notes:
 *  - created / updated / soft-deleted by the account CRUD layer
 *  - the sync only ever writes last_sync_at, after a completed run
 */
@Data
@Builder
public class Account {

    private String accountId;
    private UUID customerId;            // nullable
    private boolean active;
    private Instant lastSyncAt;         // null until the first completed run
    private AccountCredentials credentials;
    private Instant deletedAt;          // soft delete, null when live

    public SyncState syncState() {
        return SyncState.of(lastSyncAt);
    }
}
