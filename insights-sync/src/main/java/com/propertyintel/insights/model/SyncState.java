package com.propertyintel.insights.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Whether an account has ever completed a sync.
 * Keeps "never synced" distinct from any timestamp value.
 */
public sealed interface SyncState permits SyncState.NeverSynced, SyncState.SyncedAt {

    static SyncState of(Instant lastSyncAt) {
        return lastSyncAt == null ? NeverSynced.INSTANCE : new SyncedAt(lastSyncAt);
    }

    default boolean isFirstRun() {
        return this instanceof NeverSynced;
    }

    final class NeverSynced implements SyncState {
        static final NeverSynced INSTANCE = new NeverSynced();

        private NeverSynced() {
        }

        @Override
        public String toString() {
            return "NeverSynced";
        }
    }

    record SyncedAt(Instant at) implements SyncState {
        public SyncedAt {
            Objects.requireNonNull(at, "at");
        }
    }
}
