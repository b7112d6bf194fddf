package com.propertyintel.insights.service;

import com.propertyintel.insights.model.Account;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to accounts plus the single write the sync is allowed to make.
 * Soft-deleted accounts are invisible here.
 */
public interface AccountProvider {

    Optional<Account> get(String accountId);

    List<Account> list(boolean activeOnly);

    void markSynced(String accountId, Instant syncedAt);
}
