package com.propertyintel.insights.service;

import com.propertyintel.insights.model.Account;
import lombok.Getter;

/**
 * The account cannot be synced at all. Raised before any upstream call; never retried.
 */
@Getter
public class SyncPreconditionException extends RuntimeException {

    public enum Reason { NOT_FOUND, INACTIVE, MISSING_CREDENTIALS }

    private final String accountId;
    private final Reason reason;

    public SyncPreconditionException(String accountId, Reason reason) {
        super(describe(accountId, reason));
        this.accountId = accountId;
        this.reason = reason;
    }

    /** Throws unless the account is active and has a complete credential bundle. */
    public static void check(Account account) {
        if (!account.isActive()) {
            throw new SyncPreconditionException(account.getAccountId(), Reason.INACTIVE);
        }
        if (account.getCredentials() == null || !account.getCredentials().isComplete()) {
            throw new SyncPreconditionException(account.getAccountId(), Reason.MISSING_CREDENTIALS);
        }
    }

    private static String describe(String accountId, Reason reason) {
        return switch (reason) {
            case NOT_FOUND -> "Account " + accountId + " not found";
            case INACTIVE -> "Account " + accountId + " is not active";
            case MISSING_CREDENTIALS -> "Account " + accountId + " has incomplete credentials";
        };
    }
}
