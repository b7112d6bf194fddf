package com.propertyintel.insights.service;

import com.propertyintel.insights.model.Account;
import com.propertyintel.insights.model.AccountCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class JdbcAccountProvider implements AccountProvider {

    private static final String SELECT = """
            SELECT account_id, customer_id, is_active, last_sync_at,
                   airbnb_cookie, x_client_version, user_agent, deleted_at
            FROM insights.accounts
            WHERE deleted_at IS NULL
            """;

    private static final RowMapper<Account> ROW_MAPPER = (rs, i) -> Account.builder()
            .accountId(rs.getString("account_id"))
            .customerId(rs.getObject("customer_id", UUID.class))
            .active(rs.getBoolean("is_active"))
            .lastSyncAt(instant(rs.getTimestamp("last_sync_at")))
            .deletedAt(instant(rs.getTimestamp("deleted_at")))
            .credentials(AccountCredentials.builder()
                    .cookie(rs.getString("airbnb_cookie"))
                    .clientVersion(rs.getString("x_client_version"))
                    .userAgent(rs.getString("user_agent"))
                    .build())
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<Account> get(String accountId) {
        List<Account> found = jdbcTemplate.query(SELECT + " AND account_id = ?", ROW_MAPPER, accountId);
        return found.stream().findFirst();
    }

    @Override
    public List<Account> list(boolean activeOnly) {
        String sql = activeOnly ? SELECT + " AND is_active ORDER BY account_id" : SELECT + " ORDER BY account_id";
        return jdbcTemplate.query(sql, ROW_MAPPER);
    }

    @Override
    public void markSynced(String accountId, Instant syncedAt) {
        int updated = jdbcTemplate.update(
                "UPDATE insights.accounts SET last_sync_at = ?, updated_at = now() WHERE account_id = ?",
                Timestamp.from(syncedAt), accountId);
        if (updated == 0) {
            log.warn("markSynced matched no account row for {}", accountId);
        } else {
            log.info("Account {} last_sync_at set to {}", accountId, syncedAt);
        }
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
