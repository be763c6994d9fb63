package com.flagship.savings_loan.ledger;

import com.flagship.savings_loan.money.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store for loan and savings transactions.
 *
 * Enforces:
 * 1. Entries are only ever inserted, never updated or deleted
 * 2. Appends join the caller's transaction, so a ledger row exists exactly when
 *    the balance change that produced it was committed
 * 3. History is returned in insertion order (database sequence), oldest first
 *
 * Uses JDBC directly; the ledger tables have no JPA mapping.
 */
@Service
@Slf4j
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends an entry to a loan's ledger.
     *
     * Must run inside the transaction that changes the loan's cached balance.
     *
     * @return the entry with its database-assigned timestamp and sequence number
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LoanTransaction appendLoanTransaction(LoanTransaction transaction) {
        LoanTransaction recorded = jdbcTemplate.queryForObject(
            "INSERT INTO loan_transactions (id, loan_id, amount, transaction_type, description, transaction_date, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP) RETURNING created_at, sequence_number",
            (rs, rowNum) -> transaction.recorded(
                rs.getTimestamp("created_at").toInstant(),
                rs.getLong("sequence_number")),
            transaction.getId(),
            transaction.getLoanId(),
            transaction.getAmount().getAmount(),
            transaction.getType().name(),
            transaction.getDescription(),
            transaction.getTransactionDate()
        );
        log.debug("Appended loan transaction: loanId={}, type={}, amount={}",
            transaction.getLoanId(), transaction.getType(), transaction.getAmount());
        return recorded;
    }

    /**
     * Appends an entry to a member's savings ledger.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public SavingsTransaction appendSavingsTransaction(SavingsTransaction transaction) {
        SavingsTransaction recorded = jdbcTemplate.queryForObject(
            "INSERT INTO savings_transactions (id, member_id, amount, transaction_type, description, transaction_date, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP) RETURNING created_at, sequence_number",
            (rs, rowNum) -> transaction.recorded(
                rs.getTimestamp("created_at").toInstant(),
                rs.getLong("sequence_number")),
            transaction.getId(),
            transaction.getMemberId(),
            transaction.getAmount().getAmount(),
            transaction.getType().name(),
            transaction.getDescription(),
            transaction.getTransactionDate()
        );
        log.debug("Appended savings transaction: memberId={}, type={}, amount={}",
            transaction.getMemberId(), transaction.getType(), transaction.getAmount());
        return recorded;
    }

    @Transactional(readOnly = true)
    public List<LoanTransaction> getLoanTransactions(UUID loanId) {
        return jdbcTemplate.query(
            "SELECT id, loan_id, amount, transaction_type, description, transaction_date, created_at, sequence_number " +
            "FROM loan_transactions WHERE loan_id = ? ORDER BY sequence_number",
            loanTransactionRowMapper(),
            loanId
        );
    }

    @Transactional(readOnly = true)
    public List<SavingsTransaction> getSavingsTransactions(UUID memberId) {
        return jdbcTemplate.query(
            "SELECT id, member_id, amount, transaction_type, description, transaction_date, created_at, sequence_number " +
            "FROM savings_transactions WHERE member_id = ? ORDER BY sequence_number",
            savingsTransactionRowMapper(),
            memberId
        );
    }

    private RowMapper<LoanTransaction> loanTransactionRowMapper() {
        return (rs, rowNum) -> new LoanTransaction(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("loan_id")),
            Money.of(rs.getBigDecimal("amount")),
            LoanTransactionType.valueOf(rs.getString("transaction_type")),
            rs.getString("description"),
            rs.getDate("transaction_date").toLocalDate(),
            rs.getTimestamp("created_at").toInstant(),
            sequenceNumber(rs)
        );
    }

    private RowMapper<SavingsTransaction> savingsTransactionRowMapper() {
        return (rs, rowNum) -> new SavingsTransaction(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("member_id")),
            Money.of(rs.getBigDecimal("amount")),
            SavingsTransactionType.valueOf(rs.getString("transaction_type")),
            rs.getString("description"),
            rs.getDate("transaction_date").toLocalDate(),
            rs.getTimestamp("created_at").toInstant(),
            sequenceNumber(rs)
        );
    }

    private static Long sequenceNumber(ResultSet rs) throws SQLException {
        return rs.getLong("sequence_number");
    }
}
