package com.ainp.api.credit;

import com.ainp.api.common.ValidationException;
import com.ainp.core.domain.CreditAccount;
import com.ainp.core.domain.CreditTransaction;
import com.ainp.core.domain.CreditTransaction.TransactionType;
import com.ainp.core.repository.CreditAccountRepository;
import com.ainp.core.repository.CreditTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Credit ledger: per-agent balances in atomic units plus an append-only transaction log.
 *
 * Every mutation locks the account row for its read-check-write and writes the
 * balance change and its log entry in one transaction, so balance >= reserved >= 0 holds
 * under concurrent callers.
 */
@Service
public class CreditLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CreditLedgerService.class);

    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int MAX_HISTORY_LIMIT = 1000;

    private final CreditAccountRepository accountRepository;
    private final CreditTransactionRepository transactionRepository;
    private final Clock clock;

    public CreditLedgerService(
            CreditAccountRepository accountRepository,
            CreditTransactionRepository transactionRepository,
            Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<CreditAccountDto> getAccount(String agentDid) {
        return accountRepository.findById(agentDid).map(CreditAccountDto::from);
    }

    /**
     * Available balance (balance minus reserved); 0 for unknown agents.
     */
    @Transactional(readOnly = true)
    public long getBalance(String agentDid) {
        return accountRepository.findById(agentDid)
                .map(CreditAccount::getAvailable)
                .orElse(0L);
    }

    /**
     * Creates the account if absent. An existing account is returned unchanged, also when
     * another caller creates it concurrently.
     */
    @Transactional
    public CreditAccountDto createAccount(String agentDid, long initialBalance) {
        requireDid(agentDid);
        requireNonNegative(initialBalance, "initial_balance");

        Instant now = Instant.now(clock);
        if (accountRepository.insertIfAbsent(agentDid, initialBalance, now) == 1) {
            if (initialBalance > 0) {
                appendTransaction(agentDid, TransactionType.DEPOSIT, initialBalance, null, null,
                        Map.of("source", "initial_balance"), now);
            }
            log.info("Created credit account {} with initial balance {}", agentDid, initialBalance);
        }
        return accountRepository.findById(agentDid)
                .map(CreditAccountDto::from)
                .orElseThrow(() -> new AccountNotFoundException(agentDid));
    }

    @Transactional
    public CreditAccountDto reserve(String agentDid, long amount, String intentId) {
        requireNonNegative(amount, "amount");
        CreditAccount account = lockExisting(agentDid);

        if (account.getAvailable() < amount) {
            throw new InsufficientCreditsException(agentDid, amount, account.getAvailable());
        }

        Instant now = Instant.now(clock);
        account.reserve(amount, now);
        appendTransaction(agentDid, TransactionType.RESERVE, amount, intentId, null, null, now);
        log.debug("Reserved {} units for {} (intent {})", amount, agentDid, intentId);
        return CreditAccountDto.from(accountRepository.save(account));
    }

    /**
     * Releases a reservation, debiting {@code spentAmount} of it and returning the rest to available.
     */
    @Transactional
    public CreditAccountDto release(String agentDid, long reservedAmount, long spentAmount, String intentId) {
        requireNonNegative(reservedAmount, "reserved_amount");
        requireNonNegative(spentAmount, "spent_amount");
        if (spentAmount > reservedAmount) {
            throw new ValidationException("Cannot spend more than reserved: spent "
                    + spentAmount + ", reserved " + reservedAmount);
        }

        CreditAccount account = lockExisting(agentDid);
        if (reservedAmount > account.getReserved()) {
            throw new ValidationException("Cannot release " + reservedAmount
                    + " units, only " + account.getReserved() + " reserved for " + agentDid);
        }

        Instant now = Instant.now(clock);
        account.release(reservedAmount, spentAmount, now);
        appendTransaction(agentDid, TransactionType.RELEASE, reservedAmount, intentId, null,
                Map.of("spent", spentAmount), now);
        if (spentAmount > 0) {
            appendTransaction(agentDid, TransactionType.SPEND, spentAmount, intentId, null, null, now);
        }
        log.info("Released {} reserved units for {} (spent {}, intent {})",
                reservedAmount, agentDid, spentAmount, intentId);
        return CreditAccountDto.from(accountRepository.save(account));
    }

    @Transactional
    public CreditAccountDto deposit(String agentDid, long amount, Map<String, Object> metadata) {
        requireNonNegative(amount, "amount");
        Instant now = Instant.now(clock);
        CreditAccount account = lockOrCreate(agentDid, now);

        account.deposit(amount, now);
        appendTransaction(agentDid, TransactionType.DEPOSIT, amount, null, null, metadata, now);
        log.debug("Deposited {} units to {}", amount, agentDid);
        return CreditAccountDto.from(accountRepository.save(account));
    }

    @Transactional
    public CreditAccountDto earn(String agentDid, long amount, String intentId, String usefulnessProofId) {
        requireNonNegative(amount, "amount");
        Instant now = Instant.now(clock);
        CreditAccount account = lockOrCreate(agentDid, now);

        account.earn(amount, now);
        appendTransaction(agentDid, TransactionType.EARN, amount, intentId, usefulnessProofId, null, now);
        log.debug("Credited {} earned units to {} (intent {})", amount, agentDid, intentId);
        return CreditAccountDto.from(accountRepository.save(account));
    }

    /**
     * Immediate spend from available funds. Reserved funds cannot be spent this way.
     */
    @Transactional
    public CreditAccountDto spend(String agentDid, long amount, String intentId, String reason) {
        requireNonNegative(amount, "amount");
        CreditAccount account = lockExisting(agentDid);

        if (account.getAvailable() < amount) {
            throw new InsufficientCreditsException(agentDid, amount, account.getAvailable());
        }

        Instant now = Instant.now(clock);
        account.spend(amount, now);
        Map<String, Object> metadata = reason == null ? null : Map.of("reason", reason);
        appendTransaction(agentDid, TransactionType.SPEND, amount, intentId, null, metadata, now);
        log.debug("Spent {} units from {} (intent {})", amount, agentDid, intentId);
        return CreditAccountDto.from(accountRepository.save(account));
    }

    /**
     * Newest first.
     */
    @Transactional(readOnly = true)
    public List<CreditTransactionDto> getTransactionHistory(String agentDid, int limit, int offset) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        if (offset < 0) {
            throw new ValidationException("offset must be non-negative");
        }
        return transactionRepository.findHistory(agentDid, limit, offset).stream()
                .map(CreditTransactionDto::from)
                .toList();
    }

    private CreditAccount lockExisting(String agentDid) {
        return accountRepository.findForUpdate(agentDid)
                .orElseThrow(() -> new AccountNotFoundException(agentDid));
    }

    private CreditAccount lockOrCreate(String agentDid, Instant now) {
        requireDid(agentDid);
        Optional<CreditAccount> existing = accountRepository.findForUpdate(agentDid);
        if (existing.isPresent()) {
            return existing.get();
        }
        if (accountRepository.insertIfAbsent(agentDid, 0L, now) == 1) {
            log.info("Created credit account {} on first credit", agentDid);
        }
        return lockExisting(agentDid);
    }

    private void appendTransaction(
            String agentDid,
            TransactionType type,
            long amount,
            String intentId,
            String usefulnessProofId,
            Map<String, Object> metadata,
            Instant now) {
        transactionRepository.save(CreditTransaction.create(
                agentDid, type, amount, intentId, usefulnessProofId, metadata, now));
    }

    private static void requireNonNegative(long amount, String field) {
        if (amount < 0) {
            throw new ValidationException(field + " must be non-negative");
        }
    }

    private static void requireDid(String agentDid) {
        if (agentDid == null || agentDid.isBlank()) {
            throw new ValidationException("agent_did is required");
        }
    }

    public record CreditAccountDto(
            String agentDid,
            long balance,
            long reserved,
            long available,
            long earned,
            long spent,
            Instant createdAt,
            Instant updatedAt
    ) {
        static CreditAccountDto from(CreditAccount account) {
            return new CreditAccountDto(
                    account.getAgentDid(),
                    account.getBalance(),
                    account.getReserved(),
                    account.getAvailable(),
                    account.getEarned(),
                    account.getSpent(),
                    account.getCreatedAt(),
                    account.getUpdatedAt()
            );
        }
    }

    public record CreditTransactionDto(
            Long id,
            String agentDid,
            TransactionType txType,
            long amount,
            String intentId,
            String usefulnessProofId,
            Map<String, Object> metadata,
            Instant createdAt
    ) {
        static CreditTransactionDto from(CreditTransaction tx) {
            return new CreditTransactionDto(
                    tx.getId(),
                    tx.getAgentDid(),
                    tx.getTxType(),
                    tx.getAmount(),
                    tx.getIntentId(),
                    tx.getUsefulnessProofId(),
                    new LinkedHashMap<>(tx.getMetadata()),
                    tx.getCreatedAt()
            );
        }
    }
}
