package com.ainp.api.credit;

import com.ainp.api.AinpApiApplication;
import com.ainp.api.common.ValidationException;
import com.ainp.api.config.MutableClock;
import com.ainp.api.config.TestClockConfiguration;
import com.ainp.api.credit.CreditLedgerService.CreditAccountDto;
import com.ainp.api.credit.CreditLedgerService.CreditTransactionDto;
import com.ainp.core.domain.CreditTransaction.TransactionType;
import com.ainp.core.repository.CreditAccountRepository;
import com.ainp.core.repository.CreditTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Credit ledger against the real persistence stack (H2 in PostgreSQL mode).
 */
@SpringBootTest(classes = AinpApiApplication.class)
@Import(TestClockConfiguration.class)
@ActiveProfiles("test")
class CreditLedgerServiceTest {

    private static final String AGENT = "did:ainp:ledger-agent";

    @Autowired
    private CreditLedgerService ledger;

    @Autowired
    private CreditAccountRepository accountRepository;

    @Autowired
    private CreditTransactionRepository transactionRepository;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        transactionRepository.deleteAll();
        accountRepository.deleteAll();
        clock.reset();
    }

    @Test
    void createAccount_isIdempotentAndLogsInitialDeposit() {
        CreditAccountDto first = ledger.createAccount(AGENT, 5_000);
        CreditAccountDto second = ledger.createAccount(AGENT, 99_999);

        assertThat(first.balance()).isEqualTo(5_000);
        assertThat(second.balance()).isEqualTo(5_000);

        List<CreditTransactionDto> history = ledger.getTransactionHistory(AGENT, 50, 0);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).txType()).isEqualTo(TransactionType.DEPOSIT);
        assertThat(history.get(0).metadata()).containsEntry("source", "initial_balance");
    }

    @Test
    void createAccount_withZeroBalanceLogsNothing() {
        ledger.createAccount(AGENT, 0);

        assertThat(ledger.getTransactionHistory(AGENT, 50, 0)).isEmpty();
        assertThat(ledger.getAccount(AGENT)).isPresent();
    }

    @Test
    void reserve_failsWhenAvailableIsShort() {
        ledger.createAccount(AGENT, 50);
        ledger.reserve(AGENT, 40, "intent-f");

        assertThatThrownBy(() -> ledger.reserve(AGENT, 20, "intent-f"))
                .isInstanceOfSatisfying(InsufficientCreditsException.class, e -> {
                    assertThat(e.getNeeded()).isEqualTo(20);
                    assertThat(e.getAvailable()).isEqualTo(10);
                });

        CreditAccountDto account = ledger.getAccount(AGENT).orElseThrow();
        assertThat(account.balance()).isEqualTo(50);
        assertThat(account.reserved()).isEqualTo(40);
    }

    @Test
    void reserve_onMissingAccountFails() {
        assertThatThrownBy(() -> ledger.reserve("did:ainp:nobody", 1, "intent"))
                .isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void reserveThenReleaseAsSpent_debitsExactlyTheReservation() {
        ledger.createAccount(AGENT, 10_000);
        ledger.reserve(AGENT, 3_000, "intent-1");

        CreditAccountDto released = ledger.release(AGENT, 3_000, 3_000, "intent-1");

        assertThat(released.reserved()).isZero();
        assertThat(released.balance()).isEqualTo(7_000);
        assertThat(released.spent()).isEqualTo(3_000);

        List<CreditTransactionDto> history = ledger.getTransactionHistory(AGENT, 50, 0);
        assertThat(history).extracting(CreditTransactionDto::txType)
                .containsExactly(TransactionType.SPEND, TransactionType.RELEASE,
                        TransactionType.RESERVE, TransactionType.DEPOSIT);
        CreditTransactionDto release = history.get(1);
        assertThat(((Number) release.metadata().get("spent")).longValue()).isEqualTo(3_000L);
        assertThat(release.intentId()).isEqualTo("intent-1");
    }

    @Test
    void releaseWithoutSpend_restoresAvailable() {
        ledger.createAccount(AGENT, 10_000);
        ledger.reserve(AGENT, 4_000, "intent-1");

        CreditAccountDto released = ledger.release(AGENT, 4_000, 0, "intent-1");

        assertThat(released.available()).isEqualTo(10_000);
        assertThat(transactionRepository.findByAgentDidAndTxTypeOrderByIdAsc(AGENT, TransactionType.SPEND)).isEmpty();
    }

    @Test
    void release_rejectsSpentAboveReservedAndOverRelease() {
        ledger.createAccount(AGENT, 10_000);
        ledger.reserve(AGENT, 1_000, "intent-1");

        assertThatThrownBy(() -> ledger.release(AGENT, 1_000, 1_001, "intent-1"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.release(AGENT, 2_000, 0, "intent-1"))
                .isInstanceOf(ValidationException.class);

        assertThat(ledger.getAccount(AGENT).orElseThrow().reserved()).isEqualTo(1_000);
    }

    @Test
    void depositAndEarn_createAccountLazily() {
        ledger.deposit("did:ainp:new-depositor", 500, Map.of("provider", "manual"));
        ledger.earn("did:ainp:new-earner", 700, "intent-9", "proof-1");

        assertThat(ledger.getAccount("did:ainp:new-depositor").orElseThrow().balance()).isEqualTo(500);
        CreditAccountDto earner = ledger.getAccount("did:ainp:new-earner").orElseThrow();
        assertThat(earner.balance()).isEqualTo(700);
        assertThat(earner.earned()).isEqualTo(700);

        CreditTransactionDto earn = ledger.getTransactionHistory("did:ainp:new-earner", 10, 0).get(0);
        assertThat(earn.txType()).isEqualTo(TransactionType.EARN);
        assertThat(earn.usefulnessProofId()).isEqualTo("proof-1");
    }

    @Test
    void spend_cannotConsumeReservedFunds() {
        ledger.createAccount(AGENT, 1_000);
        ledger.reserve(AGENT, 800, "intent-1");

        assertThatThrownBy(() -> ledger.spend(AGENT, 300, "intent-2", "api-call"))
                .isInstanceOf(InsufficientCreditsException.class);

        CreditAccountDto account = ledger.spend(AGENT, 200, "intent-2", "api-call");
        assertThat(account.balance()).isEqualTo(800);
        assertThat(account.reserved()).isEqualTo(800);
        assertThat(account.spent()).isEqualTo(200);
        assertThat(ledger.getTransactionHistory(AGENT, 1, 0).get(0).metadata()).containsEntry("reason", "api-call");
    }

    @Test
    void negativeAmounts_areRejected() {
        ledger.createAccount(AGENT, 1_000);

        assertThatThrownBy(() -> ledger.reserve(AGENT, -1, "intent")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.deposit(AGENT, -1, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.earn(AGENT, -1, "intent", null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.spend(AGENT, -1, "intent", null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void transactionHistory_isNewestFirstAndPaged() {
        ledger.createAccount(AGENT, 0);
        for (int i = 1; i <= 5; i++) {
            clock.advance(Duration.ofSeconds(1));
            ledger.deposit(AGENT, i * 100L, null);
        }

        List<CreditTransactionDto> page = ledger.getTransactionHistory(AGENT, 2, 1);

        assertThat(page).extracting(CreditTransactionDto::amount).containsExactly(400L, 300L);
        assertThatThrownBy(() -> ledger.getTransactionHistory(AGENT, 0, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.getTransactionHistory(AGENT, 10, -1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void getBalance_isAvailableAndZeroForUnknownAgent() {
        ledger.createAccount(AGENT, 1_000);
        ledger.reserve(AGENT, 250, "intent");

        assertThat(ledger.getBalance(AGENT)).isEqualTo(750);
        assertThat(ledger.getBalance("did:ainp:unknown")).isZero();
    }

    @Test
    void concurrentReservations_neverOverCommit() throws Exception {
        ledger.createAccount(AGENT, 5_000);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                String intent = "intent-" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        ledger.reserve(AGENT, 1_000, intent);
                        return true;
                    } catch (InsufficientCreditsException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    succeeded++;
                }
            }

            assertThat(succeeded).isEqualTo(5);
        } finally {
            executor.shutdownNow();
        }

        CreditAccountDto account = ledger.getAccount(AGENT).orElseThrow();
        assertThat(account.reserved()).isEqualTo(5_000);
        assertThat(account.balance()).isGreaterThanOrEqualTo(account.reserved());
        assertThat(transactionRepository.findByAgentDidAndTxTypeOrderByIdAsc(AGENT, TransactionType.RESERVE)).hasSize(5);
    }

    @Test
    void concurrentAccountCreation_createsOneAccountAndOneDeposit() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            for (int round = 0; round < 5; round++) {
                String did = "did:ainp:race-" + round;
                CountDownLatch start = new CountDownLatch(1);
                List<Future<Long>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    results.add(executor.submit(() -> {
                        start.await();
                        return ledger.createAccount(did, 100).balance();
                    }));
                }
                start.countDown();

                for (Future<Long> result : results) {
                    assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(100);
                }
                assertThat(ledger.getAccount(did).orElseThrow().balance()).isEqualTo(100);
                assertThat(transactionRepository.findByAgentDidAndTxTypeOrderByIdAsc(did, TransactionType.DEPOSIT))
                        .hasSize(1);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentFirstEarnings_allLandOnOneAccount() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                String intent = "intent-" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    ledger.earn(AGENT, 10, intent, null);
                    return true;
                }));
            }
            start.countDown();

            for (Future<Boolean> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            executor.shutdownNow();
        }

        CreditAccountDto account = ledger.getAccount(AGENT).orElseThrow();
        assertThat(account.balance()).isEqualTo(80);
        assertThat(account.earned()).isEqualTo(80);
        assertThat(transactionRepository.findByAgentDidAndTxTypeOrderByIdAsc(AGENT, TransactionType.EARN)).hasSize(threads);
    }
}
