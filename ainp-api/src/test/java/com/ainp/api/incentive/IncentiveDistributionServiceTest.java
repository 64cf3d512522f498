package com.ainp.api.incentive;

import com.ainp.api.AinpApiApplication;
import com.ainp.api.common.ValidationException;
import com.ainp.api.config.MutableClock;
import com.ainp.api.config.TestClockConfiguration;
import com.ainp.api.credit.CreditLedgerService;
import com.ainp.api.incentive.IncentiveDistributionService.DistributionParams;
import com.ainp.api.incentive.IncentiveDistributionService.DistributionResult;
import com.ainp.api.incentive.IncentiveDistributionService.UsefulnessRecipient;
import com.ainp.api.incentive.IncentiveDistributionService.UsefulnessRewardResult;
import com.ainp.core.domain.CreditTransaction;
import com.ainp.core.domain.CreditTransaction.TransactionType;
import com.ainp.core.domain.IncentiveSplit;
import com.ainp.core.repository.AgentUsefulnessRepository;
import com.ainp.core.repository.CreditAccountRepository;
import com.ainp.core.repository.CreditTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest(classes = AinpApiApplication.class)
@Import(TestClockConfiguration.class)
@ActiveProfiles("test")
class IncentiveDistributionServiceTest {

    private static final String AGENT = "did:ainp:worker";
    private static final String BROKER = "did:ainp:test-broker";
    private static final String VALIDATOR = "did:ainp:validator";

    @Autowired
    private IncentiveDistributionService distributionService;

    @Autowired
    private UsefulnessScoreService usefulnessScoreService;

    @Autowired
    private CreditLedgerService ledger;

    @Autowired
    private AgentUsefulnessRepository usefulnessRepository;

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
        usefulnessRepository.deleteAll();
        clock.reset();
    }

    @Test
    void distribute_defaultSplitCreditsAgentBrokerAndValidator() {
        DistributionResult result = distributionService.distribute(new DistributionParams(
                "intent-d", 100_000, AGENT, BROKER, VALIDATOR, IncentiveSplit.DEFAULT, "proof-42"));

        assertThat(result.distributed().agent()).isEqualTo(70_000);
        assertThat(result.distributed().broker()).isEqualTo(10_000);
        assertThat(result.distributed().validator()).isEqualTo(10_000);
        assertThat(result.distributed().pool()).isEqualTo(10_000);

        assertThat(ledger.getAccount(AGENT).orElseThrow().earned()).isEqualTo(70_000);
        assertThat(ledger.getAccount(BROKER).orElseThrow().earned()).isEqualTo(10_000);
        assertThat(ledger.getAccount(VALIDATOR).orElseThrow().earned()).isEqualTo(10_000);

        List<CreditTransaction> earns = transactionRepository.findByIntentIdOrderByIdAsc("intent-d");
        assertThat(earns).extracting(CreditTransaction::getTxType).containsOnly(TransactionType.EARN);
        assertThat(earns).extracting(CreditTransaction::getAgentDid).containsExactly(AGENT, BROKER, VALIDATOR);
        assertThat(earns.get(0).getUsefulnessProofId()).isEqualTo("proof-42");
        assertThat(earns.get(1).getUsefulnessProofId()).isNull();
    }

    @Test
    void distribute_withoutValidatorLeavesValidatorShareUnpaid() {
        DistributionResult result = distributionService.distribute(new DistributionParams(
                "intent-nv", 1_000, AGENT, BROKER, null, IncentiveSplit.DEFAULT, null));

        assertThat(result.distributed().validator()).isEqualTo(100);
        assertThat(result.recipients().validatorDid()).isNull();
        assertThat(transactionRepository.findByIntentIdOrderByIdAsc("intent-nv"))
                .extracting(CreditTransaction::getAgentDid)
                .containsExactly(AGENT, BROKER);
    }

    @Test
    void distribute_rejectsInvalidSplitWithoutCreditingAnyone() {
        IncentiveSplit invalid = new IncentiveSplit(0.5, 0.2, 0.1, 0.1);

        assertThatThrownBy(() -> distributionService.distribute(new DistributionParams(
                "intent-x", 1_000, AGENT, BROKER, VALIDATOR, invalid, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid incentive split");

        assertThat(transactionRepository.count()).isZero();
    }

    @Test
    void distribute_rejectsMissingAgentAndNegativeTotal() {
        assertThatThrownBy(() -> distributionService.distribute(new DistributionParams(
                "intent-x", 1_000, " ", BROKER, null, IncentiveSplit.DEFAULT, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> distributionService.distribute(new DistributionParams(
                "intent-x", -1, AGENT, BROKER, null, IncentiveSplit.DEFAULT, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void usefulnessRewards_areProportionalToScore() {
        usefulnessScoreService.recordScore("did:ainp:high", 30.0);
        usefulnessScoreService.recordScore("did:ainp:low", 10.0);
        usefulnessScoreService.recordScore("did:ainp:below", 5.0);

        UsefulnessRewardResult result = distributionService.distributeUsefulnessRewards(1_000, 10.0);

        assertThat(result.totalDistributed()).isEqualTo(1_000);
        assertThat(result.recipients())
                .extracting(UsefulnessRecipient::agentDid, UsefulnessRecipient::amount)
                .containsExactly(
                        tuple("did:ainp:high", 750L),
                        tuple("did:ainp:low", 250L));
        assertThat(ledger.getAccount("did:ainp:below")).isEmpty();
        assertThat(transactionRepository.findByAgentDidAndTxTypeOrderByIdAsc("did:ainp:high", TransactionType.EARN))
                .extracting(CreditTransaction::getIntentId)
                .containsExactly(IncentiveDistributionService.USEFULNESS_REWARD_INTENT);
    }

    @Test
    void usefulnessRewards_floorEachShareAndSkipZeroAmounts() {
        usefulnessScoreService.recordScore("did:ainp:a", 50.0);
        usefulnessScoreService.recordScore("did:ainp:b", 25.0);
        usefulnessScoreService.recordScore("did:ainp:c", 25.0);

        UsefulnessRewardResult result = distributionService.distributeUsefulnessRewards(3, 10.0);

        // 1.5 -> 1, 0.75 -> 0, 0.75 -> 0
        assertThat(result.totalDistributed()).isEqualTo(1);
        assertThat(result.recipients()).extracting(UsefulnessRecipient::agentDid).containsExactly("did:ainp:a");
    }

    @Test
    void usefulnessRewards_withNobodyEligibleDistributesNothing() {
        usefulnessScoreService.recordScore("did:ainp:idle", 2.0);

        UsefulnessRewardResult result = distributionService.distributeUsefulnessRewards(1_000, 10.0);

        assertThat(result.totalDistributed()).isZero();
        assertThat(result.recipients()).isEmpty();
        assertThat(transactionRepository.count()).isZero();
    }

    @Test
    void recordScore_clampsAndCountsProofs() {
        usefulnessScoreService.recordScore("did:ainp:a", 140.0);
        var dto = usefulnessScoreService.recordScore("did:ainp:a", -3.0);

        assertThat(dto.usefulnessScore()).isZero();
        assertThat(dto.totalProofs()).isEqualTo(2);
        assertThat(usefulnessScoreService.getScore("did:ainp:unknown")).isEmpty();
    }
}
