package com.sharedmodel.api.config;

import com.sharedmodel.api.classifier.MajorityLabelClassifier;
import com.sharedmodel.blockchain.service.PayoutChainConfig;
import com.sharedmodel.blockchain.service.Web3jValueTransfer;
import com.sharedmodel.core.access.OwnershipGate;
import com.sharedmodel.core.commitment.ContributionCommitment;
import com.sharedmodel.core.commitment.Int64VectorCodec;
import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.event.ContributionEventSink;
import com.sharedmodel.core.incentive.IncentiveTerms;
import com.sharedmodel.core.incentive.StakingIncentiveEngine;
import com.sharedmodel.core.ledger.ContributionLedger;
import com.sharedmodel.core.trainer.Classifier;
import com.sharedmodel.core.trainer.CollaborativeTrainer;
import com.sharedmodel.core.trainer.InMemoryValueTransfer;
import com.sharedmodel.core.trainer.ValueTransfer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires ledger, incentive engine, classifier and payouts into one trainer for
 * {@code long[]} feature vectors.
 */
@Configuration
public class TrainerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TrainerConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ContributionLedger contributionLedger(IncentiveProperties properties) {
        return new ContributionLedger(new OwnershipGate("ledger", trainerAddress(properties)));
    }

    @Bean
    public StakingIncentiveEngine<long[]> incentiveEngine(IncentiveProperties properties, Clock clock) {
        IncentiveTerms terms = new IncentiveTerms(
                properties.getCostWeight(),
                properties.getRefundWaitTimeSeconds(),
                properties.getOwnerClaimWaitTimeSeconds(),
                properties.getAnyAddressClaimWaitTimeSeconds());
        log.info("Incentive terms: {}", terms);
        return new StakingIncentiveEngine<>(
                new OwnershipGate("incentive engine", trainerAddress(properties)),
                Address.of(properties.getOwnerAddress()),
                terms,
                clock.instant().getEpochSecond());
    }

    @Bean
    public Classifier<long[]> classifier() {
        return new MajorityLabelClassifier();
    }

    @Bean
    public ValueTransfer valueTransfer(PayoutChainConfig chainConfig) {
        if (chainConfig.isEnabled()) {
            return new Web3jValueTransfer(chainConfig);
        }
        log.info("Blockchain payouts disabled, crediting in-memory balances");
        return new InMemoryValueTransfer();
    }

    @Bean
    public ContributionEventSink<long[]> contributionEventSink(ApplicationEventPublisher publisher) {
        return publisher::publishEvent;
    }

    @Bean
    public CollaborativeTrainer<long[]> collaborativeTrainer(IncentiveProperties properties,
                                                            ContributionLedger ledger,
                                                            StakingIncentiveEngine<long[]> engine,
                                                            Classifier<long[]> classifier,
                                                            ValueTransfer valueTransfer,
                                                            ContributionEventSink<long[]> events) {
        Int64VectorCodec codec = properties.getSampleLength() > 0
                ? Int64VectorCodec.ofLength(properties.getSampleLength())
                : Int64VectorCodec.anyLength();
        return new CollaborativeTrainer<>(trainerAddress(properties), ledger, engine, classifier,
                new ContributionCommitment<>(codec), valueTransfer, events);
    }

    private static Address trainerAddress(IncentiveProperties properties) {
        return Address.of(properties.getTrainerAddress());
    }
}
