package com.guildpool.api.config;

import com.guildpool.core.distrust.DistrustLedger;
import com.guildpool.core.external.GovernanceSource;
import com.guildpool.core.external.GroupLifecycle;
import com.guildpool.core.external.InMemoryGovernanceLedger;
import com.guildpool.core.external.InMemoryGroupRegistry;
import com.guildpool.core.external.InMemoryRewardPool;
import com.guildpool.core.external.RewardPool;
import com.guildpool.core.membership.MembershipIndex;
import com.guildpool.core.reward.RecipientRegistry;
import com.guildpool.core.reward.RewardDistributor;
import com.guildpool.core.reward.ServiceEnrollment;
import com.guildpool.core.round.ManualRoundClock;
import com.guildpool.core.round.RoundClock;
import com.guildpool.core.verification.GroupVerification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the core engine. Group lifecycle, governance and pool minting are simulated in memory
 * and driven through the admin endpoints.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public ManualRoundClock roundClock(GuildpoolProperties properties) {
        log.info("Starting round clock at round {}", properties.getInitialRound());
        return new ManualRoundClock(properties.getInitialRound());
    }

    @Bean
    public InMemoryGroupRegistry groupRegistry(RoundClock roundClock) {
        return new InMemoryGroupRegistry(roundClock);
    }

    @Bean
    public InMemoryGovernanceLedger governanceLedger() {
        return new InMemoryGovernanceLedger();
    }

    /**
     * Local reward ledger. The {@code OnChainRewardPool} wraps it and is the primary {@link RewardPool}.
     */
    @Bean
    public InMemoryRewardPool rewardLedger() {
        return new InMemoryRewardPool();
    }

    @Bean
    public MembershipIndex membershipIndex(GroupLifecycle groupLifecycle, RoundClock roundClock) {
        return new MembershipIndex(groupLifecycle, roundClock);
    }

    @Bean
    public GroupVerification groupVerification(GroupLifecycle groupLifecycle, MembershipIndex membershipIndex,
                                               RoundClock roundClock) {
        return new GroupVerification(groupLifecycle, membershipIndex, roundClock);
    }

    @Bean
    public DistrustLedger distrustLedger(GovernanceSource governanceSource, GroupVerification groupVerification,
                                         RoundClock roundClock) {
        return new DistrustLedger(governanceSource, groupVerification, roundClock);
    }

    @Bean
    public RecipientRegistry recipientRegistry(GroupLifecycle groupLifecycle, RoundClock roundClock,
                                               GuildpoolProperties properties) {
        return new RecipientRegistry(groupLifecycle, roundClock, properties.getMaxRecipients());
    }

    @Bean
    public ServiceEnrollment serviceEnrollment(GroupLifecycle groupLifecycle, RoundClock roundClock) {
        return new ServiceEnrollment(groupLifecycle, roundClock);
    }

    @Bean
    public RewardDistributor rewardDistributor(RoundClock roundClock,
                                               GroupVerification groupVerification,
                                               DistrustLedger distrustLedger,
                                               RecipientRegistry recipientRegistry,
                                               ServiceEnrollment serviceEnrollment,
                                               RewardPool rewardPool) {
        return new RewardDistributor(roundClock, groupVerification, distrustLedger,
                recipientRegistry, serviceEnrollment, rewardPool);
    }
}
