package com.guildpool.blockchain.service;

import com.guildpool.blockchain.service.BlockchainRewardTokenService.BlockchainTxResult;
import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.external.InMemoryRewardPool;
import com.guildpool.core.external.RewardPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reward pool whose ledger is kept locally and whose payouts and burns are mirrored
 * to the reward token contract when the blockchain is enabled.
 *
 * <p>The ledger is applied first and stays authoritative. A failed on-chain mirror is logged
 * and does not roll the ledger back.
 */
@Service
@Primary
public class OnChainRewardPool implements RewardPool {

    private static final Logger log = LoggerFactory.getLogger(OnChainRewardPool.class);

    private final InMemoryRewardPool ledger;
    private final BlockchainRewardTokenService tokenService;

    public OnChainRewardPool(InMemoryRewardPool ledger, BlockchainRewardTokenService tokenService) {
        this.ledger = Objects.requireNonNull(ledger, "Ledger cannot be null");
        this.tokenService = Objects.requireNonNull(tokenService, "Token service cannot be null");
    }

    public void mint(ActivityKey activity, long round, BigInteger amount) {
        ledger.mint(activity, round, amount);
    }

    @Override
    public BigInteger totalServiceReward(ActivityKey activity, long round) {
        return ledger.totalServiceReward(activity, round);
    }

    @Override
    public void payout(ActivityKey activity, long round, List<Payout> payouts) {
        ledger.payout(activity, round, payouts);
        if (!tokenService.isEnabled()) {
            return;
        }
        for (Payout payout : payouts) {
            Optional<BlockchainTxResult> result = tokenService.transfer(payout.recipient(), payout.amount());
            report(result, "transfer of " + payout.amount() + " to " + payout.recipient(), activity, round);
        }
    }

    @Override
    public void burn(ActivityKey activity, long round, BigInteger amount) {
        ledger.burn(activity, round, amount);
        if (tokenService.isEnabled()) {
            report(tokenService.burn(amount), "burn of " + amount, activity, round);
        }
    }

    public BigInteger heldBalance(ActivityKey activity) {
        return ledger.heldBalance(activity);
    }

    public BigInteger balanceOf(Address account) {
        return ledger.balanceOf(account);
    }

    public BigInteger totalBurned(ActivityKey activity) {
        return ledger.totalBurned(activity);
    }

    /**
     * Token balance read from the chain, empty while the blockchain is disabled or unreachable.
     */
    public Optional<BigInteger> onChainBalanceOf(Address account) {
        return tokenService.balanceOf(account);
    }

    public boolean isMirroring() {
        return tokenService.isEnabled();
    }

    private void report(Optional<BlockchainTxResult> result, String operation, ActivityKey activity, long round) {
        if (result.isEmpty()) {
            log.warn("On-chain {} for {} round {} was not sent; ledger already updated", operation, activity, round);
        } else if (!result.get().success()) {
            log.warn("On-chain {} for {} round {} reverted in tx {}",
                    operation, activity, round, result.get().txHash());
        } else {
            log.info("Mirrored {} for {} round {} in tx {}", operation, activity, round, result.get().txHash());
        }
    }
}
