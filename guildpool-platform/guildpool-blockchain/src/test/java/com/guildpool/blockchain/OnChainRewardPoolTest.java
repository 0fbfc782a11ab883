package com.guildpool.blockchain;

import com.guildpool.blockchain.service.BlockchainConfig;
import com.guildpool.blockchain.service.BlockchainRewardTokenService;
import com.guildpool.blockchain.service.OnChainRewardPool;
import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.external.InMemoryRewardPool;
import com.guildpool.core.external.RewardPool.Payout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OnChainRewardPoolTest {

    private static final ActivityKey ACTIVITY = ActivityKey.of("0x00000000000000000000000000000000000000aa", 1);
    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000000a1");
    private static final Address BOB = Address.of("0x00000000000000000000000000000000000000b0");

    private BlockchainRewardTokenService tokenService;
    private OnChainRewardPool pool;

    @BeforeEach
    void setUp() {
        tokenService = new BlockchainRewardTokenService(new BlockchainConfig());
        pool = new OnChainRewardPool(new InMemoryRewardPool(), tokenService);
    }

    @Test
    void disabledBlockchainKeepsLedgerOnly() {
        assertThat(tokenService.isEnabled()).isFalse();
        assertThat(pool.isMirroring()).isFalse();
        assertThat(tokenService.transfer(ALICE, BigInteger.TEN)).isEmpty();
        assertThat(tokenService.burn(BigInteger.TEN)).isEmpty();
        assertThat(pool.onChainBalanceOf(ALICE)).isEmpty();
    }

    @Test
    void payoutsAndBurnsUpdateTheLedger() {
        pool.mint(ACTIVITY, 1, BigInteger.valueOf(100));

        pool.payout(ACTIVITY, 1, List.of(
                new Payout(ALICE, BigInteger.valueOf(30)),
                new Payout(BOB, BigInteger.valueOf(20))));
        pool.burn(ACTIVITY, 1, BigInteger.valueOf(50));

        assertThat(pool.totalServiceReward(ACTIVITY, 1)).isEqualTo(BigInteger.valueOf(100));
        assertThat(pool.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(30));
        assertThat(pool.balanceOf(BOB)).isEqualTo(BigInteger.valueOf(20));
        assertThat(pool.totalBurned(ACTIVITY)).isEqualTo(BigInteger.valueOf(50));
        assertThat(pool.heldBalance(ACTIVITY)).isZero();
    }

    @Test
    void overdrawnBatchPaysNobody() {
        pool.mint(ACTIVITY, 1, BigInteger.valueOf(40));

        assertThatThrownBy(() -> pool.payout(ACTIVITY, 1, List.of(
                new Payout(ALICE, BigInteger.valueOf(30)),
                new Payout(BOB, BigInteger.valueOf(20)))))
                .isInstanceOfSatisfying(GuildpoolException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INSUFFICIENT_POOL_BALANCE));

        assertThat(pool.balanceOf(ALICE)).isZero();
        assertThat(pool.heldBalance(ACTIVITY)).isEqualTo(BigInteger.valueOf(40));
    }

    @Test
    void defaultsPointAtLocalNode() {
        BlockchainConfig config = new BlockchainConfig();

        assertThat(config.isEnabled()).isFalse();
        assertThat(config.getNodeUrl()).isEqualTo("http://localhost:8545");
        assertThat(config.getGasPrice()).isEqualTo(20_000_000_000L);
        assertThat(config.getGasLimit()).isEqualTo(6_721_975L);
    }
}
