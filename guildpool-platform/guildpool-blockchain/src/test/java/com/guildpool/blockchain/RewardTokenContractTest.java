package com.guildpool.blockchain;

import com.guildpool.blockchain.contract.RewardTokenContract;
import net.jqwik.api.*;
import net.jqwik.api.constraints.BigRange;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * ABI encoding of the reward token calls.
 */
class RewardTokenContractTest {

    private static final String RECIPIENT = "0x00000000000000000000000000000000000000b1";

    @Test
    void functionSelectorsMatchErc20() {
        assertThat(FunctionEncoder.encode(RewardTokenContract.transferFunction(RECIPIENT, BigInteger.ONE)))
                .startsWith("0xa9059cbb");
        assertThat(FunctionEncoder.encode(RewardTokenContract.balanceOfFunction(RECIPIENT)))
                .startsWith("0x70a08231");
        assertThat(FunctionEncoder.encode(RewardTokenContract.burnFunction(BigInteger.ONE)))
                .startsWith("0x42966c68");
    }

    @Property(tries = 100)
    void transferEncodesRecipientAndAmountAsWords(
            @ForAll @BigRange(min = "0", max = "1000000000000000000000000") BigInteger amount) {
        String encoded = FunctionEncoder.encode(RewardTokenContract.transferFunction(RECIPIENT, amount));
        String arguments = encoded.substring("0xa9059cbb".length());

        assertThat(arguments).hasSize(128);
        assertThat(arguments.substring(0, 64)).endsWith(Numeric.cleanHexPrefix(RECIPIENT));
        assertThat(Numeric.toBigInt(arguments.substring(64))).isEqualTo(amount);
    }
}
