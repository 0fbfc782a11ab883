package com.guildpool.blockchain.service;

import com.guildpool.blockchain.contract.RewardTokenContract;
import com.guildpool.core.domain.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Service for interacting with the reward token contract.
 * Every call is a no-op returning empty while the blockchain is disabled.
 */
@Service
public class BlockchainRewardTokenService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainRewardTokenService.class);
    private final BlockchainConfig config;
    private RewardTokenContract contract;
    private Web3j web3j;

    public BlockchainRewardTokenService(BlockchainConfig config) {
        this.config = config;
        if (config.isEnabled()) {
            initializeContract();
        }
    }

    private void initializeContract() {
        try {
            this.web3j = Web3j.build(new HttpService(config.getNodeUrl()));
            Credentials credentials = Credentials.create(config.getPrivateKey());
            StaticGasProvider gasProvider = new StaticGasProvider(
                    BigInteger.valueOf(config.getGasPrice()),
                    BigInteger.valueOf(config.getGasLimit()));
            this.contract = RewardTokenContract.load(
                    config.getRewardTokenAddress(), web3j, credentials, gasProvider);
            log.info("Reward token contract initialized at {}", config.getRewardTokenAddress());
        } catch (Exception e) {
            log.error("Failed to initialize reward token contract", e);
        }
    }

    /**
     * Transfers reward tokens from the pool holder to a recipient.
     */
    public Optional<BlockchainTxResult> transfer(Address recipient, BigInteger amount) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.transfer(recipient.value(), amount).send();
            return Optional.of(toResult(receipt));
        } catch (Exception e) {
            log.error("Failed to transfer {} reward tokens to {}", amount, recipient, e);
            return Optional.empty();
        }
    }

    /**
     * Burns reward tokens held by the pool holder.
     */
    public Optional<BlockchainTxResult> burn(BigInteger amount) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.burn(amount).send();
            return Optional.of(toResult(receipt));
        } catch (Exception e) {
            log.error("Failed to burn {} reward tokens", amount, e);
            return Optional.empty();
        }
    }

    public Optional<BigInteger> balanceOf(Address account) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(contract.balanceOf(account.value()).send());
        } catch (Exception e) {
            log.error("Failed to read reward token balance of {}", account, e);
            return Optional.empty();
        }
    }

    public boolean isEnabled() {
        return config.isEnabled() && contract != null;
    }

    private BlockchainTxResult toResult(TransactionReceipt receipt) {
        return new BlockchainTxResult(
                receipt.getTransactionHash(),
                receipt.getBlockNumber(),
                receipt.isStatusOK());
    }

    public record BlockchainTxResult(String txHash, BigInteger blockNumber, boolean success) {}
}
