package com.guildpool.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * Reward token held by the pool - Web3j wrapper.
 *
 * Solidity equivalent (ERC-20 with burnable extension):
 * contract GuildpoolRewardToken is ERC20, ERC20Burnable {
 *     function transfer(address to, uint256 amount) public returns (bool);
 *     function burn(uint256 amount) public;
 *     function balanceOf(address account) public view returns (uint256);
 *
 *     event Transfer(address indexed from, address indexed to, uint256 value);
 * }
 */
public class RewardTokenContract extends Contract {

    /**
     * The token is deployed separately. Use {@link #load} with the deployed address.
     */
    public static final String BINARY = "";

    public static final String FUNC_TRANSFER = "transfer";
    public static final String FUNC_BURN = "burn";
    public static final String FUNC_BALANCEOF = "balanceOf";

    protected RewardTokenContract(String contractAddress, Web3j web3j, Credentials credentials,
                                  ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Transfers tokens from the pool holder to a recipient.
     */
    public RemoteFunctionCall<TransactionReceipt> transfer(String to, BigInteger amount) {
        return executeRemoteCallTransaction(transferFunction(to, amount));
    }

    /**
     * Destroys tokens held by the pool holder.
     */
    public RemoteFunctionCall<TransactionReceipt> burn(BigInteger amount) {
        return executeRemoteCallTransaction(burnFunction(amount));
    }

    public RemoteFunctionCall<BigInteger> balanceOf(String account) {
        return executeRemoteCallSingleValueReturn(balanceOfFunction(account), BigInteger.class);
    }

    public static Function transferFunction(String to, BigInteger amount) {
        return new Function(
                FUNC_TRANSFER,
                Arrays.asList(new Address(to), new Uint256(amount)),
                Collections.emptyList());
    }

    public static Function burnFunction(BigInteger amount) {
        return new Function(
                FUNC_BURN,
                Arrays.asList(new Uint256(amount)),
                Collections.emptyList());
    }

    public static Function balanceOfFunction(String account) {
        return new Function(
                FUNC_BALANCEOF,
                Arrays.asList(new Address(account)),
                Arrays.asList(new TypeReference<Uint256>() {}));
    }

    /**
     * Loads an existing token contract at the given address.
     */
    public static RewardTokenContract load(String contractAddress, Web3j web3j,
                                           Credentials credentials, ContractGasProvider gasProvider) {
        return new RewardTokenContract(contractAddress, web3j, credentials, gasProvider);
    }
}
