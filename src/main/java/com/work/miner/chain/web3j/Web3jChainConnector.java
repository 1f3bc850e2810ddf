package com.work.miner.chain.web3j;

import com.work.miner.chain.ChainConnector;
import com.work.miner.chain.LighthouseState;
import com.work.miner.chain.TxReceipt;
import com.work.miner.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 基于 Web3j 的链端口实现：
 * - 交易：eth_getTransactionCount(pending) / eth_sendRawTransaction / eth_getTransactionReceipt
 * - 合约只读：factory.gasPrice() / nonceOf()，lighthouse 的 marker、quota、keepAliveBlock 等，token.balanceOf()
 * - receipt 日志：factory 的 NewLiability(address) 与 token 的 Transfer
 */
public class Web3jChainConnector implements ChainConnector {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainConnector.class);

    static final String NEW_LIABILITY_TOPIC = Hash.sha3String("NewLiability(address)");
    static final String TRANSFER_TOPIC = Hash.sha3String("Transfer(address,address,uint256)");

    private final Web3j web3j;
    private final String factory;
    private final String token;

    public Web3jChainConnector(Web3j web3j, String factory, String token) {
        this.web3j = web3j;
        this.factory = factory;
        this.token = token;
    }

    @Override
    public long getPendingNonce(String account) {
        try {
            return web3j.ethGetTransactionCount(account, DefaultBlockParameterName.PENDING).send()
                    .getTransactionCount().longValue();
        } catch (IOException e) {
            throw new TransportException("eth_getTransactionCount failed", e);
        }
    }

    @Override
    public long getConfirmedNonce(String account) {
        try {
            return web3j.ethGetTransactionCount(account, DefaultBlockParameterName.LATEST).send()
                    .getTransactionCount().longValue();
        } catch (IOException e) {
            throw new TransportException("eth_getTransactionCount failed", e);
        }
    }

    @Override
    public String sendRawTransaction(String signedTransaction) {
        try {
            EthSendTransaction resp = web3j.ethSendRawTransaction(signedTransaction).send();
            if (resp.hasError()) {
                throw new TransportException("eth_sendRawTransaction rejected: " + resp.getError().getMessage());
            }
            return resp.getTransactionHash();
        } catch (IOException e) {
            log.warn("Web3j sendRawTransaction failed. err={}", e.getMessage());
            throw new TransportException("eth_sendRawTransaction failed", e);
        }
    }

    @Override
    public TxReceipt getTransactionReceipt(String txHash) {
        try {
            EthGetTransactionReceipt resp = web3j.ethGetTransactionReceipt(txHash).send();
            Optional<org.web3j.protocol.core.methods.response.TransactionReceipt> receiptOpt = resp.getTransactionReceipt();
            if (!receiptOpt.isPresent()) {
                return null;
            }
            org.web3j.protocol.core.methods.response.TransactionReceipt r = receiptOpt.get();
            BigInteger effective = r.getEffectiveGasPrice() == null
                    ? BigInteger.ZERO : Numeric.decodeQuantity(r.getEffectiveGasPrice());
            return new TxReceipt(txHash, r.getBlockNumber().longValue(), r.getBlockHash(), r.isStatusOK(),
                    r.getGasUsed().longValue(), effective, findLiability(r.getLogs()), sumMinted(r.getLogs()));
        } catch (IOException e) {
            log.warn("Web3j getTransactionReceipt failed. txHash={} err={}", txHash, e.getMessage());
            throw new TransportException("eth_getTransactionReceipt failed", e);
        }
    }

    @Override
    public long getLatestBlockNumber() {
        try {
            return web3j.ethBlockNumber().send().getBlockNumber().longValue();
        } catch (IOException e) {
            throw new TransportException("eth_blockNumber failed", e);
        }
    }

    @Override
    public BigInteger getGasPrice() {
        try {
            return web3j.ethGasPrice().send().getGasPrice();
        } catch (IOException e) {
            throw new TransportException("eth_gasPrice failed", e);
        }
    }

    @Override
    public BigInteger getAuthoritativeSmma() {
        return callUint(factory, "gasPrice");
    }

    @Override
    public LighthouseState getLighthouseState(String lighthouse, String provider) {
        Address who = new Address(provider);
        return new LighthouseState(lighthouse,
                callUint(lighthouse, "marker").longValue(),
                callUint(lighthouse, "quota").longValue(),
                callUint(lighthouse, "timeoutInBlocks").longValue(),
                callUint(lighthouse, "keepAliveBlock").longValue(),
                callUint(lighthouse, "minimalStake"),
                callUint(lighthouse, "indexOf", who).longValue(),
                callUint(lighthouse, "stakes", who));
    }

    @Override
    public BigInteger getTokenBalance(String account) {
        return callUint(token, "balanceOf", new Address(account));
    }

    @Override
    public BigInteger getAllowance(String owner, String spender) {
        return callUint(token, "allowance", new Address(owner), new Address(spender));
    }

    @Override
    public BigInteger getMessageNonce(String account) {
        return callUint(factory, "nonceOf", new Address(account));
    }

    private BigInteger callUint(String contract, String name, Type... args) {
        Function fn = new Function(name,
                args.length == 0 ? Collections.<Type>emptyList() : Arrays.asList(args),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Uint256>() {
                }));
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(null, contract, FunctionEncoder.encode(fn)),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw new TransportException(name + "() reverted: " + resp.getError().getMessage());
            }
            List<Type> out = FunctionReturnDecoder.decode(resp.getValue(), fn.getOutputParameters());
            if (out.isEmpty()) {
                throw new TransportException(name + "() returned no data from " + contract);
            }
            return ((Uint256) out.get(0)).getValue();
        } catch (IOException e) {
            throw new TransportException("eth_call " + name + " failed", e);
        }
    }

    private String findLiability(List<Log> logs) {
        for (Log l : logs) {
            List<String> topics = l.getTopics();
            if (l.getAddress() != null && l.getAddress().equalsIgnoreCase(factory)
                    && topics.size() >= 2 && NEW_LIABILITY_TOPIC.equalsIgnoreCase(topics.get(0))) {
                // indexed address：topic 的低 20 字节
                return "0x" + topics.get(1).substring(topics.get(1).length() - 40);
            }
        }
        return null;
    }

    private BigInteger sumMinted(List<Log> logs) {
        BigInteger total = BigInteger.ZERO;
        for (Log l : logs) {
            List<String> topics = l.getTopics();
            if (l.getAddress() != null && l.getAddress().equalsIgnoreCase(token)
                    && topics.size() >= 3 && TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0))) {
                total = total.add(Numeric.toBigInt(l.getData()));
            }
        }
        return total;
    }
}
