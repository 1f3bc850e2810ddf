package com.work.miner.swap.web3j;

import com.work.miner.domain.LeaseDecision;
import com.work.miner.exception.LeaseNotOwnedException;
import com.work.miner.exception.NonceConflictException;
import com.work.miner.exception.SlippageExceededException;
import com.work.miner.exception.TransportException;
import com.work.miner.exception.TransportTimeoutException;
import com.work.miner.service.nonce.NonceReservation;
import com.work.miner.service.nonce.NonceSequencer;
import com.work.miner.service.nonce.SubmitOutcome;
import com.work.miner.signer.SignedTransaction;
import com.work.miner.signer.TxFees;
import com.work.miner.swap.SwapConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 基于 Uniswap V2 router 的兑换实现：
 * - 报价：getAmountsOut(amountIn, [token, weth])
 * - 出售：allowance 不足时先 approve(router, amountIn)，再 swapExactTokensForETH(amountIn, minOut, path, self, deadline)
 *
 * 出售交易与 liability 交易共用一个账户，nonce 统一经 {@link NonceSequencer} 分配。
 */
public class Web3jSwapConnector implements SwapConnector {

    private static final Logger log = LoggerFactory.getLogger(Web3jSwapConnector.class);

    private final Web3j web3j;
    private final NonceSequencer sequencer;
    private final String ownerId;
    private final Credentials credentials;
    private final long chainId;
    private final String router;
    private final String token;
    private final String weth;
    private final BigInteger approveGasLimit;
    private final BigInteger swapGasLimit;
    private final BigInteger priorityFee;
    private final Clock clock;

    public Web3jSwapConnector(Web3j web3j, NonceSequencer sequencer, String ownerId, Credentials credentials,
                              long chainId, String router, String token, String weth, BigInteger approveGasLimit,
                              BigInteger swapGasLimit, BigInteger priorityFee, Clock clock) {
        this.web3j = web3j;
        this.sequencer = sequencer;
        this.ownerId = ownerId;
        this.credentials = credentials;
        this.chainId = chainId;
        this.router = router;
        this.token = token;
        this.weth = weth;
        this.approveGasLimit = approveGasLimit;
        this.swapGasLimit = swapGasLimit;
        this.priorityFee = priorityFee;
        this.clock = clock;
    }

    @Override
    @SuppressWarnings("unchecked")
    public BigInteger quote(BigInteger amountIn) {
        Function fn = new Function("getAmountsOut",
                Arrays.<Type>asList(new Uint256(amountIn), path()),
                Collections.<TypeReference<?>>singletonList(new TypeReference<DynamicArray<Uint256>>() {
                }));
        List<Type> out = call(router, fn);
        List<Uint256> amounts = ((DynamicArray<Uint256>) out.get(0)).getValue();
        return amounts.get(amounts.size() - 1).getValue();
    }

    @Override
    public BigInteger swap(BigInteger amountIn, double slippageTolerance, Duration deadline) {
        BigInteger expected = quote(amountIn);
        BigInteger minOut = new BigDecimal(expected)
                .multiply(BigDecimal.valueOf(1.0 - slippageTolerance))
                .toBigInteger();
        String self = credentials.getAddress();
        boolean needsApprove = allowance(self).compareTo(amountIn) < 0;
        TxFees fees = TxFees.of(gasPrice(), priorityFee);
        long deadlineTs = clock.instant().plus(deadline).getEpochSecond();

        List<SubmitOutcome> outcomes;
        try {
            LeaseDecision lease = sequencer.acquire(ownerId);
            NonceReservation reservation = sequencer.reserve(lease, needsApprove ? 2 : 1);
            List<SignedTransaction> txs = new ArrayList<>(2);
            int i = 0;
            if (needsApprove) {
                Function approve = new Function("approve",
                        Arrays.<Type>asList(new Address(router), new Uint256(amountIn)),
                        Collections.<TypeReference<?>>emptyList());
                txs.add(sign(reservation.nonceAt(i++), token, approveGasLimit, FunctionEncoder.encode(approve), fees));
            }
            Function swap = new Function("swapExactTokensForETH",
                    Arrays.<Type>asList(new Uint256(amountIn), new Uint256(minOut), path(), new Address(self),
                            new Uint256(BigInteger.valueOf(deadlineTs))),
                    Collections.<TypeReference<?>>emptyList());
            txs.add(sign(reservation.nonceAt(i), router, swapGasLimit, FunctionEncoder.encode(swap), fees));

            log.info("swapping amount={} expected={} minOut={} approve={}", amountIn, expected, minOut, needsApprove);
            outcomes = sequencer.submitBatch(lease, txs);
        } catch (LeaseNotOwnedException | NonceConflictException e) {
            throw new TransportException("nonce ledger unavailable for swap: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("swap interrupted", e);
        }

        SubmitOutcome last = outcomes.get(outcomes.size() - 1);
        switch (last.getStatus()) {
            case INCLUDED:
                if (!last.getReceipt().isSuccess()) {
                    throw new SlippageExceededException("swapExactTokensForETH reverted tx=" + last.getTxHash()
                            + " minOut=" + minOut);
                }
                log.info("swap included tx={} block={}", last.getTxHash(), last.getReceipt().getBlockNumber());
                return expected;
            case PENDING:
                log.warn("swap tx {} not confirmed in time, balance kept for next check", last.getTxHash());
                throw new TransportTimeoutException("swap tx " + last.getTxHash() + " still pending");
            case TRANSPORT_FAILED:
            default:
                throw new TransportException("swap broadcast failed: " + last.getError());
        }
    }

    private BigInteger allowance(String owner) {
        Function fn = new Function("allowance",
                Arrays.<Type>asList(new Address(owner), new Address(router)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Uint256>() {
                }));
        return ((Uint256) call(token, fn).get(0)).getValue();
    }

    private BigInteger gasPrice() {
        try {
            return web3j.ethGasPrice().send().getGasPrice();
        } catch (IOException e) {
            throw new TransportException("eth_gasPrice failed", e);
        }
    }

    private DynamicArray<Address> path() {
        return new DynamicArray<>(Address.class, new Address(token), new Address(weth));
    }

    private List<Type> call(String contract, Function fn) {
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(null, contract, FunctionEncoder.encode(fn)),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw new TransportException(fn.getName() + " reverted: " + resp.getError().getMessage());
            }
            return FunctionReturnDecoder.decode(resp.getValue(), fn.getOutputParameters());
        } catch (IOException e) {
            log.warn("Web3j {} failed. contract={} err={}", fn.getName(), contract, e.getMessage());
            throw new TransportException(fn.getName() + " failed", e);
        }
    }

    private SignedTransaction sign(long nonce, String to, BigInteger gasLimit, String data, TxFees fees) {
        RawTransaction raw = RawTransaction.createTransaction(chainId, BigInteger.valueOf(nonce), gasLimit,
                to, BigInteger.ZERO, data, fees.getMaxPriorityFeePerGas(), fees.getMaxFeePerGas());
        String hex = Numeric.toHexString(TransactionEncoder.signMessage(raw, chainId, credentials));
        return new SignedTransaction(nonce, hex, Hash.sha3(hex));
    }
}
