package com.work.miner.chain;

import com.work.miner.exception.TransportException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内存链：用于 mock 模式与测试。
 *
 * 每笔交易在广播时立即打包进新区块；扣留 receipt 期间交易停留在内存池，恢复后按广播顺序打包。
 * createLiability/finalizeLiability 会按
 * smma' = (smma×(P-1) + effectiveGasPrice) / P 推进权威 SMMA，finalize 按
 * gas × smma × 1e9 / auctionFinalPrice 铸币。
 */
public class MockChainConnector implements ChainConnector {

    public static final long CREATE_GAS = 790_000L;
    public static final long FINALIZE_GAS = 268_000L;
    public static final long APPROVE_GAS = 46_000L;
    public static final long REFILL_GAS = 90_000L;

    private static final BigInteger GWEI = BigInteger.valueOf(1_000_000_000L);

    private final Object lock = new Object();

    private final Map<String, Long> pendingNonce = new HashMap<>();
    private final Map<String, Long> confirmedNonce = new HashMap<>();
    private final Map<String, TxReceipt> receipts = new HashMap<>();
    private final List<String> mempool = new ArrayList<>();
    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Map<String, BigInteger> allowances = new HashMap<>();
    private final Map<String, BigInteger> deposits = new HashMap<>();
    private final Map<String, BigInteger> messageNonces = new HashMap<>();
    private final Map<String, Long> providers = new HashMap<>();
    private final Map<String, Long> liabilityGas = new HashMap<>();
    private final Set<String> finalized = new HashSet<>();

    private long blockNumber = 1;
    private long liabilityCounter = 0;
    private BigInteger baseFee;
    private BigInteger smma;
    private final int smmaPeriod;
    private final BigInteger auctionFinalPrice;

    private long marker = 0;
    private long quota;
    private long timeoutBlocks;
    private long keepAliveBlock = 0;
    private BigInteger stakeMinimum = BigInteger.ONE;

    private boolean receiptsWithheld;
    private int failNextSends;
    private int revertNextCreates;
    private int revertNextFinalizes;
    private long sendCount;
    private long liabilitiesFinalized;

    public MockChainConnector(BigInteger baseFee, BigInteger initialSmma, int smmaPeriod,
                              BigInteger auctionFinalPrice, long quota, long timeoutBlocks) {
        this.baseFee = baseFee;
        this.smma = initialSmma;
        this.smmaPeriod = smmaPeriod;
        this.auctionFinalPrice = auctionFinalPrice;
        this.quota = quota;
        this.timeoutBlocks = timeoutBlocks;
    }

    /**
     * 默认参数：base fee 1 gwei，SMMA 1.03 gwei，P=1000，quota 40。
     */
    public static MockChainConnector withDefaults() {
        return new MockChainConnector(GWEI, BigInteger.valueOf(1_030_000_000L), 1000,
                BigInteger.valueOf(1_000_000_000_000_000L), 40, 1);
    }

    @Override
    public long getPendingNonce(String account) {
        synchronized (lock) {
            return pendingNonce.getOrDefault(key(account), 0L);
        }
    }

    @Override
    public long getConfirmedNonce(String account) {
        synchronized (lock) {
            return confirmedNonce.getOrDefault(key(account), 0L);
        }
    }

    @Override
    public String sendRawTransaction(String signedTransaction) {
        synchronized (lock) {
            sendCount++;
            if (failNextSends > 0) {
                failNextSends--;
                throw new TransportException("mock transport failure");
            }
            MockTransactionCodec.MockTransaction tx = MockTransactionCodec.decode(signedTransaction);
            String from = key(tx.getFrom());
            long expected = pendingNonce.getOrDefault(from, 0L);
            if (tx.getNonce() < expected) {
                throw new TransportException("nonce too low: " + tx.getNonce() + " < " + expected);
            }
            pendingNonce.put(from, Math.max(expected, tx.getNonce() + 1));

            if (receiptsWithheld) {
                mempool.add(signedTransaction);
            } else {
                mine(signedTransaction);
            }
            return MockTransactionCodec.hashOf(signedTransaction);
        }
    }

    private void mine(String signedTransaction) {
        MockTransactionCodec.MockTransaction tx = MockTransactionCodec.decode(signedTransaction);
        String from = key(tx.getFrom());
        String txHash = MockTransactionCodec.hashOf(signedTransaction);
        long bn = ++blockNumber;
        BigInteger effective = tx.getMaxFeePerGas().min(baseFee.add(tx.getMaxPriorityFeePerGas()));
        confirmedNonce.put(from, Math.max(confirmedNonce.getOrDefault(from, 0L), tx.getNonce() + 1));

        TxReceipt receipt;
        if (MockTransactionCodec.CREATE.equals(tx.getKind())) {
            keepAliveBlock = bn;
            receipt = mineCreate(txHash, bn, from, effective);
        } else if (MockTransactionCodec.FINALIZE.equals(tx.getKind())) {
            keepAliveBlock = bn;
            receipt = mineFinalize(txHash, bn, from, tx.getRef(), effective);
        } else if (MockTransactionCodec.APPROVE.equals(tx.getKind())) {
            receipt = mineApprove(txHash, bn, from, tx.getRef(), effective);
        } else {
            receipt = mineRefill(txHash, bn, from, tx.getRef(), effective);
        }
        receipts.put(txHash, receipt);
    }

    private TxReceipt mineCreate(String txHash, long bn, String from, BigInteger effective) {
        if (revertNextCreates > 0) {
            revertNextCreates--;
            return new TxReceipt(txHash, bn, "block_" + bn, false, CREATE_GAS / 2, effective, null, BigInteger.ZERO);
        }
        updateSmma(effective);
        messageNonces.merge(from, BigInteger.valueOf(2), BigInteger::add);
        String liability = String.format("0x%040x", ++liabilityCounter + 0xA000L);
        liabilityGas.put(liability, CREATE_GAS);
        return new TxReceipt(txHash, bn, "block_" + bn, true, CREATE_GAS, effective, liability, BigInteger.ZERO);
    }

    private TxReceipt mineFinalize(String txHash, long bn, String from, String liability, BigInteger effective) {
        String liabilityKey = key(liability);
        if (revertNextFinalizes > 0 || !liabilityGas.containsKey(liabilityKey) || finalized.contains(liabilityKey)) {
            if (revertNextFinalizes > 0) {
                revertNextFinalizes--;
            }
            return new TxReceipt(txHash, bn, "block_" + bn, false, FINALIZE_GAS / 2, effective, null, BigInteger.ZERO);
        }
        updateSmma(effective);
        finalized.add(liabilityKey);
        liabilitiesFinalized++;
        long gas = liabilityGas.get(liabilityKey) + FINALIZE_GAS;
        BigInteger minted = BigInteger.valueOf(gas).multiply(smma).multiply(GWEI).divide(auctionFinalPrice);
        balances.merge(from, minted, BigInteger::add);
        return new TxReceipt(txHash, bn, "block_" + bn, true, FINALIZE_GAS, effective, null, minted);
    }

    private TxReceipt mineApprove(String txHash, long bn, String from, String ref, BigInteger effective) {
        String[] parts = ref.split(":");
        allowances.put(from + ">" + key(parts[0]), new BigInteger(parts[1]));
        return new TxReceipt(txHash, bn, "block_" + bn, true, APPROVE_GAS, effective, null, BigInteger.ZERO);
    }

    /**
     * lighthouse.refill：从余额转入质押，消耗 allowance；quota 随质押上调。
     */
    private TxReceipt mineRefill(String txHash, long bn, String from, String ref, BigInteger effective) {
        String[] parts = ref.split(":");
        String allowanceKey = from + ">" + key(parts[0]);
        BigInteger amount = new BigInteger(parts[1]);
        BigInteger balance = balances.getOrDefault(from, BigInteger.ZERO);
        BigInteger allowance = allowances.getOrDefault(allowanceKey, BigInteger.ZERO);
        if (balance.compareTo(amount) < 0 || allowance.compareTo(amount) < 0) {
            return new TxReceipt(txHash, bn, "block_" + bn, false, REFILL_GAS / 2, effective, null, BigInteger.ZERO);
        }
        balances.put(from, balance.subtract(amount));
        allowances.put(allowanceKey, allowance.subtract(amount));
        BigInteger stake = stakeOf(from).add(amount);
        deposits.put(from, stake);
        if (!providers.containsKey(from)) {
            providers.put(from, (long) providers.size() + 1);
        }
        quota = Math.max(quota, stake.divide(stakeMinimum).longValue());
        return new TxReceipt(txHash, bn, "block_" + bn, true, REFILL_GAS, effective, null, BigInteger.ZERO);
    }

    /**
     * 已注册的 provider 至少持有 quota × minimalStake。
     */
    private BigInteger stakeOf(String provider) {
        BigInteger deposited = deposits.getOrDefault(provider, BigInteger.ZERO);
        if (!providers.containsKey(provider)) {
            return deposited;
        }
        return deposited.max(stakeMinimum.multiply(BigInteger.valueOf(quota)));
    }

    private void updateSmma(BigInteger effective) {
        BigInteger p = BigInteger.valueOf(smmaPeriod);
        smma = smma.multiply(p.subtract(BigInteger.ONE)).add(effective).divide(p);
    }

    @Override
    public TxReceipt getTransactionReceipt(String txHash) {
        synchronized (lock) {
            return receipts.get(txHash);
        }
    }

    @Override
    public long getLatestBlockNumber() {
        synchronized (lock) {
            return blockNumber;
        }
    }

    @Override
    public BigInteger getGasPrice() {
        synchronized (lock) {
            return baseFee;
        }
    }

    @Override
    public BigInteger getAuthoritativeSmma() {
        synchronized (lock) {
            return smma;
        }
    }

    @Override
    public LighthouseState getLighthouseState(String lighthouse, String provider) {
        synchronized (lock) {
            long index = providers.getOrDefault(key(provider), 0L);
            return new LighthouseState(lighthouse, marker, quota, timeoutBlocks, keepAliveBlock,
                    stakeMinimum, index, stakeOf(key(provider)));
        }
    }

    @Override
    public BigInteger getTokenBalance(String account) {
        synchronized (lock) {
            return balances.getOrDefault(key(account), BigInteger.ZERO);
        }
    }

    @Override
    public BigInteger getAllowance(String owner, String spender) {
        synchronized (lock) {
            return allowances.getOrDefault(key(owner) + ">" + key(spender), BigInteger.ZERO);
        }
    }

    @Override
    public BigInteger getMessageNonce(String account) {
        synchronized (lock) {
            return messageNonces.getOrDefault(key(account), BigInteger.ZERO);
        }
    }

    // ---- 模拟控制 ----

    public void registerProvider(String account, long index) {
        synchronized (lock) {
            providers.put(key(account), index);
        }
    }

    public void setMarker(long marker) {
        synchronized (lock) {
            this.marker = marker;
        }
    }

    public void setQuota(long quota) {
        synchronized (lock) {
            this.quota = quota;
        }
    }

    public void setTimeoutBlocks(long timeoutBlocks) {
        synchronized (lock) {
            this.timeoutBlocks = timeoutBlocks;
        }
    }

    public void setKeepAliveBlock(long keepAliveBlock) {
        synchronized (lock) {
            this.keepAliveBlock = keepAliveBlock;
        }
    }

    public void setBaseFee(BigInteger baseFee) {
        synchronized (lock) {
            this.baseFee = baseFee;
        }
    }

    public void setAuthoritativeSmma(BigInteger smma) {
        synchronized (lock) {
            this.smma = smma;
        }
    }

    public void mineEmptyBlocks(long count) {
        synchronized (lock) {
            blockNumber += count;
        }
    }

    public void setStakeMinimum(BigInteger stakeMinimum) {
        synchronized (lock) {
            this.stakeMinimum = stakeMinimum;
        }
    }

    public void creditTokens(String account, BigInteger amount) {
        synchronized (lock) {
            balances.merge(key(account), amount, BigInteger::add);
        }
    }

    /**
     * 外部写入者使用同一账户发送并打包了 count 笔交易（用于模拟 nonce 冲突）。
     */
    public void advanceNonceExternally(String account, long count) {
        synchronized (lock) {
            String k = key(account);
            long next = Math.max(pendingNonce.getOrDefault(k, 0L), confirmedNonce.getOrDefault(k, 0L)) + count;
            long confirmed = confirmedNonce.getOrDefault(k, 0L) + count;
            pendingNonce.put(k, next);
            confirmedNonce.put(k, confirmed);
            blockNumber++;
        }
    }

    /**
     * 扣留期间交易留在内存池；恢复时按广播顺序全部打包。
     */
    public void setReceiptsWithheld(boolean withheldReceipts) {
        synchronized (lock) {
            this.receiptsWithheld = withheldReceipts;
            if (!withheldReceipts) {
                List<String> queued = new ArrayList<>(mempool);
                mempool.clear();
                for (String raw : queued) {
                    mine(raw);
                }
            }
        }
    }

    /**
     * 内存池中的交易全部丢弃，pending nonce 回退到已打包的位置。
     */
    public void dropPendingTransactions() {
        synchronized (lock) {
            mempool.clear();
            pendingNonce.clear();
            pendingNonce.putAll(confirmedNonce);
        }
    }

    public void failNextSends(int count) {
        synchronized (lock) {
            this.failNextSends = count;
        }
    }

    public void revertNextCreates(int count) {
        synchronized (lock) {
            this.revertNextCreates = count;
        }
    }

    public void revertNextFinalizes(int count) {
        synchronized (lock) {
            this.revertNextFinalizes = count;
        }
    }

    public long getSendCount() {
        synchronized (lock) {
            return sendCount;
        }
    }

    public long getLiabilitiesCreated() {
        synchronized (lock) {
            return liabilityGas.size();
        }
    }

    public long getLiabilitiesFinalized() {
        synchronized (lock) {
            return liabilitiesFinalized;
        }
    }

    private static String key(String address) {
        return address == null ? "" : address.toLowerCase();
    }
}
