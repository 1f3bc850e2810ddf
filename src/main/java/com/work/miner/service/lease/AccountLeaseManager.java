package com.work.miner.service.lease;

import com.work.miner.domain.LeaseDecision;
import com.work.miner.exception.LeaseNotOwnedException;
import com.work.miner.support.metrics.MinerMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static com.work.miner.support.ValidationUtils.requireNonEmpty;
import static com.work.miner.support.ValidationUtils.requirePositive;

/**
 * 账户级 lease + fencing 的执行权管理（单进程内存版）。
 *
 * 同一账户同一时刻只有一个 owner 可以分配 nonce；过期后由其他 owner 接管时 fencingToken 递增，
 * 旧 owner 持有的 token 随即失效。
 */
public class AccountLeaseManager {

    private static class LeaseRecord {
        String owner;
        long fencingToken;
        Instant expiresAt;
    }

    private final Clock clock;
    private final Duration leaseDuration;
    private final MinerMetrics metrics;
    private final Map<String, LeaseRecord> leases = new HashMap<>();

    public AccountLeaseManager(Clock clock, Duration leaseDuration, MinerMetrics metrics) {
        this.clock = clock;
        this.leaseDuration = requirePositive(leaseDuration, "leaseDuration");
        this.metrics = metrics;
    }

    public synchronized LeaseDecision acquireOrRenew(String account, String owner) {
        requireNonEmpty(account, "account");
        requireNonEmpty(owner, "owner");

        Instant now = clock.instant();
        Instant newExpiresAt = now.plus(leaseDuration);
        String key = account.toLowerCase();
        LeaseRecord cur = leases.get(key);

        if (cur == null) {
            cur = new LeaseRecord();
            cur.owner = owner;
            cur.fencingToken = 1L;
            cur.expiresAt = newExpiresAt;
            leases.put(key, cur);
            metrics.leaseAcquire("insert");
            return new LeaseDecision(account, owner, true, cur.fencingToken, newExpiresAt);
        }

        boolean expired = !cur.expiresAt.isAfter(now);

        if (owner.equals(cur.owner) && !expired) {
            cur.expiresAt = newExpiresAt;
            metrics.leaseAcquire("renew");
            return new LeaseDecision(account, owner, true, cur.fencingToken, newExpiresAt);
        }

        if (expired) {
            cur.owner = owner;
            cur.fencingToken++;
            cur.expiresAt = newExpiresAt;
            metrics.leaseAcquire("takeover");
            return new LeaseDecision(account, owner, true, cur.fencingToken, newExpiresAt);
        }

        // not leader
        metrics.leaseAcquire("not_leader");
        return new LeaseDecision(account, cur.owner, false, cur.fencingToken, cur.expiresAt);
    }

    /**
     * 校验 lease 仍有效：owner 与 token 都必须匹配且未过期。
     */
    public synchronized void verify(LeaseDecision lease) {
        if (lease == null || !lease.isLeader()) {
            throw new LeaseNotOwnedException("lease not held");
        }
        LeaseRecord cur = leases.get(lease.getAccount().toLowerCase());
        if (cur == null
                || !cur.owner.equals(lease.getOwner())
                || cur.fencingToken != lease.getFencingToken()
                || !cur.expiresAt.isAfter(clock.instant())) {
            throw new LeaseNotOwnedException("stale lease for " + lease.getAccount()
                    + " owner=" + lease.getOwner() + " token=" + lease.getFencingToken());
        }
    }

    public synchronized void release(LeaseDecision lease) {
        if (lease == null || !lease.isLeader()) {
            return;
        }
        LeaseRecord cur = leases.get(lease.getAccount().toLowerCase());
        if (cur != null && cur.owner.equals(lease.getOwner()) && cur.fencingToken == lease.getFencingToken()) {
            // 保留 token，使下一个 owner 的 token 继续递增
            cur.expiresAt = clock.instant();
        }
    }
}
