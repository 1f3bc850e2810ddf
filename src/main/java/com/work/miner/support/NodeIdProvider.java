package com.work.miner.support;

/**
 * 提供进程稳定标识，用作账户租约的 owner 与日志标记。
 */
public interface NodeIdProvider {
    String getNodeId();
}
