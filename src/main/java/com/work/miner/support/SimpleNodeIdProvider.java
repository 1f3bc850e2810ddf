package com.work.miner.support;

import java.net.InetAddress;
import java.util.UUID;

/**
 * 默认 nodeId 生成方式：hostname + JVM 随机后缀。
 */
public class SimpleNodeIdProvider implements NodeIdProvider {

    private final String nodeId;

    public SimpleNodeIdProvider() {
        this.nodeId = buildNodeId();
    }

    @Override
    public String getNodeId() {
        return nodeId;
    }

    private String buildNodeId() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        try {
            return "miner-" + InetAddress.getLocalHost().getHostName() + "-" + suffix;
        } catch (Exception e) {
            return "miner-unknown-" + suffix;
        }
    }
}
