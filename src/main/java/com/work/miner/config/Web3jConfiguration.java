package com.work.miner.config;

import com.work.miner.chain.ChainConnector;
import com.work.miner.chain.web3j.Web3jChainConnector;
import com.work.miner.service.nonce.NonceSequencer;
import com.work.miner.signer.LiabilitySigner;
import com.work.miner.support.NodeIdProvider;
import com.work.miner.signer.web3j.Web3jLiabilitySigner;
import com.work.miner.swap.SwapConnector;
import com.work.miner.swap.web3j.Web3jSwapConnector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean
    public Web3j web3j(ChainProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public ChainConnector web3jChainConnector(Web3j web3j, ChainProperties chain, MinerProperties props) {
        return new Web3jChainConnector(web3j, chain.getFactory(), props.getToken());
    }

    /**
     * 挖矿账户的私钥，地址必须与 miner.account 一致。
     */
    @Bean
    public Credentials minerCredentials(ChainProperties chain, MinerProperties props) {
        if (chain.getPrivateKey() == null || chain.getPrivateKey().trim().isEmpty()) {
            throw new IllegalStateException("chain.private-key 未配置，web3j 模式无法签名");
        }
        Credentials credentials = Credentials.create(chain.getPrivateKey().trim());
        if (!credentials.getAddress().equalsIgnoreCase(props.getAccount())) {
            throw new IllegalStateException("miner.account " + props.getAccount()
                    + " 与私钥地址 " + credentials.getAddress() + " 不一致");
        }
        return credentials;
    }

    @Bean
    public LiabilitySigner web3jLiabilitySigner(Credentials credentials, ChainProperties chain, MinerProperties props) {
        return new Web3jLiabilitySigner(credentials, chain.getChainId(), props.getLighthouse(), props.getToken(),
                chain.getCreateGasLimit(), chain.getFinalizeGasLimit(), chain.getApproveGasLimit(),
                chain.getRefillGasLimit());
    }

    @Bean
    public SwapConnector web3jSwapConnector(Web3j web3j, NonceSequencer sequencer, NodeIdProvider nodeIdProvider,
                                            Credentials credentials, ChainProperties chain, MinerProperties props,
                                            Clock clock) {
        return new Web3jSwapConnector(web3j, sequencer, nodeIdProvider.getNodeId(), credentials, chain.getChainId(),
                chain.getRouter(), props.getToken(), chain.getWeth(), chain.getApproveGasLimit(),
                chain.getSwapGasLimit(), chain.getSwapPriorityFee(), clock);
    }
}
