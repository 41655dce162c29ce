package com.sharedmodel.blockchain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

/**
 * Node, signing key and gas terms for paying escrow out on chain.
 * The private key belongs to the account that holds the escrowed deposits.
 */
@Configuration
@ConfigurationProperties(prefix = "sharedmodel.blockchain")
public class PayoutChainConfig {

    private boolean enabled = false;
    private String nodeUrl = "http://localhost:8545";
    private String privateKey;
    private long chainId = 1337L;
    private BigInteger gasPriceWei = BigInteger.valueOf(20_000_000_000L); // 20 Gwei
    private BigInteger gasLimit = BigInteger.valueOf(21_000L);           // plain value transfer

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getNodeUrl() { return nodeUrl; }
    public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public long getChainId() { return chainId; }
    public void setChainId(long chainId) { this.chainId = chainId; }
    public BigInteger getGasPriceWei() { return gasPriceWei; }
    public void setGasPriceWei(BigInteger gasPriceWei) { this.gasPriceWei = gasPriceWei; }
    public BigInteger getGasLimit() { return gasLimit; }
    public void setGasLimit(BigInteger gasLimit) { this.gasLimit = gasLimit; }
}
