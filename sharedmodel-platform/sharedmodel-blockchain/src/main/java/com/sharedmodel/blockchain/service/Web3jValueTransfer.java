package com.sharedmodel.blockchain.service;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.trainer.ValueTransfer;
import com.sharedmodel.core.trainer.ValueTransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.Transfer;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Pays refunds, rewards and submission change in wei from the trainer's escrow account.
 */
public class Web3jValueTransfer implements ValueTransfer {

    private static final Logger log = LoggerFactory.getLogger(Web3jValueTransfer.class);
    private final PayoutChainConfig config;
    private Web3j web3j;
    private Transfer transfer;

    public Web3jValueTransfer(PayoutChainConfig config) {
        this.config = config;
        if (config.isEnabled()) {
            initializeTransfer();
        }
    }

    private void initializeTransfer() {
        try {
            this.web3j = Web3j.build(new HttpService(config.getNodeUrl()));
            Credentials credentials = Credentials.create(config.getPrivateKey());
            this.transfer = new Transfer(web3j, new RawTransactionManager(web3j, credentials, config.getChainId()));
            log.info("Escrow payouts enabled from {} via {}", credentials.getAddress(), config.getNodeUrl());
        } catch (Exception e) {
            log.error("Failed to initialize escrow payouts", e);
        }
    }

    /**
     * Sends {@code amount} wei to {@code to}.
     *
     * @return the transaction hash
     */
    @Override
    public String transfer(Address to, BigInteger amount) {
        if (!isEnabled()) {
            throw new ValueTransferException("Blockchain payouts are not available");
        }
        TransactionReceipt receipt;
        try {
            receipt = transfer.sendFunds(
                    to.value(),
                    new BigDecimal(amount),
                    Convert.Unit.WEI,
                    config.getGasPriceWei(),
                    config.getGasLimit()).send();
        } catch (Exception e) {
            log.error("Failed to pay {} wei to {}", amount, to, e);
            throw new ValueTransferException("Payout of " + amount + " wei to " + to + " failed", e);
        }
        if (!receipt.isStatusOK()) {
            log.error("Payout of {} wei to {} reverted in {}", amount, to, receipt.getTransactionHash());
            throw new ValueTransferException("Payout transaction " + receipt.getTransactionHash() + " reverted");
        }
        log.info("Paid {} wei to {} in {}", amount, to.toChecksum(), receipt.getTransactionHash());
        return receipt.getTransactionHash();
    }

    public boolean isEnabled() {
        return config.isEnabled() && transfer != null;
    }

    public void shutdown() {
        if (web3j != null) {
            web3j.shutdown();
        }
    }
}
