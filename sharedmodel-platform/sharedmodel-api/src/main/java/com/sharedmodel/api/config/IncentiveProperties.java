package com.sharedmodel.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

/**
 * Incentive terms and identities of the deployed trainer.
 * Wait times are in seconds.
 */
@Configuration
@ConfigurationProperties(prefix = "sharedmodel.incentive")
public class IncentiveProperties {

    private BigInteger costWeight = BigInteger.valueOf(1_000_000_000_000L);
    private long refundWaitTimeSeconds = 86_400L;          // 1 day
    private long ownerClaimWaitTimeSeconds = 604_800L;     // 7 days
    private long anyAddressClaimWaitTimeSeconds = 2_592_000L; // 30 days
    private String ownerAddress;
    private String trainerAddress;
    private int sampleLength = 0; // 0 accepts any length

    public BigInteger getCostWeight() { return costWeight; }
    public void setCostWeight(BigInteger costWeight) { this.costWeight = costWeight; }
    public long getRefundWaitTimeSeconds() { return refundWaitTimeSeconds; }
    public void setRefundWaitTimeSeconds(long seconds) { this.refundWaitTimeSeconds = seconds; }
    public long getOwnerClaimWaitTimeSeconds() { return ownerClaimWaitTimeSeconds; }
    public void setOwnerClaimWaitTimeSeconds(long seconds) { this.ownerClaimWaitTimeSeconds = seconds; }
    public long getAnyAddressClaimWaitTimeSeconds() { return anyAddressClaimWaitTimeSeconds; }
    public void setAnyAddressClaimWaitTimeSeconds(long seconds) { this.anyAddressClaimWaitTimeSeconds = seconds; }
    public String getOwnerAddress() { return ownerAddress; }
    public void setOwnerAddress(String ownerAddress) { this.ownerAddress = ownerAddress; }
    public String getTrainerAddress() { return trainerAddress; }
    public void setTrainerAddress(String trainerAddress) { this.trainerAddress = trainerAddress; }
    public int getSampleLength() { return sampleLength; }
    public void setSampleLength(int sampleLength) { this.sampleLength = sampleLength; }
}
