package com.sharedmodel.core.trainer;

import com.sharedmodel.core.domain.Address;

import java.math.BigInteger;

/**
 * Moves value out of escrow to a participant. Called only after every ledger and engine
 * mutation for the payout has committed.
 */
public interface ValueTransfer {

    /**
     * @return an identifier of the transfer, e.g. a transaction hash
     * @throws ValueTransferException if the value could not be moved
     */
    String transfer(Address to, BigInteger amount);
}
