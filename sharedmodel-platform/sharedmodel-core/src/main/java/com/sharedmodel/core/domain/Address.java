package com.sharedmodel.core.domain;

import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A participant identity: 20 bytes rendered as {@code 0x}-prefixed lowercase hex.
 */
public record Address(String value) {

    private static final Pattern HEX_40 = Pattern.compile("[0-9a-f]{40}");

    public Address {
        Objects.requireNonNull(value, "Address cannot be null");
        String hex = Numeric.cleanHexPrefix(value.trim()).toLowerCase();
        if (!HEX_40.matcher(hex).matches()) {
            throw new IllegalArgumentException("Not a 20-byte hex address: " + value);
        }
        value = "0x" + hex;
    }

    public static Address of(String value) {
        return new Address(value);
    }

    public byte[] toBytes() {
        return Numeric.hexStringToByteArray(value);
    }

    /**
     * EIP-55 mixed-case form, for logs and receipts.
     */
    public String toChecksum() {
        return Keys.toChecksumAddress(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
