package com.sharedmodel.core.domain;

import org.web3j.utils.Numeric;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 32-byte content commitment identifying one contribution.
 */
public record ContributionKey(String hex) {

    private static final Pattern HEX_64 = Pattern.compile("[0-9a-f]{64}");

    public ContributionKey {
        Objects.requireNonNull(hex, "Key cannot be null");
        String clean = Numeric.cleanHexPrefix(hex.trim()).toLowerCase();
        if (!HEX_64.matcher(clean).matches()) {
            throw new IllegalArgumentException("Not a 32-byte hex key: " + hex);
        }
        hex = "0x" + clean;
    }

    public static ContributionKey of(byte[] digest) {
        if (digest == null || digest.length != 32) {
            throw new IllegalArgumentException("Commitment digest must be 32 bytes");
        }
        return new ContributionKey(Numeric.toHexString(digest));
    }

    @Override
    public String toString() {
        return hex;
    }
}
