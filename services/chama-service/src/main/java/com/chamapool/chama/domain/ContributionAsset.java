package com.chamapool.chama.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The asset a group is denominated in: the wallet's native currency or a single token.
 * A group accepts exactly one of the two.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContributionAsset {

    public static final ContributionAsset NATIVE = new ContributionAsset(null);

    String tokenCode;

    public static ContributionAsset token(String tokenCode) {
        if (tokenCode == null || tokenCode.isBlank()) {
            throw new IllegalArgumentException("Token code must not be blank");
        }
        return new ContributionAsset(tokenCode.trim().toUpperCase());
    }

    public static ContributionAsset of(String tokenCode) {
        return tokenCode == null || tokenCode.isBlank() ? NATIVE : token(tokenCode);
    }

    public boolean isNative() {
        return tokenCode == null;
    }

    public String code() {
        return isNative() ? "NATIVE" : tokenCode;
    }
}
