package com.chamapool.chama.engine;

import com.chamapool.chama.domain.ContributionAsset;

import java.math.BigDecimal;

/**
 * Moves value between member wallets and a group's pool.
 *
 * Implementations throw {@link com.chamapool.chama.exception.ValueTransferException} when the
 * transfer did not happen; the engine then rolls the whole operation back.
 */
public interface ValueTransferGateway {

    /**
     * Pulls {@code amount} from the member's wallet into the group pool.
     */
    void collect(String from, ContributionAsset asset, BigDecimal amount, String reference);

    /**
     * Pays {@code amount} out of the group pool into the member's wallet.
     */
    void disburse(String to, ContributionAsset asset, BigDecimal amount, String reference);
}
