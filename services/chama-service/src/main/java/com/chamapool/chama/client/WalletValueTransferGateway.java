package com.chamapool.chama.client;

import com.chamapool.chama.client.dto.WalletCreditRequest;
import com.chamapool.chama.client.dto.WalletCreditResponse;
import com.chamapool.chama.client.dto.WalletDebitRequest;
import com.chamapool.chama.client.dto.WalletDebitResponse;
import com.chamapool.chama.domain.ContributionAsset;
import com.chamapool.chama.engine.ValueTransferGateway;
import com.chamapool.chama.exception.ValueTransferException;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cloud.client.circuitbreaker.NoFallbackAvailableException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * {@link ValueTransferGateway} backed by the wallet service. Native-asset groups move the
 * configured platform currency; token groups move the token code.
 */
@Slf4j
@Component
public class WalletValueTransferGateway implements ValueTransferGateway {

    private final WalletServiceClient walletServiceClient;
    private final String nativeCurrency;

    public WalletValueTransferGateway(WalletServiceClient walletServiceClient,
                                      @Value("${chama.wallet.native-currency:KES}") String nativeCurrency) {
        this.walletServiceClient = walletServiceClient;
        this.nativeCurrency = nativeCurrency;
    }

    @Override
    public void collect(String from, ContributionAsset asset, BigDecimal amount, String reference) {
        log.debug("Debiting wallet: user={}, amount={}, reference={}", from, amount, reference);
        WalletDebitResponse response;
        try {
            response = walletServiceClient.debit(WalletDebitRequest.builder()
                    .userId(from)
                    .amount(amount)
                    .currency(currencyOf(asset))
                    .reference(reference)
                    .description("Chama " + reference)
                    .build());
        } catch (FeignException e) {
            log.error("Wallet debit failed: user={}, reference={}, status={}", from, reference, e.status(), e);
            throw new ValueTransferException("debit", reference, e);
        } catch (NoFallbackAvailableException e) {
            log.error("Wallet debit short-circuited: user={}, reference={}", from, reference, e);
            throw new ValueTransferException("debit", reference, e.getCause() != null ? e.getCause() : e);
        }
        if (response == null || !response.isSuccessful()) {
            throw new ValueTransferException("Wallet debit rejected for " + reference + ": "
                    + (response != null ? response.getMessage() : "empty response"));
        }
        log.info("Wallet debited: user={}, amount={}, transactionId={}", from, amount, response.getTransactionId());
    }

    @Override
    public void disburse(String to, ContributionAsset asset, BigDecimal amount, String reference) {
        log.debug("Crediting wallet: user={}, amount={}, reference={}", to, amount, reference);
        WalletCreditResponse response;
        try {
            response = walletServiceClient.credit(WalletCreditRequest.builder()
                    .userId(to)
                    .amount(amount)
                    .currency(currencyOf(asset))
                    .reference(reference)
                    .description("Chama " + reference)
                    .build());
        } catch (FeignException e) {
            log.error("Wallet credit failed: user={}, reference={}, status={}", to, reference, e.status(), e);
            throw new ValueTransferException("credit", reference, e);
        } catch (NoFallbackAvailableException e) {
            log.error("Wallet credit short-circuited: user={}, reference={}", to, reference, e);
            throw new ValueTransferException("credit", reference, e.getCause() != null ? e.getCause() : e);
        }
        if (response == null || !response.isSuccessful()) {
            throw new ValueTransferException("Wallet credit rejected for " + reference + ": "
                    + (response != null ? response.getMessage() : "empty response"));
        }
        log.info("Wallet credited: user={}, amount={}, transactionId={}", to, amount, response.getTransactionId());
    }

    private String currencyOf(ContributionAsset asset) {
        return asset == null || asset.isNative() ? nativeCurrency : asset.getTokenCode();
    }
}
