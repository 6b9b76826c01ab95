package com.chamapool.chama.client;

import com.chamapool.chama.client.dto.WalletCreditRequest;
import com.chamapool.chama.client.dto.WalletCreditResponse;
import com.chamapool.chama.client.dto.WalletDebitRequest;
import com.chamapool.chama.client.dto.WalletDebitResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for Wallet Service
 * Moves contributions and fines into group pools and payouts, refunds and withdrawals out
 */
@FeignClient(
    name = "wallet-service",
    url = "${wallet.service.url:http://localhost:8091}",
    configuration = WalletServiceClientConfig.class
)
public interface WalletServiceClient {

    /**
     * Debit a member's wallet into a group pool
     */
    @PostMapping("/api/v1/wallet/debit")
    WalletDebitResponse debit(@RequestBody WalletDebitRequest request);

    /**
     * Credit a member's wallet from a group pool
     */
    @PostMapping("/api/v1/wallet/credit")
    WalletCreditResponse credit(@RequestBody WalletCreditRequest request);
}
