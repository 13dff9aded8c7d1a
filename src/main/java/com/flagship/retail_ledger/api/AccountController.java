package com.flagship.retail_ledger.api;

import com.flagship.retail_ledger.api.dto.AccountResponse;
import com.flagship.retail_ledger.api.dto.AmountRequest;
import com.flagship.retail_ledger.api.dto.BalanceResponse;
import com.flagship.retail_ledger.api.dto.CategoryFundingRequest;
import com.flagship.retail_ledger.api.dto.OpenAccountRequest;
import com.flagship.retail_ledger.api.dto.StatementResponse;
import com.flagship.retail_ledger.api.dto.TransactionResponse;
import com.flagship.retail_ledger.api.dto.TransferRequest;
import com.flagship.retail_ledger.api.dto.TransferResponse;
import com.flagship.retail_ledger.api.dto.UpdateProfileRequest;
import com.flagship.retail_ledger.ledger.Account;
import com.flagship.retail_ledger.ledger.AccountService;
import com.flagship.retail_ledger.ledger.LedgerService;
import com.flagship.retail_ledger.ledger.LedgerTransaction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * REST surface of the ledger.
 *
 * The caller (session layer) has already authenticated the customer and passes
 * the customer's account reference in the path. No business rule lives here:
 * every rule is enforced by {@link LedgerService} and {@link AccountService}.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Validated
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<AccountResponse> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        log.info("Received account opening request: kind={}", request.getKind());
        Account account = accountService.openAccount(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.getAccount(id));
    }

    @GetMapping("/by-number/{accountNumber}")
    public AccountResponse getAccountByNumber(@PathVariable("accountNumber") String accountNumber) {
        return AccountResponse.from(accountService.getAccountByNumber(accountNumber));
    }

    @PutMapping("/{id}/profile")
    public AccountResponse updateProfile(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateProfileRequest request) {
        return AccountResponse.from(accountService.updateProfile(id, request.toProfile()));
    }

    @GetMapping("/{id}/balance")
    public BalanceResponse getBalance(@PathVariable("id") UUID id) {
        return new BalanceResponse(id, ledgerService.computeBalance(id));
    }

    /**
     * Transaction history. Stored order is oldest first; {@code order=desc} reverses it for display.
     */
    @GetMapping("/{id}/transactions")
    public List<TransactionResponse> listTransactions(
            @PathVariable("id") UUID id,
            @RequestParam(name = "order", defaultValue = "asc") String order) {
        List<LedgerTransaction> transactions = new ArrayList<>(ledgerService.listTransactions(id));
        if ("desc".equalsIgnoreCase(order)) {
            Collections.reverse(transactions);
        } else if (!"asc".equalsIgnoreCase(order)) {
            throw new IllegalArgumentException("order must be 'asc' or 'desc'");
        }
        return transactions.stream().map(TransactionResponse::from).toList();
    }

    @GetMapping("/{id}/statement")
    public StatementResponse getStatement(
            @PathVariable("id") UUID id,
            @RequestParam(name = "recent", defaultValue = "5") @Min(0) @Max(100) int recent) {
        return StatementResponse.from(ledgerService.statement(id, recent));
    }

    @PostMapping("/{id}/deposits")
    public ResponseEntity<TransactionResponse> deposit(
            @PathVariable("id") UUID id,
            @Valid @RequestBody AmountRequest request) {
        LedgerTransaction booked = ledgerService.deposit(id, request.getAmount(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(booked));
    }

    @PostMapping("/{id}/withdrawals")
    public ResponseEntity<TransactionResponse> withdraw(
            @PathVariable("id") UUID id,
            @Valid @RequestBody AmountRequest request) {
        LedgerTransaction booked = ledgerService.withdraw(id, request.getAmount(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(booked));
    }

    @PostMapping("/{id}/transfers")
    public ResponseEntity<TransferResponse> transfer(
            @PathVariable("id") UUID id,
            @Valid @RequestBody TransferRequest request) {
        var result = ledgerService.transfer(
            id, request.getRecipientAccountNumber(), request.getAmount(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(result));
    }

    @PostMapping("/{id}/category-fundings")
    public ResponseEntity<TransactionResponse> fundCategory(
            @PathVariable("id") UUID id,
            @Valid @RequestBody CategoryFundingRequest request) {
        LedgerTransaction booked = ledgerService.fundCategory(
            id, request.getCategory(), request.getAmount(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(booked));
    }
}
