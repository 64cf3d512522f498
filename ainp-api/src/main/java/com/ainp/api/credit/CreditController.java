package com.ainp.api.credit;

import com.ainp.api.common.ErrorResponse;
import com.ainp.api.common.ValidationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/credits")
public class CreditController {

    private final CreditLedgerService creditLedgerService;

    public CreditController(CreditLedgerService creditLedgerService) {
        this.creditLedgerService = creditLedgerService;
    }

    @GetMapping("/{agentDid}")
    public ResponseEntity<CreditLedgerService.CreditAccountDto> getAccount(@PathVariable String agentDid) {
        return creditLedgerService.getAccount(agentDid)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{agentDid}")
    public ResponseEntity<CreditLedgerService.CreditAccountDto> createAccount(
            @PathVariable String agentDid,
            @Valid @RequestBody(required = false) CreateAccountRequest request) {
        long initialBalance = request == null || request.initialBalance() == null ? 0L : request.initialBalance();
        var account = creditLedgerService.createAccount(agentDid, initialBalance);
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @PostMapping("/{agentDid}/deposit")
    public ResponseEntity<CreditLedgerService.CreditAccountDto> deposit(
            @PathVariable String agentDid,
            @Valid @RequestBody DepositRequest request) {
        var account = creditLedgerService.deposit(agentDid, request.amount(), request.metadata());
        return ResponseEntity.ok(account);
    }

    @GetMapping("/{agentDid}/transactions")
    public ResponseEntity<List<CreditLedgerService.CreditTransactionDto>> getTransactions(
            @PathVariable String agentDid,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(creditLedgerService.getTransactionHistory(agentDid, limit, offset));
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAccountNotFound(AccountNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("ACCOUNT_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientCredits(InsufficientCreditsException e) {
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                .body(new ErrorResponse("INSUFFICIENT_CREDITS", e.getMessage()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", e.getMessage()));
    }

    public record CreateAccountRequest(@PositiveOrZero Long initialBalance) {}

    public record DepositRequest(@PositiveOrZero long amount, Map<String, Object> metadata) {}
}
