package com.ainp.api.negotiation;

import com.ainp.api.common.ErrorResponse;
import com.ainp.api.common.ValidationException;
import com.ainp.api.credit.AccountNotFoundException;
import com.ainp.api.credit.InsufficientCreditsException;
import com.ainp.api.settlement.SettlementService;
import com.ainp.core.domain.NegotiationSession.NegotiationState;
import com.ainp.core.domain.ProposalTerms;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/negotiations")
public class NegotiationController {

    private final NegotiationService negotiationService;

    public NegotiationController(NegotiationService negotiationService) {
        this.negotiationService = negotiationService;
    }

    @PostMapping
    public ResponseEntity<NegotiationService.NegotiationDto> initiate(@Valid @RequestBody InitiateRequest request) {
        var session = negotiationService.initiate(
                request.intentId(),
                request.initiatorDid(),
                request.responderDid(),
                request.initialProposal(),
                request.maxRounds(),
                request.ttlMinutes());
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @PostMapping("/{negotiationId}/propose")
    public ResponseEntity<NegotiationService.NegotiationDto> propose(
            @PathVariable UUID negotiationId,
            @Valid @RequestBody ProposeRequest request) {
        return ResponseEntity.ok(negotiationService.propose(negotiationId, request.proposerDid(), request.proposal()));
    }

    @PostMapping("/{negotiationId}/accept")
    public ResponseEntity<NegotiationService.NegotiationDto> accept(
            @PathVariable UUID negotiationId,
            @Valid @RequestBody AcceptRequest request) {
        return ResponseEntity.ok(negotiationService.accept(negotiationId, request.acceptorDid()));
    }

    @PostMapping("/{negotiationId}/reject")
    public ResponseEntity<NegotiationService.NegotiationDto> reject(
            @PathVariable UUID negotiationId,
            @Valid @RequestBody RejectRequest request) {
        return ResponseEntity.ok(negotiationService.reject(negotiationId, request.rejectorDid(), request.reason()));
    }

    @PostMapping("/{negotiationId}/settle")
    public ResponseEntity<SettlementService.SettlementResult> settle(
            @PathVariable UUID negotiationId,
            @RequestBody(required = false) SettleRequest request) {
        String validatorDid = request == null ? null : request.validatorDid();
        String proofId = request == null ? null : request.usefulnessProofId();
        return ResponseEntity.ok(negotiationService.settle(negotiationId, validatorDid, proofId));
    }

    @GetMapping("/{negotiationId}")
    public ResponseEntity<NegotiationService.NegotiationDto> getSession(@PathVariable UUID negotiationId) {
        return negotiationService.getSession(negotiationId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/agent/{agentDid}")
    public ResponseEntity<List<NegotiationService.NegotiationDto>> getSessionsByAgent(
            @PathVariable String agentDid,
            @RequestParam(required = false) String state) {
        return ResponseEntity.ok(negotiationService.getSessionsByAgent(agentDid, parseState(state)));
    }

    private static NegotiationState parseState(String state) {
        if (state == null || state.isBlank()) {
            return null;
        }
        try {
            return NegotiationState.valueOf(state.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown negotiation state: " + state);
        }
    }

    @ExceptionHandler(NegotiationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NegotiationNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NEGOTIATION_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidStateTransitionException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_STATE_TRANSITION", e.getMessage()));
    }

    @ExceptionHandler(ExpiredNegotiationException.class)
    public ResponseEntity<ErrorResponse> handleExpired(ExpiredNegotiationException e) {
        return ResponseEntity.status(HttpStatus.GONE)
                .body(new ErrorResponse("NEGOTIATION_EXPIRED", e.getMessage()));
    }

    @ExceptionHandler(MaxRoundsExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxRounds(MaxRoundsExceededException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("MAX_ROUNDS_EXCEEDED", e.getMessage()));
    }

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientCredits(InsufficientCreditsException e) {
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                .body(new ErrorResponse("INSUFFICIENT_CREDITS", e.getMessage()));
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAccountNotFound(AccountNotFoundException e) {
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                .body(new ErrorResponse("ACCOUNT_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(SettlementService.SettlementException.class)
    public ResponseEntity<ErrorResponse> handleSettlement(SettlementService.SettlementException e) {
        if (e.getSettlementId() != null) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("SETTLEMENT_PENDING_DISTRIBUTION", e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("SETTLEMENT_FAILED", e.getMessage()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        var fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null
                ? fieldError.getField() + " " + fieldError.getDefaultMessage()
                : "Invalid request body";
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    public record InitiateRequest(
            @NotBlank String intentId,
            @NotBlank String initiatorDid,
            @NotBlank String responderDid,
            @NotNull ProposalTerms initialProposal,
            Integer maxRounds,
            Integer ttlMinutes
    ) {}

    public record ProposeRequest(@NotBlank String proposerDid, @NotNull ProposalTerms proposal) {}

    public record AcceptRequest(@NotBlank String acceptorDid) {}

    public record RejectRequest(@NotBlank String rejectorDid, String reason) {}

    public record SettleRequest(String validatorDid, String usefulnessProofId) {}
}
