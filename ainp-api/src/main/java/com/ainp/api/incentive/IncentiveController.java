package com.ainp.api.incentive;

import com.ainp.api.common.ErrorResponse;
import com.ainp.api.common.ValidationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/incentives")
public class IncentiveController {

    private final IncentiveDistributionService distributionService;
    private final UsefulnessScoreService usefulnessScoreService;

    public IncentiveController(
            IncentiveDistributionService distributionService,
            UsefulnessScoreService usefulnessScoreService) {
        this.distributionService = distributionService;
        this.usefulnessScoreService = usefulnessScoreService;
    }

    @PostMapping("/usefulness-rewards")
    public ResponseEntity<IncentiveDistributionService.UsefulnessRewardResult> distributeUsefulnessRewards(
            @Valid @RequestBody UsefulnessRewardRequest request) {
        double minScore = request.minScore() != null ? request.minScore() : IncentiveDistributionService.DEFAULT_MIN_SCORE;
        return ResponseEntity.ok(distributionService.distributeUsefulnessRewards(request.rewardPool(), minScore));
    }

    @PutMapping("/usefulness/{agentDid}")
    public ResponseEntity<UsefulnessScoreService.UsefulnessDto> recordScore(
            @PathVariable String agentDid,
            @Valid @RequestBody ScoreRequest request) {
        return ResponseEntity.ok(usefulnessScoreService.recordScore(agentDid, request.score()));
    }

    @GetMapping("/usefulness/{agentDid}")
    public ResponseEntity<UsefulnessScoreService.UsefulnessDto> getScore(@PathVariable String agentDid) {
        return usefulnessScoreService.getScore(agentDid)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", e.getMessage()));
    }

    public record UsefulnessRewardRequest(@PositiveOrZero long rewardPool, Double minScore) {}

    public record ScoreRequest(@NotNull Double score) {}
}
