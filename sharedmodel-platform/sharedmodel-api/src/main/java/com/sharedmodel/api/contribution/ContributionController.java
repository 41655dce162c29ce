package com.sharedmodel.api.contribution;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.domain.ContributionKey;
import com.sharedmodel.core.error.ErrorReason;
import com.sharedmodel.core.error.SharedModelException;
import com.sharedmodel.core.trainer.ClaimPayout;
import com.sharedmodel.core.trainer.SubmissionReceipt;
import com.sharedmodel.core.trainer.ValueTransferException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

@RestController
@RequestMapping("/api/v1/contributions")
public class ContributionController {

    private static final Logger log = LoggerFactory.getLogger(ContributionController.class);
    static final String PARTICIPANT_HEADER = "X-Participant-Address";

    private final ContributionService contributionService;

    public ContributionController(ContributionService contributionService) {
        this.contributionService = contributionService;
    }

    @GetMapping("/quote")
    public ResponseEntity<ContributionService.QuoteDto> quote() {
        return ResponseEntity.ok(contributionService.quote());
    }

    @PostMapping
    public ResponseEntity<SubmissionResponse> submit(
            @RequestHeader(PARTICIPANT_HEADER) String participant,
            @Valid @RequestBody SubmitRequest request) {
        SubmissionReceipt receipt = contributionService.submit(
                Address.of(participant), request.sample(), request.label(), request.paidAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(new SubmissionResponse(
                receipt.key().hex(),
                receipt.label(),
                receipt.addedTime(),
                receipt.submitter().value(),
                receipt.cost(),
                receipt.change()));
    }

    @PostMapping("/refund")
    public ResponseEntity<ClaimResponse> refund(
            @RequestHeader(PARTICIPANT_HEADER) String participant,
            @Valid @RequestBody RefundRequest request) {
        ClaimPayout payout = contributionService.refund(
                Address.of(participant), request.sample(), request.label(), request.addedTime());
        return ResponseEntity.ok(toResponse(payout));
    }

    @PostMapping("/report")
    public ResponseEntity<ClaimResponse> report(
            @RequestHeader(PARTICIPANT_HEADER) String participant,
            @Valid @RequestBody ReportRequest request) {
        ClaimPayout payout = contributionService.report(
                Address.of(participant), request.sample(), request.label(), request.addedTime(),
                Address.of(request.originalAuthor()));
        return ResponseEntity.ok(toResponse(payout));
    }

    @GetMapping("/{key}")
    public ResponseEntity<ContributionService.ContributionDto> getContribution(@PathVariable String key) {
        return contributionService.getContribution(new ContributionKey(key))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{key}/history")
    public ResponseEntity<List<ContributionService.ContributionDto>> getHistory(@PathVariable String key) {
        return ResponseEntity.ok(contributionService.getHistory(new ContributionKey(key)));
    }

    @GetMapping("/{key}/events")
    public ResponseEntity<List<ContributionService.AuditEntryDto>> getEvents(@PathVariable String key) {
        return ResponseEntity.ok(contributionService.getAuditTrail(new ContributionKey(key)));
    }

    @GetMapping("/participants/{address}")
    public ResponseEntity<ContributionService.ParticipantDto> getParticipant(@PathVariable String address) {
        return ResponseEntity.ok(contributionService.getParticipant(Address.of(address)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ContributionService.StatsDto> getStats() {
        return ResponseEntity.ok(contributionService.getStats());
    }

    @ExceptionHandler(SharedModelException.class)
    public ResponseEntity<ErrorResponse> handleRejected(SharedModelException e) {
        HttpStatus status = switch (e.getCategory()) {
            case VALIDATION -> e.getReason() == ErrorReason.NOT_FOUND
                    ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
            case PERMISSION -> HttpStatus.FORBIDDEN;
            case TIMING, ECONOMIC -> HttpStatus.CONFLICT;
            case ARITHMETIC -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        log.warn("Rejected with {}: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler(ValueTransferException.class)
    public ResponseEntity<ErrorResponse> handleTransferFailed(ValueTransferException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(new ErrorResponse("PAYOUT_001", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("INPUT_001", e.getMessage()));
    }

    private ClaimResponse toResponse(ClaimPayout payout) {
        return new ClaimResponse(payout.key().hex(), payout.recipient().value(), payout.amount(), payout.transferId());
    }

    public record SubmitRequest(
            @NotNull @Size(min = 1) long[] sample,
            long label,
            @NotNull @PositiveOrZero BigInteger paidAmount) {}

    public record RefundRequest(
            @NotNull @Size(min = 1) long[] sample,
            long label,
            @PositiveOrZero long addedTime) {}

    public record ReportRequest(
            @NotNull @Size(min = 1) long[] sample,
            long label,
            @PositiveOrZero long addedTime,
            @NotBlank String originalAuthor) {}

    public record SubmissionResponse(String key, long label, long addedTime, String submitter,
                                     BigInteger cost, BigInteger change) {}

    public record ClaimResponse(String key, String recipient, BigInteger amount, String transferId) {}

    public record ErrorResponse(String code, String message) {}
}
