package com.flagship.pawn_ledger.pledge;

import com.flagship.pawn_ledger.observability.LedgerMetrics;
import com.flagship.pawn_ledger.pledge.dto.DisbursePledgeRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/companies/{companyId}/pledges")
@RequiredArgsConstructor
public class PledgeController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final PledgeService pledgeService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<Pledge> disburse(@PathVariable("companyId") UUID companyId,
                                           @Valid @RequestBody DisbursePledgeRequest request,
                                           @RequestHeader(ACTOR_HEADER) String actor) {
        Pledge pledge = metrics.timeApi("disburse_pledge",
            () -> pledgeService.disburse(request.toCommand(companyId, actor)));
        return ResponseEntity.status(HttpStatus.CREATED).body(pledge);
    }

    @GetMapping("/{pledgeId}")
    public Pledge getPledge(@PathVariable("companyId") UUID companyId,
                            @PathVariable("pledgeId") UUID pledgeId) {
        return pledgeService.getPledge(pledgeId, companyId);
    }

    @GetMapping("/{pledgeId}/settlement")
    public SettlementQuote settlementQuote(@PathVariable("companyId") UUID companyId,
                                          @PathVariable("pledgeId") UUID pledgeId,
                                          @RequestParam(name = "as_of", required = false)
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return pledgeService.settlementQuote(pledgeId, companyId, asOf != null ? asOf : LocalDate.now(clock));
    }
}
