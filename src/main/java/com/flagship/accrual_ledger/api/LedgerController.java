package com.flagship.accrual_ledger.api;

import com.flagship.accrual_ledger.api.dto.RunResponse;
import com.flagship.accrual_ledger.api.dto.SynthesizeRequest;
import com.flagship.accrual_ledger.event.RawRow;
import com.flagship.accrual_ledger.export.GnuCashCsvExporter;
import com.flagship.accrual_ledger.importer.StripeBalanceCsvImporter;
import com.flagship.accrual_ledger.pipeline.LedgerPipeline;
import com.flagship.accrual_ledger.pipeline.LedgerRun;
import com.flagship.accrual_ledger.tax.TaxState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for ledger synthesis.
 *
 * Key features:
 * - JSON rows or a Stripe balance export in, balanced transactions out
 * - Row and event problems come back as warnings next to the transactions
 * - An aborted run answers 422 and carries no transactions
 * - GnuCash CSV export of the same run
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    static final String OUTCOME_HEADER = "X-Ledger-Outcome";
    static final String WARNINGS_HEADER = "X-Ledger-Warnings";
    static final String TEXT_CSV = "text/csv";

    private final LedgerPipeline pipeline;
    private final StripeBalanceCsvImporter stripeImporter;
    private final GnuCashCsvExporter gnuCashExporter;

    /**
     * Synthesizes transactions from JSON rows.
     *
     * @param request rows plus optional year-to-date income carried over
     * @return run result; 422 when the run aborted
     */
    @PostMapping(value = "/transactions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RunResponse> synthesize(@Valid @RequestBody SynthesizeRequest request) {
        log.info("Received synthesis request: rows={}", request.getRows().size());
        TaxState state = request.getYearToDate() == null || request.getYearToDate().isEmpty()
                ? TaxState.initial()
                : TaxState.of(request.getYearToDate());
        LedgerRun run = pipeline.run(request.toRawRows(), state);
        return respond(run);
    }

    /**
     * Synthesizes transactions from a Stripe balance-history CSV export.
     */
    @PostMapping(value = "/imports/stripe", consumes = {TEXT_CSV, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<RunResponse> importStripe(@RequestBody String csv) {
        List<RawRow> rows = stripeImporter.read(csv);
        log.info("Received Stripe import: rows={}", rows.size());
        return respond(pipeline.run(rows));
    }

    /**
     * Converts a Stripe balance-history CSV export into a GnuCash multi-split CSV.
     * The run outcome and warning count travel in response headers.
     */
    @PostMapping(value = "/exports/gnucash", consumes = {TEXT_CSV, MediaType.TEXT_PLAIN_VALUE},
            produces = TEXT_CSV)
    public ResponseEntity<String> exportGnuCash(@RequestBody String csv) {
        LedgerRun run = pipeline.run(stripeImporter.read(csv));
        String body = gnuCashExporter.export(run.getTransactions());
        return ResponseEntity.status(run.isAborted() ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.OK)
                .header(OUTCOME_HEADER, run.getOutcome().name())
                .header(WARNINGS_HEADER, String.valueOf(run.getWarnings().size()))
                .contentType(MediaType.parseMediaType(TEXT_CSV))
                .body(body);
    }

    private static ResponseEntity<RunResponse> respond(LedgerRun run) {
        if (run.isAborted()) {
            log.warn("Run aborted: runId={}, reason={}", run.getRunId(), run.getAbortReason());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(RunResponse.from(run));
        }
        return ResponseEntity.ok(RunResponse.from(run));
    }
}
