package com.herzen.tutor.api;

import com.herzen.tutor.access.AccessGate;
import com.herzen.tutor.access.AccessModels.Identity;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import com.herzen.tutor.ingestion.IngestionModels.IngestOutcome;
import com.herzen.tutor.ingestion.IngestionPipeline;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/turns")
public class TurnController {
    private final AccessGate accessGate;
    private final IngestionPipeline pipeline;

    public TurnController(AccessGate accessGate, IngestionPipeline pipeline) {
        this.accessGate = accessGate;
        this.pipeline = pipeline;
    }

    @PostMapping
    public ResponseEntity<ApiModels.TurnResponse> ingest(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                         @Valid @RequestBody ApiModels.TurnRequest request) {
        Identity identity = accessGate.authenticate(authorization);
        IngestOutcome outcome = pipeline.ingest(identity, request.sessionId(), TurnRole.fromCode(request.role()), request.text());
        if (!outcome.accepted()) {
            long retryAfter = Math.max(outcome.retryAfter().toSeconds(), 1);
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfter))
                    .body(new ApiModels.TurnResponse(false, "rate_limited", null, false, null, retryAfter));
        }
        return ResponseEntity.ok(new ApiModels.TurnResponse(true, null, outcome.turn().turnId(), outcome.flagged(),
                outcome.interventionReply(), null));
    }
}
