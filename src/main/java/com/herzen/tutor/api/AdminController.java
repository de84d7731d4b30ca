package com.herzen.tutor.api;

import com.herzen.tutor.access.AccessGate;
import com.herzen.tutor.analytics.AnalyticsModels.AnalyticsSummary;
import com.herzen.tutor.analytics.AnalyticsModels.RecomputeResult;
import com.herzen.tutor.analytics.AnalyticsModels.TimeWindow;
import com.herzen.tutor.domain.DomainModels.FlaggedItem;
import com.herzen.tutor.domain.DomainModels.ReviewStatus;
import com.herzen.tutor.domain.DomainModels.Student;
import com.herzen.tutor.domain.DomainModels.TurnRecord;
import com.herzen.tutor.query.ConversationQueryService;
import com.herzen.tutor.query.QueryModels;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/admin")
public class AdminController {
    private final AccessGate accessGate;
    private final ConversationQueryService queryService;
    private final Clock clock;

    public AdminController(AccessGate accessGate, ConversationQueryService queryService, Clock clock) {
        this.accessGate = accessGate;
        this.queryService = queryService;
        this.clock = clock;
    }

    /** Defaults to the last 24 hours. */
    @GetMapping("/summary")
    public ResponseEntity<List<AnalyticsSummary>> summary(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                          @RequestParam(required = false) String from,
                                                          @RequestParam(required = false) String to,
                                                          @RequestParam(required = false) String topic,
                                                          @RequestParam(required = false) String studentId) {
        var identity = accessGate.authenticate(authorization);
        Instant end = to == null ? clock.instant() : Instant.parse(to);
        Instant start = from == null ? end.minus(Duration.ofDays(1)) : Instant.parse(from);
        return ResponseEntity.ok(queryService.getSummary(identity, start, end, topic, studentId));
    }

    @PostMapping("/analytics/recompute")
    public ResponseEntity<RecomputeResult> recompute(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                     @RequestBody(required = false) ApiModels.RecomputeRequest request) {
        var identity = accessGate.authenticate(authorization);
        TimeWindow window = null;
        String studentId = null;
        if (request != null) {
            if (request.from() != null || request.to() != null) {
                if (request.from() == null || request.to() == null) throw new IllegalArgumentException("from and to go together");
                window = new TimeWindow(Instant.parse(request.from()), Instant.parse(request.to()));
            }
            studentId = request.studentId();
        }
        return ResponseEntity.ok(queryService.recompute(identity, window, studentId));
    }

    @GetMapping("/flagged")
    public ResponseEntity<List<FlaggedItem>> flagged(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                     @RequestParam(required = false) String status,
                                                     @RequestParam(defaultValue = "50") int limit) {
        var identity = accessGate.authenticate(authorization);
        ReviewStatus filter = status == null || status.isBlank() ? null : ReviewStatus.fromCode(status);
        return ResponseEntity.ok(queryService.listFlagged(identity, filter, limit));
    }

    @PutMapping("/flagged/{flagId}/status")
    public ResponseEntity<FlaggedItem> review(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                              @PathVariable long flagId,
                                              @Valid @RequestBody ApiModels.ReviewStatusRequest request) {
        var identity = accessGate.authenticate(authorization);
        return ResponseEntity.ok(queryService.setFlagReviewStatus(identity, flagId, ReviewStatus.fromCode(request.status())));
    }

    @GetMapping("/students")
    public ResponseEntity<List<Student>> students(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                  @RequestParam(defaultValue = "50") int limit,
                                                  @RequestParam(defaultValue = "0") int offset) {
        var identity = accessGate.authenticate(authorization);
        return ResponseEntity.ok(queryService.listStudents(identity, limit, offset));
    }

    @GetMapping("/stats")
    public ResponseEntity<QueryModels.PlatformStats> stats(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return ResponseEntity.ok(queryService.platformStats(accessGate.authenticate(authorization)));
    }

    @GetMapping("/turns")
    public ResponseEntity<List<TurnRecord>> turns(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                  @RequestParam(defaultValue = "50") int limit,
                                                  @RequestParam(defaultValue = "0") int offset) {
        var identity = accessGate.authenticate(authorization);
        return ResponseEntity.ok(queryService.listConversations(identity, limit, offset));
    }

    @GetMapping("/turns/search")
    public ResponseEntity<List<TurnRecord>> search(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                   @RequestParam("q") String query,
                                                   @RequestParam(defaultValue = "50") int limit) {
        var identity = accessGate.authenticate(authorization);
        return ResponseEntity.ok(queryService.searchTurns(identity, query, limit));
    }

    @PostMapping("/turns/{turnId}/redact")
    public ResponseEntity<TurnRecord> redact(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                             @PathVariable long turnId,
                                             @Valid @RequestBody(required = false) ApiModels.RedactRequest request) {
        var identity = accessGate.authenticate(authorization);
        return ResponseEntity.ok(queryService.redactTurn(identity, turnId, request == null ? null : request.reason()));
    }
}
