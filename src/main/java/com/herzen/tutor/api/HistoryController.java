package com.herzen.tutor.api;

import com.herzen.tutor.access.AccessGate;
import com.herzen.tutor.access.AccessModels.Identity;
import com.herzen.tutor.domain.DomainModels.TurnRecord;
import com.herzen.tutor.query.ConversationQueryService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/history")
public class HistoryController {
    private final AccessGate accessGate;
    private final ConversationQueryService queryService;

    public HistoryController(AccessGate accessGate, ConversationQueryService queryService) {
        this.accessGate = accessGate;
        this.queryService = queryService;
    }

    /** Without studentId the caller's own history is returned. */
    @GetMapping
    public ResponseEntity<List<TurnRecord>> history(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                    @RequestParam(required = false) String studentId,
                                                    @RequestParam(defaultValue = "50") int limit) {
        Identity identity = accessGate.authenticate(authorization);
        String target = studentId == null || studentId.isBlank() ? identity.subjectId() : studentId;
        return ResponseEntity.ok(queryService.getStudentHistory(identity, target, limit));
    }
}
