package com.herzen.tutor.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public class ApiModels {
    public record TurnRequest(@NotBlank @Size(max = 128) String sessionId,
                              @NotBlank String role,
                              @NotNull @Size(max = 20000) String text) {}

    public record TurnResponse(boolean accepted,
                               String reason,
                               Long turnId,
                               boolean flagged,
                               String interventionReply,
                               Long retryAfterSeconds) {}

    public record ReviewStatusRequest(@NotBlank String status) {}

    public record RecomputeRequest(String from, String to, String studentId) {}

    public record RedactRequest(@Size(max = 500) String reason) {}
}
