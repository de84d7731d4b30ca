package com.herzen.tutor.api;

import com.herzen.tutor.access.AccessGate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {
    private final AccessGate accessGate;

    public AuthController(AccessGate accessGate) {
        this.accessGate = accessGate;
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        accessGate.revoke(authorization);
        return ResponseEntity.noContent().build();
    }
}
