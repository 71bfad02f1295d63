package com.flagship.stock_ledger.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Login stub for the front end. Checks a single configured credential pair and
 * returns the admin role; no session or token is issued and no route is protected.
 */
@RestController
@RequestMapping("/api/login")
@Slf4j
public class LoginController {

    private static final String ADMIN_ROLE = "admin";

    @Value("${inventory.auth.username:admin}")
    private String username;

    @Value("${inventory.auth.password:123}")
    private String password;

    @PostMapping
    public ResponseEntity<Map<String, String>> login(@RequestBody(required = false) LoginRequest request) {
        if (request == null) {
            log.warn("Login rejected: no credentials");
            return invalid();
        }
        if (username.equals(request.getUsername()) && password.equals(request.getPassword())) {
            log.info("Login accepted: user={}", request.getUsername());
            return ResponseEntity.ok(Map.of("role", ADMIN_ROLE));
        }
        log.warn("Login rejected: user={}", request.getUsername());
        return invalid();
    }

    private ResponseEntity<Map<String, String>> invalid() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("message", "Invalid"));
    }
}
