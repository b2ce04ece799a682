package com.flagship.token_ledger.health;

import com.flagship.token_ledger.ledger.TokenLedger;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final TokenLedger tokenLedger;

    public HealthController(TokenLedger tokenLedger) {
        this.tokenLedger = tokenLedger;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean balanced = checkSupplyInvariant();
        response.put("ledger", balanced ? "UP" : "DOWN");

        if (!balanced) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkSupplyInvariant() {
        BigInteger sumOfBalances = tokenLedger.balances().values().stream()
            .reduce(BigInteger.ZERO, BigInteger::add);
        return sumOfBalances.equals(tokenLedger.totalSupply());
    }
}
