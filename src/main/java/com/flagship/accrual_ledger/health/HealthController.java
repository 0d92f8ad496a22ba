package com.flagship.accrual_ledger.health;

import com.flagship.accrual_ledger.config.LedgerProperties;
import com.flagship.accrual_ledger.tax.TaxTable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 *
 * The ledger keeps no external state, so being up means the configuration was accepted
 * at startup; the response echoes what was loaded.
 */
@RestController
public class HealthController {

    private final LedgerProperties properties;
    private final TaxTable taxTable;

    public HealthController(LedgerProperties properties, TaxTable taxTable) {
        this.properties = properties;
        this.taxTable = taxTable;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("currency", properties.getCurrency().name());
        response.put("zone", properties.getZone());
        response.put("taxCategories", taxTable.getCategories().size());
        return ResponseEntity.ok(response);
    }
}
