package com.propertyintel.insights.config;

import com.propertyintel.insights.model.MetricKind;
import com.propertyintel.insights.model.TriggerSource;
import com.propertyintel.insights.output.MetricsCsvExporter;
import com.propertyintel.insights.scheduler.TriggerCoordinator;
import com.propertyintel.insights.scheduler.TriggerResult;
import com.propertyintel.insights.service.MetricsQueryService;
import com.propertyintel.insights.service.SyncPreconditionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.StringWriter;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class SyncController {

    private final TriggerCoordinator coordinator;
    private final MetricsQueryService metricsQueryService;
    private final MetricsCsvExporter csvExporter;

    // ── Sync triggers ─────────────────────────────────────────────────────────

    /**
     * Start a sync for one account in the background.
     *
     * POST /api/v1/accounts/{accountId}/sync
     *
     * 202 when accepted, 409 when a run is already in flight, 404 for an unknown
     * account, 400 when the account is inactive or lacks credentials.
     */
    @PostMapping("/accounts/{accountId}/sync")
    public ResponseEntity<Map<String, String>> triggerSync(@PathVariable String accountId) {
        try {
            TriggerResult result = coordinator.trigger(accountId, TriggerSource.MANUAL);
            return switch (result.outcome()) {
                case ACCEPTED -> ResponseEntity.accepted().body(
                        Map.of("message", "Sync initiated in background", "account_id", accountId));
                case DROPPED -> ResponseEntity.status(HttpStatus.CONFLICT).body(conflict(accountId));
                case REJECTED -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                        Map.of("error", "Service is shutting down", "account_id", accountId));
            };
        } catch (SyncPreconditionException e) {
            return preconditionFailure(e);
        }
    }

    private Map<String, String> conflict(String accountId) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", "Sync already in progress");
        body.put("account_id", accountId);
        coordinator.runningSince(accountId).ifPresent(since -> body.put("running_since", since.toString()));
        return body;
    }

    @GetMapping("/sync/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "in_flight", coordinator.inFlight(),
                "stopping", coordinator.isStopping()
        ));
    }

    // ── Metrics export ────────────────────────────────────────────────────────

    /**
     * Export stored metrics for an account.
     *
     * GET /api/v1/accounts/{accountId}/metrics/export?start_date=2025-11-01&end_date=2025-11-08&format=csv&metric_type=all
     *
     * Rows whose scrape_date is in [start_date, end_date).
     */
    @GetMapping("/accounts/{accountId}/metrics/export")
    public ResponseEntity<?> export(
            @PathVariable String accountId,
            @RequestParam("start_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("end_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(defaultValue = "json") String format,
            @RequestParam(name = "metric_type", defaultValue = "all") String metricType) {
        try {
            if (!format.equals("json") && !format.equals("csv")) {
                throw new IllegalArgumentException("format must be csv or json");
            }
            boolean all = metricType.equalsIgnoreCase("all");
            List<MetricKind> kinds = all ? Arrays.asList(MetricKind.values()) : List.of(MetricKind.fromApiName(metricType));

            List<Map<String, Object>> rows = metricsQueryService.export(accountId, kinds, startDate, endDate, all);
            if (format.equals("json")) {
                return ResponseEntity.ok(rows);
            }

            StringWriter csv = new StringWriter();
            csvExporter.write(metricsQueryService.headers(kinds, all), rows, csv);
            String filename = String.format("%s_%s_%s_to_%s.csv", accountId, metricType.toLowerCase(), startDate, endDate);
            return ResponseEntity.ok()
                    .contentType(new MediaType("text", "csv"))
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                    .body(csv.toString());

        } catch (SyncPreconditionException e) {
            return preconditionFailure(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Metrics export failed for {}: {}", accountId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    private ResponseEntity<Map<String, String>> preconditionFailure(SyncPreconditionException e) {
        HttpStatus status = e.getReason() == SyncPreconditionException.Reason.NOT_FOUND
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(Map.of("error", e.getMessage(), "account_id", e.getAccountId()));
    }
}
