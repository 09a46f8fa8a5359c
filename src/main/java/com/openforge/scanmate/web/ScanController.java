package com.openforge.scanmate.web;

import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.scan.ScanPipeline;
import com.openforge.scanmate.scan.ScanReport;
import com.openforge.scanmate.scan.ScanTargets;
import com.openforge.scanmate.store.ScanRecord;
import com.openforge.scanmate.store.SessionStore;
import com.openforge.scanmate.store.UserIds;
import com.openforge.scanmate.task.OperationKind;
import com.openforge.scanmate.task.OperationOutcome;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Endpoints:
 *   POST /api/scan     {user, url} → {status, data:{response, url}}
 *   GET  /scan/{user}              → {scan_pages:[{page, result}, ...]}
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ScanController {

    public record ScanBody(
            @NotBlank(message = "Missing 'user' or 'url'") String user,
            @NotBlank(message = "Missing 'user' or 'url'") String url
    ) {}

    public record ScanPage(String page, String result) {}

    public record ScanPagesResponse(List<ScanPage> scanPages) {}

    private final ScanPipeline      scanPipeline;
    private final SessionStore      store;
    private final OperationRunner   runner;
    private final GatewayProperties properties;

    @PostMapping("/api/scan")
    public ResponseEntity<ApiResponse> scan(@Valid @RequestBody ScanBody body) {
        String user   = UserIds.validate(body.user());
        URI    target = ScanTargets.strict(body.url());

        OperationOutcome<ScanReport> outcome = runner.run(user, OperationKind.SCAN,
                ctx -> scanPipeline.run(user, target, ctx), properties.scan().deadline());
        log.info("[HTTP] Scan of {} for {} → {}", target, user, outcome.status());
        return OperationRunner.respond(outcome,
                report -> Map.of("response", report.response(), "url", report.url()));
    }

    @GetMapping("/scan/{user}")
    public ScanPagesResponse scanHistory(@PathVariable String user) {
        List<ScanRecord> scans = store.loadScans(UserIds.validate(user));
        return new ScanPagesResponse(scans.stream()
                .map(scan -> new ScanPage(scan.page(), scan.result()))
                .toList());
    }
}
