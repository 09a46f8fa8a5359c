package com.openforge.scanmate.scan;

import com.openforge.scanmate.activity.ActivityLog;
import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.fetch.FetchedPage;
import com.openforge.scanmate.fetch.PageFetcher;
import com.openforge.scanmate.fetch.RedirectProbe;
import com.openforge.scanmate.llm.GenerationOptions;
import com.openforge.scanmate.llm.ModelClient;
import com.openforge.scanmate.llm.model.Message;
import com.openforge.scanmate.store.ScanRecord;
import com.openforge.scanmate.store.SessionStore;
import com.openforge.scanmate.support.TextLimits;
import com.openforge.scanmate.task.OperationContext;
import com.openforge.scanmate.task.OperationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.List;

/**
 * Four-stage scan of one URL.
 *
 *   REDIRECT_CHECK ──► CONTENT_FETCH ──► ANALYZE ──► COMPLETE
 *        │                  │                │
 *        │ never fails      │ fetch error    │ timeout / error / cancel
 *        │ (unknown on      ▼                ▼
 *        │  error/timeout) FAILED      degraded report if redirects are known,
 *        │                             otherwise FAILED
 *        ▼
 *   cancelled here → CANCELLED / TIMED_OUT, nothing persisted
 *
 * Once the redirect check has produced definite information, any later
 * cancellation or analysis failure still yields a (degraded) report, and
 * that report is persisted like a full one.
 */
@Slf4j
@Service
public class ScanPipeline {

    private final PageFetcher              fetcher;
    private final ModelClient              modelClient;
    private final SessionStore             store;
    private final ActivityLog              activityLog;
    private final Clock                    clock;
    private final GatewayProperties.Scan   limits;

    public ScanPipeline(PageFetcher fetcher,
                        ModelClient modelClient,
                        SessionStore store,
                        ActivityLog activityLog,
                        Clock clock,
                        GatewayProperties properties) {
        this.fetcher     = fetcher;
        this.modelClient = modelClient;
        this.store       = store;
        this.activityLog = activityLog;
        this.clock       = clock;
        this.limits      = properties.scan();
    }

    /** Runs inside an orchestrated operation; {@code user} is already validated. */
    public OperationOutcome<ScanReport> run(String user, URI target, OperationContext ctx) {
        String url = target.toString();

        // ── 1. Redirect check ────────────────────────────────────────────────
        enter(url, ScanStage.REDIRECT_CHECK);
        if (ctx.isCancelled()) {
            return ctx.interruption();
        }
        OperationOutcome<RedirectProbe> probe = ctx.await("Redirect check",
                () -> fetcher.probeRedirects(target, limits.probeRequestTimeout()),
                limits.redirectCheckTimeout());
        if (!probe.isOk() && ctx.isCancelled()) {
            return ctx.interruption();
        }
        RedirectInfo redirects = redirectInfo(target, probe);
        log.debug("[Scan] {} redirects: {}", url, redirects.description());

        // ── 2. Content fetch ─────────────────────────────────────────────────
        enter(url, ScanStage.CONTENT_FETCH);
        if (ctx.isCancelled()) {
            return degradedOrInterrupted(user, url, redirects, null, ctx.interruption());
        }
        OperationOutcome<FetchedPage> fetched = ctx.await("Content fetch",
                () -> fetcher.fetch(redirects.finalUrl(), limits.fetchRequestTimeout()),
                limits.contentFetchTimeout());
        if (!fetched.isOk()) {
            if (ctx.isCancelled()) {
                return degradedOrInterrupted(user, url, redirects, null, ctx.interruption());
            }
            enter(url, ScanStage.FAILED);
            activityLog.record(user, "URLScan error: " + fetched.message());
            return fetched.withMessage("Failed to fetch URL content: " + fetched.message()).propagate();
        }
        FetchedPage page = fetched.payload();
        String content = ScanPrompts.analysableContent(page.body(), page.status(), limits.contentLimit());
        log.debug("[Scan] {} fetched status={} content-length={}", url, page.status(), content.length());

        // ── 3. Analyze ───────────────────────────────────────────────────────
        enter(url, ScanStage.ANALYZE);
        if (ctx.isCancelled()) {
            return degradedOrInterrupted(user, url, redirects, page.status(), ctx.interruption());
        }
        List<Message> prompt = List.of(
                Message.system(ScanPrompts.INSTRUCTION),
                Message.user(ScanPrompts.payload(url, redirects.description(), page.status(), content)));
        OperationOutcome<String> analysis = ctx.await("Analysis",
                () -> modelClient.generate(prompt, GenerationOptions.SCAN), ctx.remaining());
        if (!analysis.isOk()) {
            log.warn("[Scan] {} analysis {}: {}", url, analysis.status(), analysis.message());
            return degradedOrInterrupted(user, url, redirects, page.status(), analysisFailure(analysis));
        }

        // ── 4. Complete ──────────────────────────────────────────────────────
        String report = ScanPrompts.normaliseReport(analysis.payload(), limits.reportLimit());
        return complete(user, url, redirects, page.status(), report, false);
    }

    private RedirectInfo redirectInfo(URI target, OperationOutcome<RedirectProbe> probe) {
        return switch (probe.status()) {
            case OK        -> RedirectInfo.fromProbe(probe.payload());
            case TIMED_OUT -> RedirectInfo.timedOut(target);
            default        -> RedirectInfo.failed(target);
        };
    }

    private OperationOutcome<ScanReport> degradedOrInterrupted(String user,
                                                               String url,
                                                               RedirectInfo redirects,
                                                               Integer statusCode,
                                                               OperationOutcome<?> failure) {
        if (!redirects.known()) {
            enter(url, ScanStage.FAILED);
            activityLog.record(user, "URLScan error: " + failure.message());
            return failure.propagate();
        }
        log.info("[Scan] {} interrupted ({}), returning degraded report", url, failure.status());
        return complete(user, url, redirects, statusCode, ScanPrompts.degradedReport(url, redirects.description()), true);
    }

    private OperationOutcome<ScanReport> complete(String user,
                                                  String url,
                                                  RedirectInfo redirects,
                                                  Integer statusCode,
                                                  String report,
                                                  boolean degraded) {
        store.appendScan(user, new ScanRecord(url, redirects.description(), statusCode, report, clock.instant()));
        activityLog.record(user, "URLScan (%s): %s".formatted(url, TextLimits.preview(report, 200)));
        enter(url, ScanStage.COMPLETE);
        return OperationOutcome.ok(new ScanReport(report, url, degraded));
    }

    private static OperationOutcome<?> analysisFailure(OperationOutcome<String> analysis) {
        return switch (analysis.status()) {
            case TIMED_OUT -> analysis.withMessage("Scan timed out. The URL may be too complex or unresponsive.");
            case CANCELLED -> analysis;
            default        -> analysis.withMessage("Failed to scan URL: " + analysis.message());
        };
    }

    private static void enter(String url, ScanStage stage) {
        log.debug("[Scan] {} → {}", url, stage);
    }
}
