package org.jstats.pitwall_api.modules.openf1_gatherer.browse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.Circuits;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.DriverList;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.SessionDetail;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.SessionList;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.SessionSummary;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.Standings;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.SessionViews.Years;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session discovery. The keys listed here are the {@code session_keys} accepted by model training.
 */
@Tag(name = "Sessions", description = "Browse OpenF1 sessions, drivers and standings")
@Validated
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionBrowseService sessions;

    public SessionController(SessionBrowseService sessions) {
        this.sessions = sessions;
    }

    @Operation(
            summary = "List sessions, newest first",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "400", description = "Limit out of range",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping
    public SessionList list(@RequestParam(required = false) @Nullable Integer year,
                            @RequestParam(required = false) @Nullable String country,
                            @RequestParam(name = "session_type", required = false) @Nullable String sessionType,
                            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
                            @RequestParam(name = "include_future", defaultValue = "false") boolean includeFuture) {
        return sessions.sessions(year, country, sessionType, limit, includeFuture);
    }

    @Operation(summary = "The most recent session")
    @GetMapping("/latest")
    public SessionSummary latest() {
        return sessions.latest();
    }

    @Operation(summary = "Years with session data")
    @GetMapping("/years")
    public Years years() {
        return sessions.years();
    }

    @Operation(summary = "Circuits raced, optionally for one year")
    @GetMapping("/circuits")
    public Circuits circuits(@RequestParam(required = false) @Nullable Integer year) {
        return sessions.circuits(year);
    }

    @Operation(
            summary = "Session metadata with data volumes",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "404", description = "Unknown session",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/{sessionKey}")
    public SessionDetail session(@PathVariable int sessionKey) {
        return sessions.session(sessionKey);
    }

    @Operation(summary = "Drivers entered in a session")
    @GetMapping("/{sessionKey}/drivers")
    public DriverList drivers(@PathVariable int sessionKey) {
        return sessions.drivers(sessionKey);
    }

    @Operation(summary = "Running order by latest gap to the leader")
    @GetMapping("/{sessionKey}/standings")
    public Standings standings(@PathVariable int sessionKey) {
        return sessions.standings(sessionKey);
    }
}
