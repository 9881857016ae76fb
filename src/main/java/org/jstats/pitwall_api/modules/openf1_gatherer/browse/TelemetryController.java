package org.jstats.pitwall_api.modules.openf1_gatherer.browse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Comparison;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.DriverSummary;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Intervals;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Laps;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.PitStops;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.RaceControl;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Stints;
import org.jstats.pitwall_api.modules.openf1_gatherer.browse.TelemetryViews.Weather;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Telemetry", description = "Per-session laps, stints, gaps, weather and pit stops from OpenF1")
@RestController
@RequestMapping("/api/telemetry")
public class TelemetryController {

    private final TelemetryService telemetry;

    public TelemetryController(TelemetryService telemetry) {
        this.telemetry = telemetry;
    }

    @Operation(summary = "Lap and sector times")
    @GetMapping("/laps")
    public Laps laps(@RequestParam("session_key") int sessionKey,
                     @RequestParam(name = "driver_number", required = false) @Nullable Integer driverNumber) {
        return telemetry.laps(sessionKey, driverNumber);
    }

    @Operation(summary = "Tire stints")
    @GetMapping("/stints")
    public Stints stints(@RequestParam("session_key") int sessionKey,
                         @RequestParam(name = "driver_number", required = false) @Nullable Integer driverNumber) {
        return telemetry.stints(sessionKey, driverNumber);
    }

    @Operation(summary = "Latest gap per driver")
    @GetMapping("/intervals")
    public Intervals intervals(@RequestParam("session_key") int sessionKey) {
        return telemetry.intervals(sessionKey);
    }

    @Operation(summary = "Weather timeline and latest reading")
    @GetMapping("/weather")
    public Weather weather(@RequestParam("session_key") int sessionKey) {
        return telemetry.weather(sessionKey);
    }

    @Operation(summary = "Race control messages")
    @GetMapping("/race-control")
    public RaceControl raceControl(@RequestParam("session_key") int sessionKey,
                                   @RequestParam(required = false) @Nullable String category) {
        return telemetry.raceControl(sessionKey, category);
    }

    @Operation(summary = "Pit stops")
    @GetMapping("/pit-stops")
    public PitStops pitStops(@RequestParam("session_key") int sessionKey,
                             @RequestParam(name = "driver_number", required = false) @Nullable Integer driverNumber) {
        return telemetry.pitStops(sessionKey, driverNumber);
    }

    @Operation(summary = "One driver's laps, stints and pit stops")
    @GetMapping("/driver/{driverNumber}/summary")
    public DriverSummary driverSummary(@PathVariable int driverNumber,
                                       @RequestParam("session_key") int sessionKey) {
        return telemetry.driverSummary(sessionKey, driverNumber);
    }

    @Operation(summary = "Side-by-side lap statistics, drivers given as a comma-separated list")
    @GetMapping("/comparison")
    public Comparison comparison(@RequestParam("session_key") int sessionKey,
                                 @RequestParam List<Integer> drivers) {
        return telemetry.comparison(sessionKey, drivers);
    }
}
