package org.jstats.pitwall_api.modules.openf1_gatherer.ingest;

import org.jspecify.annotations.NullMarked;

/**
 * An OpenF1 resource queried by session key, with the array type its body decodes to.
 */
@NullMarked
public record OpenF1Endpoint<T>(String resource, Class<T[]> arrayType) {

    public static final OpenF1Endpoint<OpenF1Payload.Session> SESSIONS =
            new OpenF1Endpoint<>("sessions", OpenF1Payload.Session[].class);
    public static final OpenF1Endpoint<OpenF1Payload.Driver> DRIVERS =
            new OpenF1Endpoint<>("drivers", OpenF1Payload.Driver[].class);
    public static final OpenF1Endpoint<OpenF1Payload.Lap> LAPS =
            new OpenF1Endpoint<>("laps", OpenF1Payload.Lap[].class);
    public static final OpenF1Endpoint<OpenF1Payload.Stint> STINTS =
            new OpenF1Endpoint<>("stints", OpenF1Payload.Stint[].class);
    public static final OpenF1Endpoint<OpenF1Payload.Weather> WEATHER =
            new OpenF1Endpoint<>("weather", OpenF1Payload.Weather[].class);
    public static final OpenF1Endpoint<OpenF1Payload.Interval> INTERVALS =
            new OpenF1Endpoint<>("intervals", OpenF1Payload.Interval[].class);
    public static final OpenF1Endpoint<OpenF1Payload.Position> POSITIONS =
            new OpenF1Endpoint<>("position", OpenF1Payload.Position[].class);
    public static final OpenF1Endpoint<OpenF1Payload.PitStop> PIT_STOPS =
            new OpenF1Endpoint<>("pit", OpenF1Payload.PitStop[].class);
    public static final OpenF1Endpoint<OpenF1Payload.RaceControl> RACE_CONTROL =
            new OpenF1Endpoint<>("race_control", OpenF1Payload.RaceControl[].class);
}
