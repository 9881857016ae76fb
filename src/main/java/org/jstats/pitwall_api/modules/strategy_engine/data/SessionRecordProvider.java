package org.jstats.pitwall_api.modules.strategy_engine.data;

import java.util.List;

/**
 * Source of observed per-lap session records. Implementations never throw for an unavailable
 * session; they return an empty list instead.
 */
public interface SessionRecordProvider {

    List<RawSessionRecord> fetchSession(int sessionKey);
}
