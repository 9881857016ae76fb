package org.jstats.pitwall_api.modules.strategy_engine.model;

import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelStatus;

import java.util.List;

public record ModelStatusResponse(List<ModelStatus> models) {}
