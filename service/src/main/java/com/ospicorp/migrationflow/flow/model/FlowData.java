package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record FlowData(
    List<PeriodOption> periods,
    List<FlowEdge> flows,
    @JsonProperty("top_flows") List<FlowEdge> topFlows,
    Map<String, List<FlowNode>> nodes
) {}
