package com.ospicorp.migrationflow.flow.service;

import com.ospicorp.migrationflow.flow.model.FlowEdge;
import com.ospicorp.migrationflow.flow.model.FlowNode;
import com.ospicorp.migrationflow.flow.model.LocationInfo;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Derives per-location totals for a flow diagram from the flows of a single period. */
public final class FlowNodeAggregator {
  private FlowNodeAggregator() {
  }

  public static List<FlowNode> nodesForPeriod(List<FlowEdge> flows, String periodId) {
    if (flows == null || periodId == null) return List.of();
    Map<String, long[]> totals = new LinkedHashMap<>();
    Map<String, LocationInfo> locations = new LinkedHashMap<>();
    for (FlowEdge flow : flows) {
      if (!periodId.equals(flow.periodId()) || flow.origin() == null || flow.destination() == null) {
        continue;
      }
      long magnitude = Math.abs(flow.flowCount());
      locations.putIfAbsent(flow.origin().id(), flow.origin());
      locations.putIfAbsent(flow.destination().id(), flow.destination());
      totals.computeIfAbsent(flow.origin().id(), id -> new long[2])[1] += magnitude;
      totals.computeIfAbsent(flow.destination().id(), id -> new long[2])[0] += magnitude;
    }
    List<FlowNode> out = new ArrayList<>(totals.size());
    for (var e : totals.entrySet()) {
      out.add(new FlowNode(locations.get(e.getKey()), e.getValue()[0], e.getValue()[1]));
    }
    return out;
  }
}
