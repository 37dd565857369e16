package com.ospicorp.migrationflow.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.migrationflow.flow.model.Aggregation;
import com.ospicorp.migrationflow.flow.model.FlowEdge;
import com.ospicorp.migrationflow.flow.model.LocationInfo;
import com.ospicorp.migrationflow.flow.model.LocationSeries;
import com.ospicorp.migrationflow.flow.model.MigrationResponse;
import com.ospicorp.migrationflow.flow.model.MigrationStats;
import com.ospicorp.migrationflow.flow.model.ResponseMetadata;
import com.ospicorp.migrationflow.flow.model.Scale;
import com.ospicorp.migrationflow.flow.model.TimePeriod;
import com.ospicorp.migrationflow.location.model.CatalogTimePeriods;
import com.ospicorp.migrationflow.location.model.District;
import com.ospicorp.migrationflow.location.model.LocationCatalog;
import com.ospicorp.migrationflow.location.model.Province;
import com.ospicorp.migrationflow.location.model.Subdistrict;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads migration API payloads leniently. Shape problems are carried into the model (a missing
 * {@code data} array becomes a {@code null} location list, a series without a location keeps a
 * {@code null} location) so the aggregator can report them instead of the client failing.
 */
final class UpstreamPayloadReader {
  private UpstreamPayloadReader() {
  }

  static MigrationResponse readMigrationResponse(JsonNode body) {
    if (body == null || !body.isObject()) {
      return null;
    }
    List<LocationSeries> locations = null;
    JsonNode data = body.path("data");
    if (data.isArray()) {
      locations = new ArrayList<>(data.size());
      for (JsonNode item : data) {
        locations.add(readSeries(item));
      }
    }
    List<TimePeriod> periods = new ArrayList<>();
    for (JsonNode period : body.path("time_periods")) {
      TimePeriod parsed = readPeriod(period);
      if (parsed != null) {
        periods.add(parsed);
      }
    }
    List<FlowEdge> flows = new ArrayList<>();
    for (JsonNode flow : body.path("flows")) {
      if (flow.isObject()) {
        flows.add(new FlowEdge(
            readLocation(flow.path("origin")),
            readLocation(flow.path("destination")),
            flow.path("time_period_id").asText(null),
            flow.path("flow_count").asLong(0),
            flow.hasNonNull("flow_rate") ? flow.path("flow_rate").asDouble() : null));
      }
    }
    return new MigrationResponse(readMetadata(body.path("metadata")), periods, locations, flows);
  }

  static LocationCatalog readCatalog(JsonNode body) {
    if (body == null || !body.isObject()) {
      throw new UpstreamApiException("Metadata response is not a JSON object", 502);
    }
    List<Province> provinces = new ArrayList<>();
    for (JsonNode p : body.path("provinces")) {
      provinces.add(new Province(p.path("id").asText(null), p.path("name").asText(null),
          p.path("code").asText(null), p.path("region").asText(null)));
    }
    List<District> districts = new ArrayList<>();
    for (JsonNode d : body.path("districts")) {
      districts.add(new District(d.path("id").asText(null), d.path("name").asText(null),
          d.path("province_id").asText(null)));
    }
    List<Subdistrict> subdistricts = new ArrayList<>();
    for (JsonNode s : body.path("subdistricts")) {
      subdistricts.add(new Subdistrict(s.path("id").asText(null), s.path("name").asText(null),
          s.path("district_id").asText(null)));
    }
    CatalogTimePeriods timePeriods = null;
    JsonNode tp = body.path("time_periods");
    if (tp.isObject()) {
      List<TimePeriod> available = new ArrayList<>();
      for (JsonNode period : tp.path("available_periods")) {
        TimePeriod parsed = readPeriod(period);
        if (parsed != null) {
          available.add(parsed);
        }
      }
      timePeriods = new CatalogTimePeriods(readDate(tp.path("start_date")),
          readDate(tp.path("end_date")), available);
    }
    return new LocationCatalog(provinces, districts, subdistricts, timePeriods);
  }

  private static LocationSeries readSeries(JsonNode item) {
    JsonNode location = item.path("location");
    Map<String, MigrationStats> series = new LinkedHashMap<>();
    JsonNode timeSeries = item.path("time_series");
    Iterator<Map.Entry<String, JsonNode>> fields = timeSeries.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode stats = field.getValue();
      if (!stats.isObject()) continue;
      Long net = stats.hasNonNull("net_migration") ? stats.path("net_migration").asLong() : null;
      series.put(field.getKey(), new MigrationStats(stats.path("move_in").asLong(0),
          stats.path("move_out").asLong(0), net));
    }
    return new LocationSeries(location.isObject() ? readLocation(location) : null, series);
  }

  private static LocationInfo readLocation(JsonNode node) {
    if (!node.isObject()) return null;
    return new LocationInfo(node.path("id").asText(null), node.path("name").asText(null),
        node.path("code").asText(null), node.path("parent_id").asText(null));
  }

  private static TimePeriod readPeriod(JsonNode node) {
    String id = node.path("id").asText(null);
    if (id == null) return null;
    return new TimePeriod(id, readDate(node.path("start_date")), readDate(node.path("end_date")));
  }

  private static ResponseMetadata readMetadata(JsonNode node) {
    if (!node.isObject()) return null;
    return new ResponseMetadata(
        readEnum(node.path("scale"), Scale.class),
        readDate(node.path("start_date")),
        readDate(node.path("end_date")),
        node.path("total_records").asLong(0),
        readEnum(node.path("aggregation"), Aggregation.class));
  }

  // ISO dates, or date-times truncated to their date
  static LocalDate readDate(JsonNode node) {
    String text = node.asText(null);
    if (text == null || text.isBlank()) return null;
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException ex) {
      try {
        return DateTimeFormatter.ISO_DATE_TIME.parse(text, LocalDate::from);
      } catch (DateTimeParseException nested) {
        return null;
      }
    }
  }

  private static <E extends Enum<E>> E readEnum(JsonNode node, Class<E> type) {
    String text = node.asText(null);
    if (text == null) return null;
    for (E constant : type.getEnumConstants()) {
      if (constant.name().equalsIgnoreCase(text.trim())) {
        return constant;
      }
    }
    return null;
  }
}
