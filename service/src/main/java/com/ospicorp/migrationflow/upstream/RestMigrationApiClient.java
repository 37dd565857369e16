package com.ospicorp.migrationflow.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.migrationflow.flow.model.MigrationResponse;
import com.ospicorp.migrationflow.location.model.LocationCatalog;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Service
public class RestMigrationApiClient implements MigrationApiClient {
  private static final Logger log = LoggerFactory.getLogger(RestMigrationApiClient.class);
  static final String MIGRATIONS_PATH = "/api/v1/migrations";
  static final String METADATA_PATH = "/api/v1/metadata";

  private final RestTemplate restTemplate;
  private final ObjectMapper mapper;
  private final String baseUrl;

  public RestMigrationApiClient(RestTemplate restTemplate,
      ObjectMapper mapper,
      @Value("${migration.api.url:http://localhost:2020}") String baseUrl) {
    this.restTemplate = restTemplate;
    this.mapper = mapper;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  @Override
  public MigrationResponse getMigrationData(MigrationQuery query) {
    String payload;
    try {
      payload = mapper.writeValueAsString(buildRequestBody(query));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialise migration query", e);
    }
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    HttpEntity<String> entity = new HttpEntity<>(payload, headers);

    log.debug("Requesting {} migration data for {} location(s), {} to {}",
        query.scale().code(), query.locationIds().size(), query.startDate(), query.endDate());
    JsonNode body = call(baseUrl + MIGRATIONS_PATH, HttpMethod.POST, entity);
    return UpstreamPayloadReader.readMigrationResponse(body);
  }

  @Override
  public LocationCatalog getMetadata() {
    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    JsonNode body = call(baseUrl + METADATA_PATH, HttpMethod.GET, new HttpEntity<>(headers));
    return UpstreamPayloadReader.readCatalog(body);
  }

  private JsonNode call(String url, HttpMethod method, HttpEntity<?> entity) {
    try {
      ResponseEntity<JsonNode> response = restTemplate.exchange(url, method, entity,
          JsonNode.class);
      return response.getBody();
    } catch (HttpStatusCodeException e) {
      int status = e.getStatusCode().value();
      log.warn("Migration API {} {} returned {}", method, url, status);
      throw new UpstreamApiException("Migration API responded with status " + status, status, e);
    } catch (ResourceAccessException e) {
      log.warn("Migration API {} {} unreachable: {}", method, url, e.getMessage());
      throw new UpstreamApiException("Migration API is unreachable", 0, e);
    } catch (RestClientException e) {
      log.warn("Migration API {} {} failed: {}", method, url, e.getMessage());
      throw new UpstreamApiException("Migration API returned an unreadable response", 0, e);
    }
  }

  static Map<String, Object> buildRequestBody(MigrationQuery query) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("scale", query.scale().code());
    if (query.startDate() != null) {
      body.put("start_date", query.startDate().toString());
      body.put("end_date", query.endDate().toString());
    }
    if (!query.locationIds().isEmpty()) {
      String key = switch (query.scale()) {
        case PROVINCE -> "provinces";
        case DISTRICT -> "districts";
        case SUBDISTRICT -> "subdistricts";
      };
      body.put(key, query.locationIds());
    }
    body.put("aggregation", query.aggregation().code());
    body.put("include_flows", query.includeFlows());
    return body;
  }
}
