package com.ospicorp.migrationflow.flow.controller;

import com.ospicorp.migrationflow.config.CsvHttpMessageConverter;
import com.ospicorp.migrationflow.flow.model.ChartData;
import com.ospicorp.migrationflow.flow.model.ChartEntry;
import com.ospicorp.migrationflow.flow.model.ChartRow;
import com.ospicorp.migrationflow.flow.model.FlowData;
import com.ospicorp.migrationflow.flow.model.LocationEntry;
import com.ospicorp.migrationflow.flow.service.MigrationFlowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/migrations")
@Validated
@Tag(name = "Migrations")
public class MigrationController {
  static final String SESSION_HEADER = "X-View-Session";
  private static final String ERROR_DOCS_BASE = "https://docs.migration-flow.dev/errors/";

  private final MigrationFlowService service;

  public MigrationController(MigrationFlowService service) {
    this.service = service;
  }

  @PostMapping("/chart")
  @Operation(summary = "Chart data",
      description = "Per-period move-in/move-out for the selected locations, zero-filled.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Chart entries",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ChartData.class)),
              @Content(mediaType = "text/csv")}),
      @ApiResponse(responseCode = "400", description = "Invalid request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Superseded by a newer request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "502", description = "Migration API failure",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> chart(@Valid @RequestBody ChartRequest request,
      @RequestHeader(value = SESSION_HEADER, required = false)
      @Parameter(description = "View session; a newer request supersedes older ones") String session,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    ChartData data = service.loadChartData(request.toQuery(), session);
    Object body = contentType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)
        ? toRows(data)
        : data;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @PostMapping("/flows")
  @Operation(summary = "Flow diagram data",
      description = "Origin-destination flows, top flows and per-period nodes.")
  public FlowData flows(@Valid @RequestBody ChartRequest request,
      @RequestHeader(value = SESSION_HEADER, required = false) String session) {
    return service.loadFlows(request.toQuery(), session);
  }

  static List<ChartRow> toRows(ChartData data) {
    List<ChartRow> rows = new ArrayList<>();
    for (ChartEntry entry : data.entries()) {
      for (LocationEntry location : entry.locations()) {
        rows.add(new ChartRow(entry.period(), location.locationId(), location.locationName(),
            location.moveIn(), location.moveOut(), location.netMigration()));
      }
    }
    return rows;
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.",
          1001, ERROR_DOCS_BASE + 1001);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
