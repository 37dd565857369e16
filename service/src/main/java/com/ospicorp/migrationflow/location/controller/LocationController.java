package com.ospicorp.migrationflow.location.controller;

import com.ospicorp.migrationflow.flow.model.LocationType;
import com.ospicorp.migrationflow.location.model.CachedCatalog;
import com.ospicorp.migrationflow.location.model.LocationSearchResult;
import com.ospicorp.migrationflow.location.service.LocationCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.ArrayList;
import java.util.List;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/locations")
@Tag(name = "Locations")
public class LocationController {
  private final LocationCatalogService catalog;

  public LocationController(LocationCatalogService catalog) {
    this.catalog = catalog;
  }

  @GetMapping("/search")
  @Operation(summary = "Search locations",
      description = "Case-insensitive match on name, code or id across the location catalog.")
  public LocationSearchResult search(
      @RequestParam @Parameter(description = "Search text", example = "bang") String q,
      @RequestParam(required = false)
      @Parameter(description = "Comma separated: province,district,subDistrict") String types) {
    return catalog.searchLocations(q, parseTypes(types));
  }

  @GetMapping("/metadata")
  @Operation(summary = "Location catalog",
      description = "Provinces, districts, subdistricts and available periods.")
  public CachedCatalog metadata() {
    return catalog.getMetadata();
  }

  private static List<LocationType> parseTypes(String types) {
    if (!StringUtils.hasText(types)) {
      return List.of();
    }
    List<LocationType> out = new ArrayList<>();
    for (String token : types.split(",")) {
      if (StringUtils.hasText(token)) {
        out.add(LocationType.fromCode(token));
      }
    }
    return out;
  }
}
