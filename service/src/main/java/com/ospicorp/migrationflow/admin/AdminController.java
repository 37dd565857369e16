package com.ospicorp.migrationflow.admin;

import com.ospicorp.migrationflow.location.service.LocationCatalogCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@Tag(name = "Admin")
public class AdminController {
  private final LocationCatalogCache catalogCache;

  public AdminController(LocationCatalogCache catalogCache) {
    this.catalogCache = catalogCache;
  }

  @PostMapping("/catalog/invalidate")
  @Operation(summary = "Drop the cached location catalog; the next read refetches it")
  public ResponseEntity<Map<String, String>> invalidateCatalog() {
    catalogCache.invalidate();
    return ResponseEntity.accepted().body(Map.of("status", "catalog invalidated"));
  }
}
