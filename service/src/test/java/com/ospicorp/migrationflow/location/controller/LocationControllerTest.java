package com.ospicorp.migrationflow.location.controller;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.migrationflow.admin.AdminController;
import com.ospicorp.migrationflow.flow.model.LocationType;
import com.ospicorp.migrationflow.location.model.CachedCatalog;
import com.ospicorp.migrationflow.location.model.LocationCatalog;
import com.ospicorp.migrationflow.location.model.LocationSearchResult;
import com.ospicorp.migrationflow.location.model.Province;
import com.ospicorp.migrationflow.location.service.LocationCatalogCache;
import com.ospicorp.migrationflow.location.service.LocationCatalogService;
import com.ospicorp.migrationflow.upstream.UpstreamApiException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({LocationController.class, AdminController.class})
class LocationControllerTest {

  @Autowired
  private MockMvc mvc;

  @MockBean
  private LocationCatalogService catalog;

  @MockBean
  private LocationCatalogCache cache;

  @Test
  void searchParsesTypes() throws Exception {
    when(catalog.searchLocations(eq("bang"), eq(List.of(LocationType.PROVINCE, LocationType.SUB_DISTRICT))))
        .thenReturn(new LocationSearchResult(
            List.of(new Province("10", "Bangkok", "BKK", "Central")), List.of(), List.of()));

    mvc.perform(get("/v1/locations/search").param("q", "bang").param("types", "province,subDistrict"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.provinces[0].name").value("Bangkok"));
  }

  @Test
  void unknownTypeIsBadRequest() throws Exception {
    mvc.perform(get("/v1/locations/search").param("q", "bang").param("types", "country"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void metadataCarriesCacheFlag() throws Exception {
    when(catalog.getMetadata()).thenReturn(new CachedCatalog(
        new LocationCatalog(List.of(), List.of(), List.of(), null), true));

    mvc.perform(get("/v1/locations/metadata"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.from_cache").value(true));
  }

  @Test
  void upstreamFailureIsBadGateway() throws Exception {
    when(catalog.getMetadata()).thenThrow(new UpstreamApiException("Migration API is unreachable", 0));

    mvc.perform(get("/v1/locations/metadata"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.detail").value("Migration API is unreachable"));
  }

  @Test
  void invalidateIsAccepted() throws Exception {
    mvc.perform(post("/admin/catalog/invalidate"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("catalog invalidated"));
    verify(cache).invalidate();
  }
}
