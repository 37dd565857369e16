package com.ospicorp.migrationflow.location.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ospicorp.migrationflow.flow.model.LocationRef;
import com.ospicorp.migrationflow.flow.model.LocationType;
import com.ospicorp.migrationflow.location.model.CachedCatalog;
import com.ospicorp.migrationflow.location.model.CatalogTimePeriods;
import com.ospicorp.migrationflow.location.model.District;
import com.ospicorp.migrationflow.location.model.LocationCatalog;
import com.ospicorp.migrationflow.location.model.LocationSearchResult;
import com.ospicorp.migrationflow.location.model.Province;
import com.ospicorp.migrationflow.location.model.Subdistrict;
import com.ospicorp.migrationflow.period.BoundaryMode;
import com.ospicorp.migrationflow.period.DateWindow;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LocationCatalogServiceTest {
  private static final LocationCatalog CATALOG = new LocationCatalog(
      List.of(new Province("10", "Bangkok", "BKK", "Central"),
          new Province("50", "Chiang Mai", "CNX", "North")),
      List.of(new District("1001", "Phra Nakhon", "10"), new District("5001", "Mueang Chiang Mai", "50")),
      List.of(new Subdistrict("100101", "Phra Borom Maha Ratchawang", "1001")),
      new CatalogTimePeriods(LocalDate.of(2019, 1, 1), LocalDate.of(2022, 12, 31), List.of()));

  private final LocationCatalogCache cache = mock(LocationCatalogCache.class);
  private final LocationCatalogService service = new LocationCatalogService(cache);

  @BeforeEach
  void setUp() {
    when(cache.get()).thenReturn(new CachedCatalog(CATALOG, true));
  }

  @Test
  void searchMatchesNamesAndCodesAcrossTypes() {
    LocationSearchResult result = service.searchLocations("chiang", null);

    assertThat(result.provinces()).extracting(Province::id).containsExactly("50");
    assertThat(result.districts()).extracting(District::id).containsExactly("5001");
    assertThat(service.searchLocations("bkk", List.of(LocationType.PROVINCE)).provinces())
        .extracting(Province::name).containsExactly("Bangkok");
  }

  @Test
  void searchCanBeLimitedToTypes() {
    LocationSearchResult result = service.searchLocations("chiang", List.of(LocationType.DISTRICT));

    assertThat(result.provinces()).isEmpty();
    assertThat(result.districts()).hasSize(1);
  }

  @Test
  void blankQueryIsRejected() {
    assertThatThrownBy(() -> service.searchLocations(" ", null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void hierarchyLookups() {
    assertThat(service.findProvinceById("10")).map(Province::name).contains("Bangkok");
    assertThat(service.findDistrictById("nope")).isEmpty();
    assertThat(service.getDistrictsByProvince("50")).extracting(District::id).containsExactly("5001");
    assertThat(service.getSubdistrictsByDistrict("1001")).hasSize(1);
  }

  @Test
  void resolveApiIdTriesNameThenCodeThenSearch() {
    assertThat(service.resolveApiId(new LocationRef("x", "bangkok", LocationType.PROVINCE)))
        .contains("10");
    assertThat(service.resolveApiId(new LocationRef("x", "CNX", LocationType.PROVINCE)))
        .contains("50");
    assertThat(service.resolveApiId(new LocationRef("x", "Phra", LocationType.DISTRICT)))
        .contains("1001");
    assertThat(service.resolveApiId(new LocationRef("x", "Atlantis", LocationType.PROVINCE)))
        .isEmpty();
  }

  @Test
  void defaultDateRangeComesFromCatalog() {
    DateWindow window = service.defaultDateRange();

    assertThat(window.start()).isEqualTo(LocalDate.of(2019, 1, 1));
    assertThat(window.end()).isEqualTo(LocalDate.of(2022, 12, 31));
    assertThat(window.boundaryMode()).isEqualTo(BoundaryMode.INCLUSIVE_END);
  }

  @Test
  void missingDateRangeIsNotFound() {
    when(cache.get()).thenReturn(new CachedCatalog(
        new LocationCatalog(List.of(), List.of(), List.of(), null), false));

    assertThatThrownBy(service::defaultDateRange).isInstanceOf(NoSuchElementException.class);
  }
}
