package com.ospicorp.migrationflow.location.service;

import com.ospicorp.migrationflow.flow.model.LocationRef;
import com.ospicorp.migrationflow.flow.model.LocationType;
import com.ospicorp.migrationflow.location.model.CachedCatalog;
import com.ospicorp.migrationflow.location.model.CatalogTimePeriods;
import com.ospicorp.migrationflow.location.model.District;
import com.ospicorp.migrationflow.location.model.LocationCatalog;
import com.ospicorp.migrationflow.location.model.LocationSearchResult;
import com.ospicorp.migrationflow.location.model.Province;
import com.ospicorp.migrationflow.location.model.Subdistrict;
import com.ospicorp.migrationflow.period.DateWindow;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class LocationCatalogService {
  private static final Logger log = LoggerFactory.getLogger(LocationCatalogService.class);

  private final LocationCatalogCache cache;

  public LocationCatalogService(LocationCatalogCache cache) {
    this.cache = cache;
  }

  public CachedCatalog getMetadata() {
    return cache.get();
  }

  public LocationSearchResult searchLocations(String query, Collection<LocationType> types) {
    if (!StringUtils.hasText(query)) {
      throw new IllegalArgumentException("q must be provided");
    }
    Set<LocationType> wanted = types == null || types.isEmpty()
        ? EnumSet.allOf(LocationType.class)
        : EnumSet.copyOf(types);
    String needle = query.trim().toLowerCase(Locale.ROOT);
    LocationCatalog catalog = cache.get().catalog();

    List<Province> provinces = !wanted.contains(LocationType.PROVINCE) ? List.of()
        : catalog.provinces().stream()
            .filter(p -> contains(p.name(), needle) || contains(p.code(), needle)
                || contains(p.id(), needle))
            .toList();
    List<District> districts = !wanted.contains(LocationType.DISTRICT) ? List.of()
        : catalog.districts().stream()
            .filter(d -> contains(d.name(), needle) || contains(d.id(), needle))
            .toList();
    List<Subdistrict> subdistricts = !wanted.contains(LocationType.SUB_DISTRICT) ? List.of()
        : catalog.subdistricts().stream()
            .filter(s -> contains(s.name(), needle) || contains(s.id(), needle))
            .toList();
    return new LocationSearchResult(provinces, districts, subdistricts);
  }

  public Optional<Province> findProvinceById(String id) {
    return cache.get().catalog().provinces().stream().filter(p -> Objects.equals(id, p.id()))
        .findFirst();
  }

  public Optional<District> findDistrictById(String id) {
    return cache.get().catalog().districts().stream().filter(d -> Objects.equals(id, d.id()))
        .findFirst();
  }

  public Optional<Subdistrict> findSubdistrictById(String id) {
    return cache.get().catalog().subdistricts().stream().filter(s -> Objects.equals(id, s.id()))
        .findFirst();
  }

  public List<District> getDistrictsByProvince(String provinceId) {
    return cache.get().catalog().districts().stream()
        .filter(d -> provinceId.equals(d.provinceId()))
        .toList();
  }

  public List<Subdistrict> getSubdistrictsByDistrict(String districtId) {
    return cache.get().catalog().subdistricts().stream()
        .filter(s -> districtId.equals(s.districtId()))
        .toList();
  }

  /**
   * Maps a caller location to the migration API's own id: exact name (ignoring case) first, then
   * province code, then the first search hit.
   */
  public Optional<String> resolveApiId(LocationRef location) {
    if (location == null || !StringUtils.hasText(location.name()) || location.type() == null) {
      return Optional.empty();
    }
    LocationCatalog catalog = cache.get().catalog();
    String name = location.name().trim();
    Optional<String> resolved = switch (location.type()) {
      case PROVINCE -> catalog.provinces().stream()
          .filter(p -> name.equalsIgnoreCase(p.name()))
          .map(Province::id)
          .findFirst()
          .or(() -> catalog.provinces().stream()
              .filter(p -> name.equalsIgnoreCase(p.code()))
              .map(Province::id)
              .findFirst());
      case DISTRICT -> catalog.districts().stream()
          .filter(d -> name.equalsIgnoreCase(d.name()))
          .map(District::id)
          .findFirst();
      case SUB_DISTRICT -> catalog.subdistricts().stream()
          .filter(s -> name.equalsIgnoreCase(s.name()))
          .map(Subdistrict::id)
          .findFirst();
    };
    if (resolved.isPresent()) {
      return resolved;
    }

    LocationSearchResult hits = searchLocations(name, List.of(location.type()));
    Optional<String> searched = switch (location.type()) {
      case PROVINCE -> hits.provinces().stream().map(Province::id).findFirst();
      case DISTRICT -> hits.districts().stream().map(District::id).findFirst();
      case SUB_DISTRICT -> hits.subdistricts().stream().map(Subdistrict::id).findFirst();
    };
    if (searched.isEmpty()) {
      log.warn("Could not map location {} ({}) to a migration API id", name,
          location.type().code());
    }
    return searched;
  }

  /** The dataset's full coverage as an inclusive window. */
  public DateWindow defaultDateRange() {
    CatalogTimePeriods periods = cache.get().catalog().timePeriods();
    if (periods == null || periods.startDate() == null || periods.endDate() == null) {
      throw new NoSuchElementException("Location catalog does not define a default date range");
    }
    return DateWindow.inclusive(periods.startDate(), periods.endDate());
  }

  private static boolean contains(String value, String needle) {
    return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
  }
}
