package com.ospicorp.migrationflow.location.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationCatalog(
    List<Province> provinces,
    List<District> districts,
    List<Subdistrict> subdistricts,
    @JsonProperty("time_periods") CatalogTimePeriods timePeriods
) {

  public LocationCatalog {
    provinces = provinces == null ? List.of() : List.copyOf(provinces);
    districts = districts == null ? List.of() : List.copyOf(districts);
    subdistricts = subdistricts == null ? List.of() : List.copyOf(subdistricts);
  }
}
