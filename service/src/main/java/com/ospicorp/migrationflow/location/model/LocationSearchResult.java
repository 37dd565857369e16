package com.ospicorp.migrationflow.location.model;

import java.util.List;

public record LocationSearchResult(
    List<Province> provinces,
    List<District> districts,
    List<Subdistrict> subdistricts
) {}
