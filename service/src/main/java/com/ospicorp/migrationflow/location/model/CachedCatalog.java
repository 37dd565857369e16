package com.ospicorp.migrationflow.location.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CachedCatalog(
    LocationCatalog catalog,
    @JsonProperty("from_cache") boolean fromCache
) {}
