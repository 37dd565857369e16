package com.ospicorp.migrationflow.flow.service;

import com.ospicorp.migrationflow.flow.model.LocationInfo;
import com.ospicorp.migrationflow.flow.model.LocationRef;

/**
 * Joins a caller-selected location to a location returned by the migration API. The two sides use
 * different id namespaces, so implementations decide what counts as the same place.
 */
@FunctionalInterface
public interface LocationMatcher {

  boolean matches(LocationRef requested, LocationInfo upstream);
}
