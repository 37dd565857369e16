package com.ospicorp.migrationflow.upstream;

import com.ospicorp.migrationflow.flow.model.MigrationResponse;
import com.ospicorp.migrationflow.location.model.LocationCatalog;

/**
 * Migration data API. Implementations must be safe to call concurrently; identical queries are
 * expected to return identical data.
 */
public interface MigrationApiClient {

  MigrationResponse getMigrationData(MigrationQuery query);

  LocationCatalog getMetadata();
}
