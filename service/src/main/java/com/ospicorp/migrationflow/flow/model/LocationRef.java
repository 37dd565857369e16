package com.ospicorp.migrationflow.flow.model;

/** A location as selected by the caller; {@code id} lives in the caller's namespace. */
public record LocationRef(String id, String name, LocationType type) {}
