package com.ospicorp.migrationflow.flow.model;

public record PeriodOption(String id, String label) {}
