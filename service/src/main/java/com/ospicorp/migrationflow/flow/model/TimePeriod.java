package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.migrationflow.period.PeriodParser;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimePeriod(
    String id,
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date") LocalDate endDate
) {

  public static TimePeriod of(String id, LocalDate startDate) {
    return new TimePeriod(id, startDate, null);
  }

  /** Calendar month of this period: parsed from the id, else taken from the start date. */
  public LocalDate resolvedDate() {
    LocalDate parsed = PeriodParser.parsePeriod(id);
    if (parsed != null) return parsed;
    return startDate == null ? null : startDate.withDayOfMonth(1);
  }
}
