package com.ospicorp.migrationflow.period;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves period identifiers to the first day of the month they denote.
 *
 * <p>Accepted formats, tried in order:
 * <ol>
 *   <li>three-letter month and two-digit year, e.g. {@code oct19} (always 20yy)</li>
 *   <li>{@code YYYY-MM}</li>
 *   <li>{@code YYYY-MM-DD}, resolved to the month containing that day</li>
 *   <li>ISO date-times and labels such as {@code Oct 2019}</li>
 * </ol>
 * Anything else resolves to {@code null}.
 */
public final class PeriodParser {
  private static final String[] MONTH_LABELS = {
      "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"
  };

  private static final Pattern MONTH_CODE = Pattern.compile("^([A-Za-z]{3})(\\d{2})$");
  private static final Pattern YEAR_MONTH = Pattern.compile("^(\\d{4})-(\\d{1,2})$");
  private static final Pattern YEAR_MONTH_DAY = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
  private static final Pattern MONTH_NAME_YEAR = Pattern.compile("^([A-Za-z]{3,9})\\.?\\s+(\\d{4})$");

  private PeriodParser() {
  }

  public static LocalDate parsePeriod(String id) {
    if (id == null) return null;
    String value = id.trim();
    if (value.isEmpty()) return null;

    Matcher m = MONTH_CODE.matcher(value);
    if (m.matches()) {
      int month = monthFromCode(m.group(1));
      if (month > 0) {
        return LocalDate.of(2000 + Integer.parseInt(m.group(2)), month, 1);
      }
    }

    m = YEAR_MONTH.matcher(value);
    if (m.matches()) {
      return firstOfMonth(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), 1);
    }

    m = YEAR_MONTH_DAY.matcher(value);
    if (m.matches()) {
      return firstOfMonth(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
          Integer.parseInt(m.group(3)));
    }

    return parseFallback(value);
  }

  public static String formatPeriod(String id) {
    LocalDate date = parsePeriod(id);
    return date == null ? id : formatDate(date);
  }

  public static String formatDate(LocalDate date) {
    return MONTH_LABELS[date.getMonthValue() - 1] + " " + date.getYear();
  }

  /**
   * Label for a period spanning {@code start..end}; a single month renders as one label.
   * Returns {@code null} if either bound is missing.
   */
  public static String formatRange(LocalDate start, LocalDate end) {
    if (start == null || end == null) return null;
    if (start.getYear() == end.getYear() && start.getMonth() == end.getMonth()) {
      return formatDate(start);
    }
    return formatDate(start) + " - " + formatDate(end);
  }

  private static int monthFromCode(String code) {
    for (int i = 0; i < MONTH_LABELS.length; i++) {
      if (MONTH_LABELS[i].equalsIgnoreCase(code)) {
        return i + 1;
      }
    }
    return -1;
  }

  private static LocalDate firstOfMonth(int year, int month, int day) {
    try {
      return LocalDate.of(year, month, day).withDayOfMonth(1);
    } catch (DateTimeException ex) {
      return null;
    }
  }

  private static LocalDate parseFallback(String value) {
    Matcher m = MONTH_NAME_YEAR.matcher(value);
    if (m.matches()) {
      String name = m.group(1).toUpperCase(Locale.ROOT);
      for (Month month : Month.values()) {
        if (month.name().startsWith(name)) {
          return LocalDate.of(Integer.parseInt(m.group(2)), month, 1);
        }
      }
      return null;
    }
    try {
      return DateTimeFormatter.ISO_DATE_TIME.parse(value, LocalDate::from).withDayOfMonth(1);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }
}
