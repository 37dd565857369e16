package com.ospicorp.migrationflow.flow.service;

import com.ospicorp.migrationflow.flow.model.LocationInfo;
import com.ospicorp.migrationflow.flow.model.LocationRef;
import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public enum MatchPolicy implements LocationMatcher {
  /** Names must be identical. */
  EXACT {
    @Override
    public boolean matches(LocationRef requested, LocationInfo upstream) {
      return requested.name() != null && requested.name().equals(upstream.name());
    }
  },
  /** Trimmed names compared ignoring case. */
  CASE_INSENSITIVE {
    @Override
    public boolean matches(LocationRef requested, LocationInfo upstream) {
      return requested.name() != null && upstream.name() != null
          && requested.name().trim().equalsIgnoreCase(upstream.name().trim());
    }
  },
  /**
   * Names compared without case, accents, punctuation or spacing; falls back to comparing ids
   * with any {@code th-} prefix and leading zeros removed.
   */
  NORMALIZED {
    @Override
    public boolean matches(LocationRef requested, LocationInfo upstream) {
      String left = normalizeName(requested.name());
      if (!left.isEmpty() && left.equals(normalizeName(upstream.name()))) {
        return true;
      }
      String id = normalizeId(requested.id());
      return !id.isEmpty() && id.equals(normalizeId(upstream.id()));
    }
  };

  private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
  private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

  public static MatchPolicy fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("match policy must be provided");
    }
    try {
      return MatchPolicy.valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Invalid match policy " + code + ". Supported values: exact,case_insensitive,normalized.");
    }
  }

  static String normalizeName(String name) {
    if (name == null) return "";
    String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD);
    String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
    return NON_ALNUM.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll("");
  }

  static String normalizeId(String id) {
    if (id == null) return "";
    String value = id.trim().toLowerCase(Locale.ROOT);
    if (value.startsWith("th-")) {
      value = value.substring(3);
    }
    return value.replaceFirst("^0+", "");
  }
}
