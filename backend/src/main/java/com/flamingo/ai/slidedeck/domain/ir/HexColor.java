package com.flamingo.ai.slidedeck.domain.ir;

import java.awt.Color;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for the IR's color representation: six hex digits, no alpha, stored as lowercase
 * {@code #rrggbb}. Input is accepted in any case, with or without the leading {@code #}.
 */
public final class HexColor {

  /** Canonical stored form, usable in {@code @Pattern} constraints. */
  public static final String CANONICAL_REGEX = "#[0-9a-f]{6}";

  public static final String INVALID_MESSAGE = "must be a 6-digit hex color like #1a73e8";

  private static final Pattern HEX_PATTERN = Pattern.compile("^#?[0-9a-fA-F]{6}$");

  private HexColor() {}

  public static boolean isValid(String value) {
    return value != null && HEX_PATTERN.matcher(value.trim()).matches();
  }

  /**
   * Normalizes a hex color to lowercase {@code #rrggbb}.
   *
   * @throws IllegalArgumentException if the value is not a six-digit hex color
   */
  public static String normalize(String value) {
    if (!isValid(value)) {
      throw new IllegalArgumentException("Not a 6-digit hex color: " + value);
    }
    String trimmed = value.trim();
    String digits = trimmed.startsWith("#") ? trimmed.substring(1) : trimmed;
    return "#" + digits.toLowerCase(Locale.ROOT);
  }

  /**
   * Normalizes a valid color and returns anything else unchanged, leaving the rejection to the
   * {@link #CANONICAL_REGEX} constraint of the holding record.
   */
  public static String canonical(String value) {
    return isValid(value) ? normalize(value) : value;
  }

  public static Color toColor(String value) {
    return new Color(Integer.parseInt(normalize(value).substring(1), 16));
  }

  public static String fromColor(Color color) {
    return String.format("#%02x%02x%02x", color.getRed(), color.getGreen(), color.getBlue());
  }

  /** Formats the three bytes of an OOXML {@code srgbClr} value. */
  public static String fromRgbBytes(byte[] rgb) {
    if (rgb == null || rgb.length != 3) {
      throw new IllegalArgumentException("Expected 3 RGB bytes");
    }
    return String.format("#%02x%02x%02x", rgb[0] & 0xff, rgb[1] & 0xff, rgb[2] & 0xff);
  }
}
