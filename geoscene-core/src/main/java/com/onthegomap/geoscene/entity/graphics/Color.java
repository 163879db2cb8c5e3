package com.onthegomap.geoscene.entity.graphics;

import java.util.Locale;

/**
 * An immutable RGBA color with each channel in the range {@code [0, 1]}.
 */
public record Color(float red, float green, float blue, float alpha) {

  public static final Color WHITE = new Color(1, 1, 1, 1);
  public static final Color BLACK = new Color(0, 0, 0, 1);
  public static final Color YELLOW = new Color(1, 1, 0, 1);

  public Color {
    checkChannel("red", red);
    checkChannel("green", green);
    checkChannel("blue", blue);
    checkChannel("alpha", alpha);
  }

  private static void checkChannel(String name, float value) {
    if (!(value >= 0 && value <= 1)) {
      throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
    }
  }

  /** Returns a color from channels in the range {@code [0, 255]}. */
  public static Color fromBytes(int red, int green, int blue, int alpha) {
    return new Color(red / 255f, green / 255f, blue / 255f, alpha / 255f);
  }

  /**
   * Parses a CSS hex color: {@code #rgb}, {@code #rrggbb} or {@code #rrggbbaa}.
   *
   * @throws IllegalArgumentException if {@code css} is not one of those forms
   */
  public static Color fromCssHex(String css) {
    String hex = css == null ? "" : css.strip();
    if (hex.startsWith("#")) {
      hex = hex.substring(1);
    }
    try {
      return switch (hex.length()) {
        case 3 -> fromBytes(
          Integer.parseInt(hex.substring(0, 1), 16) * 17,
          Integer.parseInt(hex.substring(1, 2), 16) * 17,
          Integer.parseInt(hex.substring(2, 3), 16) * 17,
          255
        );
        case 6, 8 -> fromBytes(
          Integer.parseInt(hex.substring(0, 2), 16),
          Integer.parseInt(hex.substring(2, 4), 16),
          Integer.parseInt(hex.substring(4, 6), 16),
          hex.length() == 8 ? Integer.parseInt(hex.substring(6, 8), 16) : 255
        );
        default -> throw new IllegalArgumentException("Invalid css color: " + css);
      };
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid css color: " + css, e);
    }
  }

  /** Returns the channels as {@code [0, 255]} integers. */
  public int[] toBytes() {
    return new int[]{
      Math.round(red * 255), Math.round(green * 255), Math.round(blue * 255), Math.round(alpha * 255)
    };
  }

  public String toCssHex() {
    int[] bytes = toBytes();
    return String.format(Locale.ROOT, "#%02x%02x%02x%02x", bytes[0], bytes[1], bytes[2], bytes[3]);
  }
}
