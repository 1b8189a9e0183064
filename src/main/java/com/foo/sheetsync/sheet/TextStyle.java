package com.foo.sheetsync.sheet;

/** 셀 글꼴 서식. null 필드는 변경하지 않는다. */
public record TextStyle(Integer fontSize, String linkUri, Rgb foregroundColor) {

  public static TextStyle annotated(int fontSize, String linkUri) {
    return new TextStyle(fontSize, linkUri, null);
  }

  /** 0.0 ~ 1.0 범위의 RGB 색상. */
  public record Rgb(double red, double green, double blue) {

    public Rgb {
      if (!inRange(red) || !inRange(green) || !inRange(blue)) {
        throw new IllegalArgumentException("Color components must be within [0, 1]");
      }
    }

    private static boolean inRange(double value) {
      return value >= 0.0 && value <= 1.0;
    }
  }
}
