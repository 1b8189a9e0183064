package com.foo.sheetsync.util;

/** 1-based 행/열 위치와 A1 주소("B4") 사이의 변환. */
public final class A1Notation {

  private static final int ALPHABET = 26;

  private A1Notation() {}

  /** (4, 2) -> "B4", (10, 27) -> "AA10" */
  public static String rowColToA1(int row, int col) {
    if (row < 1 || col < 1) {
      throw new IllegalArgumentException("Row and column must be 1-based: " + row + ", " + col);
    }
    StringBuilder letters = new StringBuilder();
    for (int remaining = col; remaining > 0; remaining = (remaining - 1) / ALPHABET) {
      letters.append((char) ('A' + (remaining - 1) % ALPHABET));
    }
    return letters.reverse().append(row).toString();
  }

  /** "B4" -> {4, 2}. 소문자와 앞뒤 공백은 허용한다. */
  public static int[] a1ToRowCol(String address) {
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("Cell address is empty");
    }
    String trimmed = address.strip().toUpperCase();
    int col = 0;
    int split = 0;
    for (; split < trimmed.length(); split++) {
      char c = trimmed.charAt(split);
      if (c < 'A' || c > 'Z') {
        break;
      }
      col = col * ALPHABET + (c - 'A' + 1);
    }
    if (split == 0 || split == trimmed.length()) {
      throw new IllegalArgumentException("Invalid cell address: " + address);
    }
    int row;
    try {
      row = Integer.parseInt(trimmed.substring(split));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid cell address: " + address, e);
    }
    if (row < 1) {
      throw new IllegalArgumentException("Invalid cell address: " + address);
    }
    return new int[] {row, col};
  }
}
