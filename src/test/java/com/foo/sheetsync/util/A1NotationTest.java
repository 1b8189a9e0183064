package com.foo.sheetsync.util;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class A1NotationTest {

  @ParameterizedTest
  @CsvSource({
    "1, 1, A1",
    "4, 2, B4",
    "3, 26, Z3",
    "10, 27, AA10",
    "250, 52, AZ250",
    "7, 53, BA7",
    "2, 703, AAA2"
  })
  void rowColToA1_convertsOneBasedPosition(int row, int col, String expected) {
    assertThat(A1Notation.rowColToA1(row, col)).isEqualTo(expected);
    assertThat(A1Notation.a1ToRowCol(expected)).containsExactly(row, col);
  }

  @Test
  void rowColToA1_zeroRowOrColumn_throws() {
    assertThatThrownBy(() -> A1Notation.rowColToA1(0, 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> A1Notation.rowColToA1(1, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void a1ToRowCol_lowerCaseAndSpaces_accepted() {
    assertThat(A1Notation.a1ToRowCol(" c7 ")).containsExactly(7, 3);
  }

  @ParameterizedTest
  @CsvSource({"A", "12", "A0", "A-1", "1A", "A1B", "É1"})
  void a1ToRowCol_malformed_throws(String address) {
    assertThatThrownBy(() -> A1Notation.a1ToRowCol(address))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
