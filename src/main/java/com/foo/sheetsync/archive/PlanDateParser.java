package com.foo.sheetsync.archive;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * 시트에 사람이 입력한 계획 날짜를 해석한다.
 *
 * <p>알려진 월 약어 오타를 먼저 고친 뒤 고정 형식들을 순서대로 시도하고, 모두 실패하면 일반적인 형식들로 다시 시도한다. 해석할 수 없으면 empty.
 */
@Component
public class PlanDateParser {

  /** 앞뒤가 영문자가 아닌 단독 토큰만 고친다. "September" 같은 완전한 월 이름은 건드리지 않는다. */
  private static final Map<Pattern, String> MONTH_TYPOS = new LinkedHashMap<>();

  static {
    MONTH_TYPOS.put(monthToken("Sept"), "Sep");
    MONTH_TYPOS.put(monthToken("Okt"), "Oct");
    MONTH_TYPOS.put(monthToken("Des"), "Dec");
  }

  private static final List<DateTimeFormatter> LITERAL_FORMATS =
      List.of(
          formatter("d MMM yy"),
          formatter("d MMM yyyy"),
          formatter("d-MMM-yyyy"),
          formatter("d-MMM-yy"),
          formatter("yyyy/M/d"));

  /** 연도가 없는 "5Jan" 형식. 연도는 현재 연도로 채운다. */
  private static final String DAY_MONTH_PATTERN = "dMMM";

  private static final List<DateTimeFormatter> GENERAL_DATE_FORMATS =
      List.of(
          DateTimeFormatter.ISO_LOCAL_DATE,
          formatter("M/d/yyyy"),
          formatter("d MMMM yyyy"),
          formatter("MMM d, yyyy"),
          formatter("MMMM d, yyyy"),
          formatter("yyyy.M.d"));

  private static final List<DateTimeFormatter> GENERAL_DATE_TIME_FORMATS =
      List.of(
          DateTimeFormatter.ISO_LOCAL_DATE_TIME,
          formatter("yyyy-MM-dd HH:mm:ss"),
          formatter("M/d/yyyy H:mm:ss"));

  private final Clock clock;

  public PlanDateParser(Clock clock) {
    this.clock = clock;
  }

  public Optional<LocalDate> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }

    String text = raw;
    for (Map.Entry<Pattern, String> typo : MONTH_TYPOS.entrySet()) {
      text = typo.getKey().matcher(text).replaceAll(typo.getValue());
    }
    text = text.strip();

    for (DateTimeFormatter format : LITERAL_FORMATS) {
      Optional<LocalDate> parsed = tryDate(text, format);
      if (parsed.isPresent()) {
        return parsed;
      }
    }

    Optional<LocalDate> dayMonth = tryDate(text, dayMonthFormatter());
    if (dayMonth.isPresent()) {
      return dayMonth;
    }

    for (DateTimeFormatter format : GENERAL_DATE_FORMATS) {
      Optional<LocalDate> parsed = tryDate(text, format);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    for (DateTimeFormatter format : GENERAL_DATE_TIME_FORMATS) {
      Optional<LocalDate> parsed = tryDateTime(text, format);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return Optional.empty();
  }

  private DateTimeFormatter dayMonthFormatter() {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(DAY_MONTH_PATTERN)
        .parseDefaulting(ChronoField.YEAR, LocalDate.now(clock).getYear())
        .toFormatter(Locale.ENGLISH);
  }

  private static Optional<LocalDate> tryDate(String text, DateTimeFormatter format) {
    try {
      return Optional.of(LocalDate.parse(text, format));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Optional<LocalDate> tryDateTime(String text, DateTimeFormatter format) {
    try {
      return Optional.of(LocalDateTime.parse(text, format).toLocalDate());
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Pattern monthToken(String token) {
    return Pattern.compile("(?<![A-Za-z])" + token + "(?![A-Za-z])");
  }

  private static DateTimeFormatter formatter(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.ENGLISH);
  }
}
