package com.foo.sheetsync.mapping;

import com.foo.sheetsync.config.SheetSyncProperties;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 동기화에 참여하는 워크시트를 제목으로 고른다. */
@Slf4j
@Component
public class SheetTitleFilter {

  private final SheetSyncProperties properties;
  private final Set<String> excluded;

  public SheetTitleFilter(SheetSyncProperties properties) {
    this.properties = properties;
    this.excluded =
        properties.getExcludedSheets().stream()
            .map(HeaderNormalizer::normalizeHeader)
            .collect(Collectors.toUnmodifiableSet());
  }

  public boolean participates(String title) {
    if (title == null) {
      return false;
    }
    if (properties.hasSheetPrefix()) {
      return title.startsWith(properties.getSheetPrefix());
    }
    return !excluded.contains(HeaderNormalizer.normalizeHeader(title));
  }

  public boolean isFallbackSheet(String title) {
    return HeaderNormalizer.normalizeHeader(title)
        .equals(HeaderNormalizer.normalizeHeader(properties.getFallbackSheetTitle()));
  }
}
