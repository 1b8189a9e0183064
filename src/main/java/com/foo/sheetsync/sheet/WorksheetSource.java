package com.foo.sheetsync.sheet;

import java.io.IOException;

/**
 * 외부 스프레드시트 문서에 대한 세션 팩토리.
 *
 * <p>최상위 작업 하나당 세션 하나를 열고 작업이 끝나면 닫는다. 연결 풀링은 가정하지 않는다.
 */
public interface WorksheetSource {

  SpreadsheetDocument open(String documentLocator) throws IOException;
}
