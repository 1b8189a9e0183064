package com.foo.sheetsync.config;

/** 원격 호출 전에 감지되는 설정 오류. 해당 작업은 아무것도 수행하지 않고 중단된다. */
public class SheetSyncConfigurationException extends IllegalStateException {

  public SheetSyncConfigurationException(String message) {
    super(message);
  }
}
