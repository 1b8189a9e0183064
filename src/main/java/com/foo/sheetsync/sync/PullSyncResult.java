package com.foo.sheetsync.sync;

/**
 * pull-sync 한 번의 결과.
 *
 * @param total 중복 제거 후 들어온 식별자 수
 */
public record PullSyncResult(int created, int updated, int softDeleted, int total) {

  public static PullSyncResult empty() {
    return new PullSyncResult(0, 0, 0, 0);
  }
}
