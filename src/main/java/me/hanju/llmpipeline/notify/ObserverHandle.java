package me.hanju.llmpipeline.notify;

/**
 * 구독 해지에만 쓰이는 불투명 토큰. 동일성(identity)으로 비교됩니다.
 */
public final class ObserverHandle {

  private final long id;

  ObserverHandle(final long id) {
    this.id = id;
  }

  @Override
  public String toString() {
    return "ObserverHandle#" + id;
  }
}
