package me.hanju.llmpipeline.spi.notify;

/**
 * {@link me.hanju.llmpipeline.notify.Notifier}가 발행하는 이벤트를 받는 구독자.
 *
 * @param <T> 이벤트 타입
 */
@FunctionalInterface
public interface EventObserver<T> {

  void onEvent(T payload);
}
