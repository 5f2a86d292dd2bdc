package me.hanju.llmpipeline.notify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import lombok.extern.slf4j.Slf4j;
import me.hanju.llmpipeline.exception.ObserverException;
import me.hanju.llmpipeline.spi.notify.EventObserver;

/**
 * 하나의 이벤트를 여러 구독자에게 전달하는 발행자.
 *
 * <p>
 * 구독 순서대로 전달하며, 각 publish는 시작 시점의 구독자 스냅샷을 대상으로 합니다.
 * publish 도중의 구독/해지는 다음 publish부터 반영됩니다.
 * 지난 이벤트를 보관하지 않으므로 늦게 구독한 구독자는 이전 이벤트를 받지 않습니다.
 *
 * @param <T> 이벤트 타입
 */
@Slf4j
public class Notifier<T> {

  private final List<Subscription<T>> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicLong handleSequence = new AtomicLong();

  /**
   * 구독자를 추가합니다.
   *
   * @param observer 구독자
   * @return 구독 해지용 핸들
   */
  public ObserverHandle subscribe(final EventObserver<? super T> observer) {
    Objects.requireNonNull(observer, "observer");
    final ObserverHandle handle = new ObserverHandle(handleSequence.incrementAndGet());
    subscriptions.add(new Subscription<>(handle, observer));
    log.debug("[NOTIFIER] Subscribed | handle={} | subscribers={}", handle, subscriptions.size());
    return handle;
  }

  /**
   * 구독을 해지합니다. 이미 해지된 핸들이면 아무 일도 하지 않습니다.
   *
   * @return 실제로 해지되었으면 true
   */
  public boolean unsubscribe(final ObserverHandle handle) {
    final boolean removed = subscriptions.removeIf(s -> s.handle == handle);
    if (removed) {
      log.debug("[NOTIFIER] Unsubscribed | handle={} | subscribers={}", handle, subscriptions.size());
    }
    return removed;
  }

  public int getSubscriberCount() {
    return subscriptions.size();
  }

  /**
   * 현재 구독자 스냅샷에 이벤트를 전달합니다.
   * 구독자가 실패해도 나머지 구독자에게는 계속 전달하며, 실패는 결과에 기록됩니다.
   *
   * @param payload 이벤트
   * @return 전달 결과
   */
  public PublishOutcome publish(final T payload) {
    int delivered = 0;
    final List<ObserverException> failures = new ArrayList<>();

    for (final Subscription<T> subscription : subscriptions) {
      try {
        subscription.observer.onEvent(payload);
        delivered++;
      } catch (RuntimeException e) {
        log.warn("[NOTIFIER] Observer failed | handle={} | error={}", subscription.handle, e.getMessage(), e);
        failures.add(new ObserverException(subscription.handle, e));
      }
    }

    return new PublishOutcome(delivered, List.copyOf(failures));
  }

  private static final class Subscription<T> {
    private final ObserverHandle handle;
    private final EventObserver<? super T> observer;

    private Subscription(final ObserverHandle handle, final EventObserver<? super T> observer) {
      this.handle = handle;
      this.observer = observer;
    }
  }
}
