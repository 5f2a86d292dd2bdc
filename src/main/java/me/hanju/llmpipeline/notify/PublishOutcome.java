package me.hanju.llmpipeline.notify;

import java.util.List;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import me.hanju.llmpipeline.exception.ObserverException;

/**
 * 한 번의 publish 결과.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PACKAGE)
@ToString
public class PublishOutcome {

  /**
   * 이벤트를 정상적으로 처리한 구독자 수.
   */
  private final int deliveredCount;

  /**
   * 처리 중 실패한 구독자들의 실패 정보 (구독 순서).
   */
  private final List<ObserverException> failures;

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  public int getAttemptedCount() {
    return deliveredCount + failures.size();
  }
}
