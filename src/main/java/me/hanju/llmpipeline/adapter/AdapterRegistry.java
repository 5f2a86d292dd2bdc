package me.hanju.llmpipeline.adapter;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;

import lombok.extern.slf4j.Slf4j;
import me.hanju.llmpipeline.exception.DuplicateModelException;
import me.hanju.llmpipeline.exception.PipelineTimeoutException;
import me.hanju.llmpipeline.exception.UnknownModelException;
import me.hanju.llmpipeline.payload.result.CompletionResult;
import me.hanju.llmpipeline.spi.backend.EntryPoint;
import me.hanju.llmpipeline.spi.backend.GenerationBackend;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 호출 방식이 서로 다른 백엔드들을 하나의 호출 규약으로 노출하는 레지스트리.
 * 호출자는 모델 ID만으로 백엔드를 호출하며, 백엔드 종류에 따라 분기하지 않습니다.
 *
 * <p>
 * 바인딩 테이블은 등록 시에만 변경되며, 호출은 락 없이 동시에 수행될 수 있습니다.
 */
@Slf4j
public class AdapterRegistry {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  static final String INVOCATION_STAGE = "invocation";

  private final ConcurrentMap<String, AdapterBinding<?>> bindings = new ConcurrentHashMap<>();
  private final Duration defaultTimeout;

  public AdapterRegistry() {
    this(DEFAULT_TIMEOUT);
  }

  public AdapterRegistry(final Duration defaultTimeout) {
    this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
  }

  /**
   * 백엔드를 함수 참조로 등록합니다.
   *
   * @param modelId    모델 ID
   * @param backend    백엔드 인스턴스
   * @param entryPoint 생성 호출 (예: {@code OpenAiModel::query})
   * @throws DuplicateModelException 이미 등록된 모델 ID인 경우
   */
  public <B> void register(final String modelId, final B backend, final EntryPoint<? super B> entryPoint) {
    Objects.requireNonNull(modelId, "modelId");
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(entryPoint, "entryPoint");

    final AdapterBinding<B> binding = new AdapterBinding<>(modelId, backend, entryPoint);
    if (bindings.putIfAbsent(modelId, binding) != null) {
      throw new DuplicateModelException(modelId);
    }
    log.info("[REGISTRY] Backend registered | modelId={} | backend={}", modelId, backend.getClass().getSimpleName());
  }

  /**
   * 백엔드를 메서드 이름으로 등록합니다.
   * 메서드는 등록 시점에 한 번만 찾으며, 호출 시에는 이름으로 다시 찾지 않습니다.
   *
   * @param modelId    모델 ID
   * @param backend    백엔드 인스턴스
   * @param entryPoint {@code String} 하나를 받는 public 메서드 이름
   * @throws IllegalArgumentException 해당 메서드가 없거나 반환값이 없는 경우
   * @throws DuplicateModelException  이미 등록된 모델 ID인 경우
   */
  public void register(final String modelId, final Object backend, final String entryPoint) {
    Objects.requireNonNull(backend, "backend");
    final MethodHandle handle = resolveEntryPoint(backend.getClass(), entryPoint);
    register(modelId, backend, (target, prompt) -> {
      try {
        return handle.invoke(target, prompt);
      } catch (Exception | Error e) {
        throw e;
      } catch (Throwable t) {
        throw new UndeclaredThrowableException(t);
      }
    });
  }

  /**
   * {@link GenerationBackend}를 구현한 백엔드를 등록합니다.
   */
  public void register(final String modelId, final GenerationBackend backend) {
    register(modelId, backend, GenerationBackend::generate);
  }

  /**
   * 바인딩을 제거합니다.
   *
   * @return 제거된 바인딩이 있었으면 true
   */
  public boolean unregister(final String modelId) {
    final boolean removed = bindings.remove(modelId) != null;
    if (removed) {
      log.info("[REGISTRY] Backend unregistered | modelId={}", modelId);
    }
    return removed;
  }

  public boolean isRegistered(final String modelId) {
    return bindings.containsKey(modelId);
  }

  public Set<String> getModelIds() {
    return Set.copyOf(bindings.keySet());
  }

  /**
   * 기본 제한 시간으로 백엔드를 호출합니다 (blocking).
   *
   * @throws UnknownModelException     등록되지 않은 모델인 경우
   * @throws me.hanju.llmpipeline.exception.BackendException 백엔드 호출이 실패한 경우
   * @throws PipelineTimeoutException  제한 시간을 넘긴 경우
   */
  public CompletionResult invoke(final String modelId, final String prompt) {
    return invoke(modelId, prompt, defaultTimeout);
  }

  public CompletionResult invoke(final String modelId, final String prompt, final Duration timeout) {
    return invokeAsync(modelId, prompt, timeout).block();
  }

  public Mono<CompletionResult> invokeAsync(final String modelId, final String prompt) {
    return invokeAsync(modelId, prompt, defaultTimeout);
  }

  /**
   * 백엔드를 비동기로 호출합니다.
   * 구독을 dispose하면 진행 중인 호출이 취소됩니다.
   */
  public Mono<CompletionResult> invokeAsync(final String modelId, final String prompt, final Duration timeout) {
    Objects.requireNonNull(modelId, "modelId");
    Objects.requireNonNull(prompt, "prompt");
    Objects.requireNonNull(timeout, "timeout");
    final AdapterBinding<?> binding = bindings.get(modelId);
    if (binding == null) {
      return Mono.error(new UnknownModelException(modelId));
    }

    return Mono.fromCallable(() -> binding.call(prompt))
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(timeout)
        .onErrorMap(TimeoutException.class, e -> new PipelineTimeoutException(INVOCATION_STAGE, timeout, e))
        .doOnSubscribe(s -> log.debug("[REGISTRY] Invoking backend | modelId={} | promptLength={}",
            modelId, prompt.length()))
        .doOnError(e -> log.warn("[REGISTRY] Backend invocation failed | modelId={} | error={}",
            modelId, e.getMessage()));
  }

  private static MethodHandle resolveEntryPoint(final Class<?> backendType, final String entryPoint) {
    Objects.requireNonNull(entryPoint, "entryPoint");
    final Method method;
    try {
      method = backendType.getMethod(entryPoint, String.class);
    } catch (NoSuchMethodException e) {
      throw new IllegalArgumentException(
          backendType.getName() + " has no public method " + entryPoint + "(String)", e);
    }
    if (method.getReturnType() == void.class) {
      throw new IllegalArgumentException(
          backendType.getName() + "." + entryPoint + "(String) returns no value");
    }
    method.trySetAccessible();
    try {
      return MethodHandles.lookup().unreflect(method);
    } catch (IllegalAccessException e) {
      throw new IllegalArgumentException(
          backendType.getName() + "." + entryPoint + "(String) is not accessible", e);
    }
  }
}
