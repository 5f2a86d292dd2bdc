package me.hanju.llmpipeline.adapter;

import me.hanju.llmpipeline.exception.BackendException;
import me.hanju.llmpipeline.payload.result.CompletionResult;
import me.hanju.llmpipeline.spi.backend.EntryPoint;

/**
 * 모델 ID, 백엔드 인스턴스, 생성 호출을 묶은 바인딩.
 * 백엔드의 응답을 {@link CompletionResult}로 정규화합니다.
 *
 * @param <B> 백엔드 타입
 */
final class AdapterBinding<B> {

  private final String modelId;
  private final B backend;
  private final EntryPoint<? super B> entryPoint;

  AdapterBinding(final String modelId, final B backend, final EntryPoint<? super B> entryPoint) {
    this.modelId = modelId;
    this.backend = backend;
    this.entryPoint = entryPoint;
  }

  CompletionResult call(final String prompt) {
    final Object response;
    try {
      response = entryPoint.call(backend, prompt);
    } catch (BackendException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendException(modelId, "Backend call interrupted", e);
    } catch (Exception e) {
      throw new BackendException(modelId, "Backend call failed: " + e.getMessage(), e);
    }
    return normalize(response);
  }

  private CompletionResult normalize(final Object response) {
    if (response == null) {
      throw new BackendException(modelId, "Backend returned no result");
    }
    if (response instanceof Throwable) {
      final Throwable error = (Throwable) response;
      throw new BackendException(modelId, "Backend reported an error: " + error.getMessage(), error);
    }
    if (response instanceof CompletionResult) {
      final CompletionResult result = (CompletionResult) response;
      return result.getModelId() != null ? result : result.toBuilder().modelId(modelId).build();
    }
    return CompletionResult.builder()
        .modelId(modelId)
        .text(response.toString())
        .raw(response)
        .build();
  }

  @Override
  public String toString() {
    return "AdapterBinding[" + modelId + " -> " + backend.getClass().getName() + "]";
  }
}
