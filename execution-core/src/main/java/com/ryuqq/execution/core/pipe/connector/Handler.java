package com.ryuqq.execution.core.pipe.connector;

import com.ryuqq.execution.core.pipe.PipeHandlerException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * 파이프라인 단계에서 입력 하나를 0개 이상의 출력으로 바꾸는 핸들러.
 *
 * <p>변형은 닫혀 있습니다:</p>
 * <ul>
 *   <li>{@link Transform}: 입력 하나 → 출력 하나 (동기)</li>
 *   <li>{@link AsyncTransform}: 입력 하나 → 출력 하나 ({@link CompletionStage} 완료 대기)</li>
 *   <li>{@link Generator}: 입력 하나 → 출력 여러 개 ({@link Iterable})</li>
 *   <li>{@link Emitter}: 입력 하나 → 생성되는 즉시 출력을 밀어넣는 스트리밍 방식</li>
 * </ul>
 *
 * <p>어떤 변형이든 출력 순서는 생성 순서 그대로 유지됩니다.
 * Transform/AsyncTransform이 null을 돌려주면 출력 없이 건너뜁니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Execution Team
 * @since 1.0.0
 */
public sealed interface Handler<I, O>
    permits Handler.Transform, Handler.AsyncTransform, Handler.Generator, Handler.Emitter {

    /**
     * 입력을 처리하여 출력을 out으로 전달.
     *
     * @param input 입력
     * @param out 출력 수신자
     * @throws InterruptedException 출력 전달 또는 비동기 완료 대기 중 인터럽트 발생 시
     * @throws PipeHandlerException 핸들러가 checked 예외로 실패한 경우
     */
    void apply(I input, Output<? super O> out) throws InterruptedException;

    /**
     * 입력을 그대로 전달하는 핸들러.
     */
    static <T> Handler<T, T> identity() {
        return new Transform<>(Function.identity());
    }

    static <I, O> Handler<I, O> transform(Function<? super I, ? extends O> function) {
        return new Transform<>(function);
    }

    static <I, O> Handler<I, O> async(Function<? super I, ? extends CompletionStage<? extends O>> function) {
        return new AsyncTransform<>(function);
    }

    static <I, O> Handler<I, O> generator(Function<? super I, ? extends Iterable<? extends O>> function) {
        return new Generator<>(function);
    }

    static <I, O> Handler<I, O> emitter(EmitFunction<I, O> function) {
        return new Emitter<>(function);
    }

    /**
     * 핸들러 출력 수신자.
     *
     * @param <O> 출력 타입
     */
    @FunctionalInterface
    interface Output<O> {
        void accept(O value) throws InterruptedException;
    }

    /**
     * 스트리밍 방식 생성 함수.
     *
     * @param <I> 입력 타입
     * @param <O> 출력 타입
     */
    @FunctionalInterface
    interface EmitFunction<I, O> {
        void emit(I input, Output<? super O> out) throws Exception;
    }

    record Transform<I, O>(Function<? super I, ? extends O> function) implements Handler<I, O> {

        public Transform {
            requireFunction(function);
        }

        @Override
        public void apply(I input, Output<? super O> out) throws InterruptedException {
            O value = function.apply(input);
            if (value != null) {
                out.accept(value);
            }
        }
    }

    record AsyncTransform<I, O>(Function<? super I, ? extends CompletionStage<? extends O>> function)
        implements Handler<I, O> {

        public AsyncTransform {
            requireFunction(function);
        }

        @Override
        public void apply(I input, Output<? super O> out) throws InterruptedException {
            CompletableFuture<? extends O> future = function.apply(input).toCompletableFuture();
            O value;
            try {
                value = future.get();
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                throw unwrap(e.getCause());
            }
            if (value != null) {
                out.accept(value);
            }
        }
    }

    record Generator<I, O>(Function<? super I, ? extends Iterable<? extends O>> function)
        implements Handler<I, O> {

        public Generator {
            requireFunction(function);
        }

        @Override
        public void apply(I input, Output<? super O> out) throws InterruptedException {
            for (O value : function.apply(input)) {
                out.accept(value);
            }
        }
    }

    record Emitter<I, O>(EmitFunction<I, O> function) implements Handler<I, O> {

        public Emitter {
            requireFunction(function);
        }

        @Override
        public void apply(I input, Output<? super O> out) throws InterruptedException {
            try {
                function.emit(input, out);
            } catch (InterruptedException | RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw unwrap(e);
            }
        }
    }

    private static void requireFunction(Object function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new PipeHandlerException("Pipeline handler failed: " + cause, cause);
    }
}
