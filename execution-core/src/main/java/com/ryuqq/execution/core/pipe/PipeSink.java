package com.ryuqq.execution.core.pipe;

/**
 * Pipe의 생산자 측 인터페이스.
 *
 * @param <T> 데이터 타입
 * @author Execution Team
 * @since 1.0.0
 */
public interface PipeSink<T> {

    /**
     * 기본 설정(즉시 실패)으로 put.
     *
     * @param item 데이터
     * @throws PipeStoppedException stop() 이후인 경우
     * @throws PipeSentinelException SENTINEL을 넣으려 한 경우
     * @throws PipeFullException 버퍼가 가득 찬 경우
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    default void put(T item) throws InterruptedException {
        put(item, PutOptions.defaults());
    }

    /**
     * 재시도 설정을 지정하여 put.
     *
     * @param item 데이터
     * @param options 재시도 설정
     * @throws PipeStoppedException stop() 이후인 경우
     * @throws PipeSentinelException SENTINEL을 넣으려 한 경우
     * @throws PipeFullException 재시도 예산 소진 후에도 가득 찬 경우
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void put(T item, PutOptions options) throws InterruptedException;

    /**
     * 더 이상 데이터가 없음을 알림 (멱등).
     */
    void stop();

    boolean isFull();

    boolean isStopped();
}
