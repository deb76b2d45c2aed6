package com.ryuqq.execution.core.pipe;

import java.time.Duration;
import java.util.List;

/**
 * Pipe의 소비자 측 인터페이스.
 *
 * @param <T> 데이터 타입
 * @author Execution Team
 * @since 1.0.0
 */
public interface PipeSource<T> {

    /**
     * 가장 오래된 원소를 꺼냄. 비어있으면 원소나 SENTINEL이 올 때까지 대기.
     *
     * @return 데이터 원소 또는 SENTINEL
     * @throws InterruptedException 대기 중 인터럽트(취소) 발생 시
     * @throws IllegalStateException SENTINEL을 이미 소비한 뒤 호출한 경우
     */
    PipeItem<T> get() throws InterruptedException;

    /**
     * get()으로 꺼낸 원소 하나의 처리가 끝났음을 알림.
     *
     * @throws IllegalStateException 대응하는 원소보다 많이 호출된 경우
     */
    void taskDone();

    /**
     * 들어온 모든 원소가 taskDone 처리될 때까지 대기.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void join() throws InterruptedException;

    /**
     * 제한 시간 동안 join.
     *
     * @param timeout 최대 대기 시간
     * @return 모든 원소가 처리되었으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    boolean join(Duration timeout) throws InterruptedException;

    /**
     * 버퍼에 남은 모든 원소를 원자적으로 꺼냄 (대기 중 SENTINEL 포함).
     *
     * @return 순서가 보존된 불변 리스트
     */
    List<PipeItem<T>> snapshot();

    boolean isEmpty();

    int size();
}
