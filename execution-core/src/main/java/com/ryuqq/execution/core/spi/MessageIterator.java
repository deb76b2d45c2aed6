package com.ryuqq.execution.core.spi;

import java.io.IOException;
import java.util.Optional;

/**
 * 블로킹 메시지 이터레이터.
 *
 * <p>{@link #next()}는 다음 메시지가 올 때까지 대기하며, 스트림이 정상 종료되면
 * {@link Optional#empty()}를 반환합니다. 대기 중 인터럽트는 취소 신호입니다.</p>
 *
 * @param <T> 메시지 타입
 * @author Execution Team
 * @since 1.0.0
 */
public interface MessageIterator<T> extends AutoCloseable {

    /**
     * 다음 메시지.
     *
     * @return 메시지 (스트림 종료 시 empty)
     * @throws IOException 연결 끊김 등 I/O 오류
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    Optional<T> next() throws IOException, InterruptedException;

    /**
     * 스트림 자원 해제 (멱등).
     */
    @Override
    void close();
}
