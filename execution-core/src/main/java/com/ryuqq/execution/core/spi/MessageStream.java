package com.ryuqq.execution.core.spi;

import java.io.IOException;

/**
 * Message Stream SPI.
 *
 * <p>WebSocket 등 외부 메시지 스트림을 추상화합니다.
 * {@code streamToPipe} 커넥터 함수의 입력으로 사용됩니다.</p>
 *
 * @param <T> 메시지 타입
 * @author Execution Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageStream<T> {

    /**
     * 메시지 순회 시작.
     *
     * @return 메시지 이터레이터
     * @throws IOException 스트림을 열 수 없는 경우
     */
    MessageIterator<T> iterMessages() throws IOException;
}
