package com.ryuqq.execution.core.pipe;

/**
 * 재시도 예산을 모두 소진했는데도 버퍼가 가득 찬 경우 (backpressure).
 *
 * <p>일시적 상황이며, 호출자가 자기 단계에서 치명적으로 볼지 결정합니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class PipeFullException extends PipeException {

    public PipeFullException(String message) {
        super(message);
    }
}
