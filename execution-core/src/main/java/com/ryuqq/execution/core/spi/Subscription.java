package com.ryuqq.execution.core.spi;

/**
 * 구독 해지 핸들.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * 구독 해지 (멱등).
     */
    @Override
    void close();
}
