package com.ryuqq.execution.core.pipe.connector;

import java.io.IOException;

/**
 * 스트림 연결/해제 동작.
 *
 * @author Execution Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectionAction {

    void run() throws IOException;
}
