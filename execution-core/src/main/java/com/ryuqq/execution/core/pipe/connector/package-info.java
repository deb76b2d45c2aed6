/**
 * Connector functions composing pipes into pipelines.
 *
 * <p>{@link com.ryuqq.execution.core.pipe.connector.PipeConnectors} links pipes and message streams
 * through a {@link com.ryuqq.execution.core.pipe.connector.Handler}. Every connector propagates the
 * end of stream downstream, stops its destination before re-throwing a handler failure, and flushes
 * what is left upstream when it is cancelled.</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execution.core.pipe.connector;
