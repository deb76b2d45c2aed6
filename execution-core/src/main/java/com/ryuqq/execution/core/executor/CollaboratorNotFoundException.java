package com.ryuqq.execution.core.executor;

/**
 * 등록되지 않은 커넥터 이름을 사용한 경우 (프로그래밍 오류).
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class CollaboratorNotFoundException extends RuntimeException {

    private final String connectorName;

    public CollaboratorNotFoundException(String connectorName) {
        super("Connector not found: " + connectorName);
        this.connectorName = connectorName;
    }

    public String getConnectorName() {
        return connectorName;
    }
}
