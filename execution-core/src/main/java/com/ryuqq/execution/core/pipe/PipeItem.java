package com.ryuqq.execution.core.pipe;

import java.util.NoSuchElementException;

/**
 * Pipe를 흐르는 원소: 데이터 또는 종료 신호(SENTINEL).
 *
 * <p>종료 신호를 데이터 타입과 구분된 변형으로 표현하여, 소비자가
 * {@link #isSentinel()}로 스트림 종료를 명시적으로 판단할 수 있게 합니다.</p>
 *
 * <pre>
 * PipeItem&lt;Trade&gt; item = pipe.get();
 * if (item.isSentinel()) {
 *     return; // 더 이상 get() 호출 금지
 * }
 * Trade trade = item.value();
 * </pre>
 *
 * @param <T> 데이터 타입
 * @author Execution Team
 * @since 1.0.0
 */
public sealed interface PipeItem<T> permits PipeItem.Data, PipeItem.Sentinel {

    /**
     * 데이터 원소 생성.
     *
     * @param value 데이터 (null 불가)
     * @param <T> 데이터 타입
     * @return 데이터 원소
     */
    static <T> PipeItem<T> of(T value) {
        return new Data<>(value);
    }

    /**
     * 예약된 종료 신호.
     *
     * @param <T> 데이터 타입
     * @return SENTINEL (모든 SENTINEL은 서로 equals)
     */
    static <T> PipeItem<T> sentinel() {
        return new Sentinel<>();
    }

    /**
     * 종료 신호인지 확인.
     *
     * @return SENTINEL이면 true
     */
    boolean isSentinel();

    /**
     * 데이터 값.
     *
     * @return 데이터
     * @throws NoSuchElementException SENTINEL인 경우
     */
    T value();

    /**
     * 데이터 원소.
     *
     * @param value 데이터 (null 불가)
     * @param <T> 데이터 타입
     */
    record Data<T>(T value) implements PipeItem<T> {

        public Data {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public boolean isSentinel() {
            return false;
        }
    }

    /**
     * 종료 신호. 구성 요소가 없으므로 모든 인스턴스가 같습니다.
     *
     * @param <T> 데이터 타입
     */
    record Sentinel<T>() implements PipeItem<T> {

        @Override
        public boolean isSentinel() {
            return true;
        }

        @Override
        public T value() {
            throw new NoSuchElementException("SENTINEL carries no value");
        }

        @Override
        public String toString() {
            return "SENTINEL";
        }
    }
}
