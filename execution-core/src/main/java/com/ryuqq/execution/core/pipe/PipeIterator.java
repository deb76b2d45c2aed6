package com.ryuqq.execution.core.pipe;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * SENTINEL을 만날 때까지 Pipe의 데이터를 순회하는 Iterator.
 *
 * <p>꺼낸 원소마다 {@link PipeSource#taskDone()}을 호출합니다 (SENTINEL 포함).
 * 대기 중 인터럽트되면 인터럽트 플래그를 복원하고 순회를 끝냅니다.</p>
 *
 * @param <T> 데이터 타입
 * @author Execution Team
 * @since 1.0.0
 */
public class PipeIterator<T> implements Iterator<T> {

    private final PipeSource<T> source;
    private PipeItem<T> next;
    private boolean finished;

    public PipeIterator(PipeSource<T> source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.source = source;
    }

    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        if (next != null) {
            return true;
        }
        try {
            PipeItem<T> item = source.get();
            source.taskDone();
            if (item.isSentinel()) {
                finished = true;
                return false;
            }
            next = item;
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = true;
            return false;
        }
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T value = next.value();
        next = null;
        return value;
    }
}
