package com.ryuqq.workerlock.adapter.runner;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker 전용 스레드 팩토리.
 *
 * <p>호출마다 새 플랫폼 스레드를 만듭니다. 스레드는 재사용되지 않습니다.
 * 이름은 {@code prefix + 순번} 형식입니다 (예: workerlock-1).</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class WorkerThreadFactory implements ThreadFactory {

    private final String prefix;
    private final boolean daemon;
    private final AtomicLong sequence;

    /**
     * 생성자.
     *
     * @param config Launcher 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public WorkerThreadFactory(LauncherConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.prefix = config.threadNamePrefix();
        this.daemon = config.daemon();
        this.sequence = new AtomicLong(0);
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + sequence.incrementAndGet());
        thread.setDaemon(daemon);
        return thread;
    }
}
