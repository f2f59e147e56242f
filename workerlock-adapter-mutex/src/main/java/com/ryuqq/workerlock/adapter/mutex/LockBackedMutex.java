package com.ryuqq.workerlock.adapter.mutex;

import com.ryuqq.workerlock.core.failure.MutexErrorCode;
import com.ryuqq.workerlock.core.failure.MutexException;
import com.ryuqq.workerlock.core.spi.TaskMutex;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * 호출자가 제공한 {@link Lock}을 TaskMutex로 감싸는 어댑터.
 *
 * <p>Lock의 생명주기와 재진입 여부는 전적으로 호출자의 Lock 구현을 따릅니다.
 * {@link java.util.concurrent.locks.ReentrantLock}을 넘기면 재진입이 허용되므로,
 * 재진입 검사가 필요하면 {@link ErrorCheckingMutex}를 사용합니다.</p>
 *
 * <p><strong>오류 변환:</strong></p>
 * <ul>
 *   <li>unlock 중 {@link IllegalMonitorStateException} → {@link MutexErrorCode#NOT_OWNER}</li>
 *   <li>tryLock 중 {@link InterruptedException} → {@link MutexErrorCode#INTERRUPTED} (인터럽트 플래그 복원)</li>
 * </ul>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class LockBackedMutex implements TaskMutex {

    private final Lock lock;

    /**
     * 생성자.
     *
     * @param lock 감쌀 Lock (호출자 소유)
     * @throws IllegalArgumentException lock이 null인 경우
     */
    public LockBackedMutex(Lock lock) {
        if (lock == null) {
            throw new IllegalArgumentException("lock cannot be null");
        }
        this.lock = lock;
    }

    @Override
    public void lock() {
        lock.lock();
    }

    @Override
    public boolean tryLock(long timeoutMs) throws MutexException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be non-negative (current: " + timeoutMs + ")");
        }
        try {
            return lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MutexException(MutexErrorCode.INTERRUPTED, "Interrupted while waiting for lock", e);
        }
    }

    @Override
    public void unlock() throws MutexException {
        try {
            lock.unlock();
        } catch (IllegalMonitorStateException e) {
            throw new MutexException(MutexErrorCode.NOT_OWNER,
                "Lock is not held by " + Thread.currentThread().getName(), e);
        }
    }

    @Override
    public String toString() {
        return "LockBackedMutex{" + lock + "}";
    }
}
