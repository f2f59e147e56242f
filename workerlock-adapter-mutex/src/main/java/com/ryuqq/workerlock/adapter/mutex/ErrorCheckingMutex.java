package com.ryuqq.workerlock.adapter.mutex;

import com.ryuqq.workerlock.core.failure.MutexErrorCode;
import com.ryuqq.workerlock.core.failure.MutexException;
import com.ryuqq.workerlock.core.spi.TaskMutex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 오류 검사형(error-checking) mutex.
 *
 * <p>재진입을 허용하지 않으며, 잘못된 사용을 예외 대신 오류 코드로 보고합니다.</p>
 *
 * <p><strong>오류 검사:</strong></p>
 * <ul>
 *   <li>보유 스레드가 다시 lock → {@link MutexErrorCode#DEADLOCK}</li>
 *   <li>보유하지 않은 스레드가 unlock → {@link MutexErrorCode#NOT_OWNER}</li>
 *   <li>destroy() 이후 모든 연산 → {@link MutexErrorCode#INVALID_MUTEX}</li>
 *   <li>잠긴 상태에서 destroy() → {@link MutexErrorCode#BUSY}</li>
 * </ul>
 *
 * <p><strong>획득 순서:</strong> fair=false(기본)이면 대기자 간 순서를 보장하지 않습니다.
 * fair=true이면 대체로 오래 기다린 스레드가 먼저 획득하지만, 이 역시 {@link ReentrantLock}의
 * 구현에 따릅니다.</p>
 *
 * <p>호출자가 생성하고 {@link #destroy()}로 파괴합니다. 이 mutex를 참조하는 모든 Task가
 * join된 뒤에 파괴해야 합니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class ErrorCheckingMutex implements TaskMutex {

    private static final Logger log = LoggerFactory.getLogger(ErrorCheckingMutex.class);

    private final ReentrantLock lock;
    private volatile boolean destroyed;

    /**
     * 생성자 (비공정 모드).
     */
    public ErrorCheckingMutex() {
        this(false);
    }

    /**
     * 생성자.
     *
     * @param fair 공정 모드 여부
     */
    public ErrorCheckingMutex(boolean fair) {
        this.lock = new ReentrantLock(fair);
    }

    @Override
    public void lock() throws MutexException {
        ensureValid();
        ensureNotHeldByCurrentThread();
        lock.lock();
        releaseIfDestroyedWhileWaiting();
    }

    @Override
    public boolean tryLock(long timeoutMs) throws MutexException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be non-negative (current: " + timeoutMs + ")");
        }
        ensureValid();
        ensureNotHeldByCurrentThread();

        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MutexException(MutexErrorCode.INTERRUPTED, "Interrupted while waiting for mutex", e);
        }

        if (acquired) {
            releaseIfDestroyedWhileWaiting();
        }
        return acquired;
    }

    @Override
    public void unlock() throws MutexException {
        ensureValid();
        if (!lock.isHeldByCurrentThread()) {
            throw new MutexException(MutexErrorCode.NOT_OWNER,
                "Mutex is not held by " + Thread.currentThread().getName());
        }
        lock.unlock();
    }

    /**
     * mutex 파괴.
     *
     * <p>잠겨 있지 않은 상태에서만 파괴할 수 있습니다. 이후 모든 연산은 INVALID_MUTEX로 실패합니다.</p>
     *
     * @throws MutexException 이미 파괴된 경우(INVALID_MUTEX), 잠겨 있는 경우(BUSY)
     */
    public void destroy() throws MutexException {
        ensureValid();
        if (!lock.tryLock()) {
            throw new MutexException(MutexErrorCode.BUSY, "Mutex is locked by another thread");
        }
        try {
            if (lock.getHoldCount() > 1) {
                throw new MutexException(MutexErrorCode.BUSY, "Mutex is locked by the destroying thread");
            }
            destroyed = true;
        } finally {
            lock.unlock();
        }
        log.debug("Mutex destroyed");
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * 획득을 기다리는 스레드 수 (추정치).
     *
     * @return 대기 중인 스레드 수
     */
    public int getQueueLength() {
        return lock.getQueueLength();
    }

    private void ensureValid() throws MutexException {
        if (destroyed) {
            throw new MutexException(MutexErrorCode.INVALID_MUTEX, "Mutex has been destroyed");
        }
    }

    private void ensureNotHeldByCurrentThread() throws MutexException {
        if (lock.isHeldByCurrentThread()) {
            throw new MutexException(MutexErrorCode.DEADLOCK,
                "Mutex already held by " + Thread.currentThread().getName());
        }
    }

    private void releaseIfDestroyedWhileWaiting() throws MutexException {
        if (destroyed) {
            lock.unlock();
            throw new MutexException(MutexErrorCode.INVALID_MUTEX, "Mutex destroyed while waiting");
        }
    }

    @Override
    public String toString() {
        return "ErrorCheckingMutex{locked=" + lock.isLocked() + ", destroyed=" + destroyed + "}";
    }
}
