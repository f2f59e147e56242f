package com.ryuqq.workerlock.core.spi;

import com.ryuqq.workerlock.core.failure.MutexException;

/**
 * Worker Task가 공유하는 mutex SPI.
 *
 * <p>mutex는 호출자가 생성/초기화/파괴합니다. Worker Task와 ParameterBlock은
 * 참조만 보유하며 소유하지 않으므로, mutex는 이를 참조하는 모든 Task보다 오래 살아있어야 합니다.</p>
 *
 * <p><strong>의미론:</strong></p>
 * <ul>
 *   <li>재진입(reentrant) 잠금은 지원 대상이 아닙니다.</li>
 *   <li>대기자 사이의 획득 순서는 구현체가 정합니다 (FIFO 보장 없음).</li>
 *   <li>unlock 실패 후 mutex 상태는 구현체가 남긴 그대로이며 복구를 시도하지 않습니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * mutex.lock();
 * try {
 *     // critical section
 * } finally {
 *     mutex.unlock();
 * }
 * }</pre>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public interface TaskMutex {

    /**
     * mutex 획득 (무제한 대기).
     *
     * <p>다른 스레드가 보유 중이면 해제될 때까지 무기한 블로킹합니다. 인터럽트로 중단되지 않습니다.</p>
     *
     * @throws MutexException 획득 실패 시 (파괴된 mutex, 교착 감지 등)
     */
    void lock() throws MutexException;

    /**
     * mutex 획득 (제한 대기).
     *
     * @param timeoutMs 최대 대기 시간 (밀리초, 0 이상)
     * @return true: 획득 성공, false: 시간 초과
     * @throws MutexException 획득 실패 시 (파괴된 mutex, 교착 감지, 인터럽트 등)
     */
    boolean tryLock(long timeoutMs) throws MutexException;

    /**
     * mutex 해제.
     *
     * @throws MutexException 해제 실패 시 (보유자가 아님, 파괴된 mutex 등)
     */
    void unlock() throws MutexException;
}
