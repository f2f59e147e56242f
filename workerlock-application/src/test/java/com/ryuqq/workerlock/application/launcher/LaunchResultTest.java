package com.ryuqq.workerlock.application.launcher;

import com.ryuqq.workerlock.core.failure.MutexErrorCode;
import com.ryuqq.workerlock.core.failure.TaskErrorKind;
import com.ryuqq.workerlock.core.failure.TaskFailure;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LaunchResult 유닛 테스트.
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LaunchResultTest {

    @Mock
    private TaskHandle handle;

    @Test
    void Launched_결과는_ok() {
        // when
        LaunchResult result = new LaunchResult.Launched(handle);

        // then
        assertThat(result.isOk()).isTrue();
        assertThat(((LaunchResult.Launched) result).handle()).isSameAs(handle);
    }

    @Test
    void Rejected_결과는_ok_아님() {
        // given
        TaskFailure failure = TaskFailure.of(TaskErrorKind.SPAWN_FAILURE, "no thread");

        // when
        LaunchResult result = new LaunchResult.Rejected(failure);

        // then
        assertThat(result.isOk()).isFalse();
        assertThat(((LaunchResult.Rejected) result).failure()).isEqualTo(failure);
    }

    @Test
    void Rejected_비동기_실패_종류는_거부() {
        // given
        TaskFailure lockFailure = new TaskFailure(TaskErrorKind.LOCK_FAILURE, MutexErrorCode.BUSY, "busy");

        // when & then
        assertThatThrownBy(() -> new LaunchResult.Rejected(lockFailure))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("LOCK_FAILURE");
    }

    @Test
    void null_인자_거부() {
        assertThatThrownBy(() -> new LaunchResult.Launched(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LaunchResult.Rejected(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
