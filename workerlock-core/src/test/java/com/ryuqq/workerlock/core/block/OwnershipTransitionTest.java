package com.ryuqq.workerlock.core.block;

import org.junit.jupiter.api.Test;

import static com.ryuqq.workerlock.core.block.BlockOwner.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * OwnershipTransition 테스트.
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
class OwnershipTransitionTest {

    @Test
    void validate_AllowedTransfers_Succeed() {
        assertDoesNotThrow(() -> OwnershipTransition.validate(LAUNCHER, WORKER));
        assertDoesNotThrow(() -> OwnershipTransition.validate(LAUNCHER, RELEASED));
        assertDoesNotThrow(() -> OwnershipTransition.validate(WORKER, JOINER));
        assertDoesNotThrow(() -> OwnershipTransition.validate(JOINER, RELEASED));
    }

    @Test
    void validate_WorkerToReleased_ThrowsException() {
        // Worker는 block을 해제할 수 없음
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> OwnershipTransition.validate(WORKER, RELEASED));
        assertTrue(exception.getMessage().contains("Invalid ownership transfer"));
    }

    @Test
    void validate_LauncherToJoiner_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> OwnershipTransition.validate(LAUNCHER, JOINER));
    }

    @Test
    void validate_FromReleased_ThrowsException() {
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> OwnershipTransition.validate(RELEASED, RELEASED));
        assertTrue(exception.getMessage().contains("already released"));
    }

    @Test
    void validate_Null_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> OwnershipTransition.validate(null, WORKER));
        assertThrows(IllegalArgumentException.class, () -> OwnershipTransition.validate(WORKER, null));
    }
}
