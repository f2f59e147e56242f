package com.ryuqq.workerlock.core.block;

/**
 * ParameterBlock 소유권 이전 규칙.
 *
 * <p><strong>허용되는 이전:</strong></p>
 * <ul>
 *   <li>LAUNCHER → WORKER (스레드 시작)</li>
 *   <li>LAUNCHER → RELEASED (스폰 실패, launch가 직접 회수)</li>
 *   <li>WORKER → JOINER (join)</li>
 *   <li>JOINER → RELEASED (호출자가 해제)</li>
 * </ul>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class OwnershipTransition {

    private OwnershipTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 소유권 이전이 유효한지 검증.
     *
     * @param from 현재 소유자
     * @param to 새 소유자
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 허용되지 않은 이전인 경우
     */
    public static void validate(BlockOwner from, BlockOwner to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Owners cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from == BlockOwner.RELEASED) {
            throw new IllegalStateException(
                String.format("Block already released: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case LAUNCHER -> to == BlockOwner.WORKER || to == BlockOwner.RELEASED;
            case WORKER -> to == BlockOwner.JOINER;
            case JOINER -> to == BlockOwner.RELEASED;
            case RELEASED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid ownership transfer: %s → %s", from, to)
            );
        }
    }
}
