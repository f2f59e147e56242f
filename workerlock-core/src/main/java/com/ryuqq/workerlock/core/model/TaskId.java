package com.ryuqq.workerlock.core.model;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 한 번의 launch로 시작된 Worker를 가리키는 상관관계 키.
 *
 * <p>Launcher는 launch마다 {@link #random()}으로 새 키를 만들어 ParameterBlock에 싣고,
 * 이후 Worker 로그, 관찰자 콜백, Worker 스레드 진단 정보가 모두 이 키로 묶입니다.
 * 같은 키가 두 블록에 동시에 쓰이는 일은 없습니다.</p>
 *
 * <p>로그와 스레드 이름에 그대로 들어가므로 공백이나 경로 구분자는 받지 않습니다.
 * 허용 문자는 영숫자, {@code -}, {@code _}이고 최대 {@value #MAX_LENGTH}자입니다.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public final class TaskId {

    private static final int MAX_LENGTH = 255;
    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]+");

    private final String value;

    private TaskId(String value) {
        this.value = requireLoggable(value);
    }

    /**
     * 테스트나 재현 시나리오처럼 키를 직접 지정해야 할 때 사용.
     *
     * @throws IllegalArgumentException 비어 있거나 너무 길거나 허용되지 않은 문자가 있는 경우
     */
    public static TaskId of(String value) {
        return new TaskId(value);
    }

    /** launch마다 쓰는 UUID 기반 키. */
    public static TaskId random() {
        return new TaskId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    private static String requireLoggable(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            throw new IllegalArgumentException("TaskId cannot be null or blank");
        }
        if (candidate.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "TaskId is " + candidate.length() + " characters, limit is " + MAX_LENGTH);
        }
        if (!ALLOWED.matcher(candidate).matches()) {
            throw new IllegalArgumentException("TaskId '" + candidate + "' may only use letters, digits, '-' and '_'");
        }
        return candidate;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TaskId && value.equals(((TaskId) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TaskId{" + value + '}';
    }
}
