package com.ryuqq.workerlock.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskId 테스트.
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
class TaskIdTest {

    @Test
    void of_ValidValue_CreatesTaskId() {
        // When
        TaskId taskId = TaskId.of("task-001_a");

        // Then
        assertEquals("task-001_a", taskId.getValue());
        assertEquals("TaskId{task-001_a}", taskId.toString());
    }

    @Test
    void of_NullOrBlank_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TaskId.of(null));
        assertThrows(IllegalArgumentException.class, () -> TaskId.of("   "));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> TaskId.of(value));
        assertTrue(exception.getMessage().contains("255"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TaskId.of("task 1"));
        assertThrows(IllegalArgumentException.class, () -> TaskId.of("task/1"));
    }

    @Test
    void of_TrailingNewline_RejectedAndNamedInMessage() {
        // When
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> TaskId.of("task-1\n"));

        // Then
        assertTrue(exception.getMessage().contains("task-1"));
    }

    @Test
    void random_GeneratesDistinctIds() {
        // When
        TaskId first = TaskId.random();
        TaskId second = TaskId.random();

        // Then
        assertNotEquals(first, second);
        assertEquals(36, first.getValue().length());
    }

    @Test
    void equals_SameValue_EqualAndSameHashCode() {
        // Given
        TaskId first = TaskId.of("same");
        TaskId second = TaskId.of("same");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, TaskId.of("other"));
    }
}
