package com.ryuqq.workerlock.testkit.contract;

import com.ryuqq.workerlock.core.model.TaskId;
import com.ryuqq.workerlock.core.observation.TaskObserver;
import com.ryuqq.workerlock.core.statemachine.CompletionStatus;
import com.ryuqq.workerlock.core.statemachine.WorkerState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * TaskObserver that records transitions, completions and critical section timings.
 *
 * <p>A critical section starts when a worker enters HOLDING_LOCK and ends when it enters
 * UNLOCKING. Both events are emitted while the worker still holds the mutex, so two
 * recorded sections on the same mutex never overlap if mutual exclusion holds.</p>
 *
 * @author WorkerLock Team
 * @since 1.0.0
 */
public class RecordingTaskObserver implements TaskObserver {

    /**
     * One recorded critical section.
     *
     * @param taskId the task that held the mutex
     * @param startNanos {@link System#nanoTime()} on HOLDING_LOCK entry
     * @param endNanos {@link System#nanoTime()} on UNLOCKING entry
     */
    public record CriticalSection(TaskId taskId, long startNanos, long endNanos) {

        public long durationMillis() {
            return (endNanos - startNanos) / 1_000_000L;
        }

        public boolean overlaps(CriticalSection other) {
            return startNanos < other.endNanos && other.startNanos < endNanos;
        }
    }

    /**
     * One recorded transition.
     *
     * @param taskId the task
     * @param from previous state
     * @param to next state
     */
    public record Transition(TaskId taskId, WorkerState from, WorkerState to) {
    }

    private final List<Transition> transitions = new CopyOnWriteArrayList<>();
    private final Map<TaskId, CompletionStatus> completions = new ConcurrentHashMap<>();
    private final Map<TaskId, Long> openSections = new ConcurrentHashMap<>();
    private final List<CriticalSection> sections = new CopyOnWriteArrayList<>();

    @Override
    public void onTransition(TaskId taskId, WorkerState from, WorkerState to) {
        long now = System.nanoTime();
        transitions.add(new Transition(taskId, from, to));
        if (to == WorkerState.HOLDING_LOCK) {
            openSections.put(taskId, now);
        } else if (to == WorkerState.UNLOCKING) {
            Long start = openSections.remove(taskId);
            if (start != null) {
                sections.add(new CriticalSection(taskId, start, now));
            }
        }
    }

    @Override
    public void onCompleted(TaskId taskId, CompletionStatus status) {
        completions.put(taskId, status);
    }

    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    /**
     * Transitions of a single task, in the order they were emitted.
     *
     * @param taskId the task
     * @return target states of the task's transitions
     */
    public List<WorkerState> statesOf(TaskId taskId) {
        List<WorkerState> states = new ArrayList<>();
        for (Transition transition : transitions) {
            if (transition.taskId().equals(taskId)) {
                states.add(transition.to());
            }
        }
        return states;
    }

    public List<CriticalSection> getCriticalSections() {
        return Collections.unmodifiableList(new ArrayList<>(sections));
    }

    public CriticalSection criticalSectionOf(TaskId taskId) {
        for (CriticalSection section : sections) {
            if (section.taskId().equals(taskId)) {
                return section;
            }
        }
        throw new IllegalStateException("No critical section recorded for " + taskId);
    }

    public CompletionStatus completionOf(TaskId taskId) {
        return completions.get(taskId);
    }

    public int completedCount() {
        return completions.size();
    }

    public void clear() {
        transitions.clear();
        completions.clear();
        openSections.clear();
        sections.clear();
    }
}
