package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.context.MachineContext;
import com.ryuqq.lifecycle.core.statemachine.StateListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State listener that records every notification it receives.
 *
 * <p>Used by contract tests to assert the exact order and content of notifications
 * without a mocking framework.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingListener&lt;ServiceState&gt; listener = new RecordingListener&lt;&gt;();
 * machine.subscribe(listener);
 *
 * machine.transition("CHECK");
 *
 * assertEquals(List.of(UNKNOWN, CHECKING), listener.states());
 * </pre>
 *
 * @param <S> the state type
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class RecordingListener<S extends Enum<S>> implements StateListener<S> {

    private final List<Notification<S>> notifications = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onStateChanged(S state, MachineContext context) {
        notifications.add(new Notification<>(state, context));
    }

    /**
     * Returns all recorded notifications, oldest first.
     *
     * @return an immutable copy of the notifications
     */
    public List<Notification<S>> notifications() {
        synchronized (notifications) {
            return List.copyOf(notifications);
        }
    }

    /**
     * Returns the states of all recorded notifications, oldest first.
     *
     * @return an immutable list of states
     */
    public List<S> states() {
        List<S> states = new ArrayList<>();
        for (Notification<S> notification : notifications()) {
            states.add(notification.state());
        }
        return List.copyOf(states);
    }

    /**
     * Returns the most recent notification.
     *
     * @return the last notification
     * @throws IllegalStateException if nothing was recorded
     */
    public Notification<S> last() {
        List<Notification<S>> snapshot = notifications();
        if (snapshot.isEmpty()) {
            throw new IllegalStateException("No notification recorded");
        }
        return snapshot.get(snapshot.size() - 1);
    }

    public int count() {
        return notifications.size();
    }

    public void clear() {
        notifications.clear();
    }

    /**
     * A single recorded (state, context) pair.
     *
     * @param state the state delivered
     * @param context the context delivered
     * @param <S> the state type
     */
    public record Notification<S extends Enum<S>>(S state, MachineContext context) {
    }
}
