package org.fairswap.event;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public enum EventBus {
	INSTANCE;

	private static final Logger LOGGER = LogManager.getLogger(EventBus.class);

	private static final List<Listener> LISTENERS = new ArrayList<>();

	public void addListener(Listener newListener) {
		synchronized (LISTENERS) {
			LISTENERS.add(newListener);
		}
	}

	public void removeListener(Listener listener) {
		synchronized (LISTENERS) {
			LISTENERS.remove(listener);
		}
	}

	/**
	 * Delivers event to every registered listener, in registration order.
	 * <p>
	 * <b>WARNING:</b> before calling this method,
	 * make sure current thread's repository session
	 * holds no uncommitted changes, e.g. by calling
	 * <tt>repository.saveChanges()</tt> or
	 * <tt>repository.discardChanges()</tt>.
	 * <p>
	 * Listeners may open their own repository session and must
	 * only ever observe committed swap state.
	 * <p>
	 * Exceptions thrown by a listener are logged and do not reach the caller or other listeners.
	 */
	public void notify(Event event) {
		List<Listener> clonedListeners;

		synchronized (LISTENERS) {
			clonedListeners = new ArrayList<>(LISTENERS);
		}

		for (Listener listener : clonedListeners)
			try {
				listener.listen(event);
			} catch (Exception e) {
				LOGGER.warn(() -> String.format("Caught %s from a listener processing %s", e.getClass().getSimpleName(), event), e);
			}
	}
}
