package org.fairswap.event;

@FunctionalInterface
public interface Listener {

	void listen(Event event);

}
