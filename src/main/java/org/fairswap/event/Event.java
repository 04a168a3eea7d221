package org.fairswap.event;

public interface Event {
}
