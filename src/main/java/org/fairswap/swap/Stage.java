package org.fairswap.swap;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

import java.util.Map;

/**
 * Swap lifecycle stages, in protocol order.
 * <p>
 * Stages only ever move forward by one step via {@link #next()},
 * apart from the terminal reset back to {@link #READY_TO_START}.
 */
public enum Stage {
	READY_TO_START(0),
	STARTED(1),
	TERMS_SET(2),
	TERMS_ACCEPTED(3),
	DEPOSIT_CONFIRMED(4),
	EXECUTED(5);

	public final int value;
	private static final Map<Integer, Stage> map = stream(Stage.values()).collect(toMap(stage -> stage.value, stage -> stage));

	Stage(int value) {
		this.value = value;
	}

	public static Stage valueOf(int value) {
		return map.get(value);
	}

	/**
	 * Returns the single permitted successor stage.
	 *
	 * @throws IllegalStateException if called on {@link #EXECUTED}, which only resets
	 */
	public Stage next() {
		switch (this) {
			case READY_TO_START:
				return STARTED;

			case STARTED:
				return TERMS_SET;

			case TERMS_SET:
				return TERMS_ACCEPTED;

			case TERMS_ACCEPTED:
				return DEPOSIT_CONFIRMED;

			case DEPOSIT_CONFIRMED:
				return EXECUTED;

			default:
				throw new IllegalStateException("No stage follows " + this.name());
		}
	}

	public boolean isBefore(Stage other) {
		return this.value < other.value;
	}
}
