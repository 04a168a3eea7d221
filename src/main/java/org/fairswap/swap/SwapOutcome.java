package org.fairswap.swap;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

import java.util.Map;

/** Why a swap instance is (or isn't) still in progress. */
public enum SwapOutcome {
	ACTIVE(0), COMPLETED(1), CANCELLED(2), OVERRIDDEN(3);

	public final int value;
	private static final Map<Integer, SwapOutcome> map = stream(SwapOutcome.values()).collect(toMap(outcome -> outcome.value, outcome -> outcome));

	SwapOutcome(int value) {
		this.value = value;
	}

	public static SwapOutcome valueOf(int value) {
		return map.get(value);
	}
}
