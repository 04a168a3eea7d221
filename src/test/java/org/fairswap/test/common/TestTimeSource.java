package org.fairswap.test.common;

import org.fairswap.utils.TimeSource;

/** Manually driven clock. Starts synchronized at a fixed instant. */
public class TestTimeSource implements TimeSource {

	public static final long START = 1_600_000_000_000L;

	private Long now = START;

	@Override
	public synchronized Long getTime() {
		return this.now;
	}

	public synchronized void setTime(Long now) {
		this.now = now;
	}

	public synchronized void advance(long millis) {
		this.now += millis;
	}

	/** Simulates losing clock synchronization. */
	public synchronized void unsync() {
		this.now = null;
	}

}
