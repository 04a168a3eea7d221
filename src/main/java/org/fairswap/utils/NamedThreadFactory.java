package org.fairswap.utils;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class NamedThreadFactory implements ThreadFactory {

	private final String prefix;
	private final boolean daemon;
	private final AtomicInteger counter = new AtomicInteger(1);

	public NamedThreadFactory(String prefix, boolean daemon) {
		this.prefix = prefix;
		this.daemon = daemon;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread thread = Executors.defaultThreadFactory().newThread(runnable);
		thread.setName(this.prefix + "-" + this.counter.getAndIncrement());
		thread.setDaemon(this.daemon);

		return thread;
	}

}
