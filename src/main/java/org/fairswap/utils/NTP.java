package org.fairswap.utils;

import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.apache.commons.net.ntp.NTPUDPClient;
import org.apache.commons.net.ntp.TimeInfo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Network time, used to judge cancellation and override delays.
 * <p>
 * {@link #getTime()} returns null until enough NTP servers have replied,
 * or until a fixed offset has been set (e.g. for testing).
 */
public class NTP {

	private static final Logger LOGGER = LogManager.getLogger(NTP.class);

	private static final int MIN_POLL_SECONDS = 64;
	private static final int MAX_SAMPLES = 8;

	private static ScheduledExecutorService scheduler;
	private static NTP instance;
	private static volatile boolean isOffsetSet = false;
	private static volatile long offset = 0;

	private static class NtpServer {
		private final String remote;
		private Integer stratum;
		private Double offset;
		private byte reach = 0;
		private long nextPoll = 0;
		private final Deque<Double> samples = new ArrayDeque<>(MAX_SAMPLES);

		private NtpServer(String remote) {
			this.remote = remote;
		}

		private boolean poll(NTPUDPClient client, long now) {
			try {
				TimeInfo timeInfo = client.getTime(InetAddress.getByName(this.remote));
				timeInfo.computeDetails();

				this.stratum = timeInfo.getMessage().getStratum();
				int pollSeconds = Math.max(MIN_POLL_SECONDS, 1 << timeInfo.getMessage().getPoll());
				this.nextPoll = now + pollSeconds * 1000L;

				if (this.samples.size() == MAX_SAMPLES)
					this.samples.removeFirst();

				this.samples.addLast((double) timeInfo.getOffset());
				this.offset = this.samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
				this.reach = (byte) ((this.reach << 1) | 1);

				return true;
			} catch (IOException e) {
				LOGGER.trace(() -> String.format("NTP server %s unreachable: %s", this.remote, e.getMessage()));

				this.reach <<= 1;
				this.nextPoll = now + MIN_POLL_SECONDS * 1000L;
				return false;
			}
		}
	}

	private final NTPUDPClient client;
	private final List<NtpServer> servers = new ArrayList<>();
	private final ExecutorService pollExecutor;

	private NTP(String[] serverNames) {
		this.client = new NTPUDPClient();
		this.client.setDefaultTimeout(2000);

		for (String serverName : serverNames)
			this.servers.add(new NtpServer(serverName));

		this.pollExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("NTP-poll", true));
	}

	public static synchronized void start(String[] serverNames) {
		if (instance != null)
			return;

		instance = new NTP(serverNames);
		scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("NTP", true));
		scheduler.scheduleWithFixedDelay(instance::pollServers, 0, 1, TimeUnit.SECONDS);
	}

	public static synchronized void shutdownNow() {
		if (scheduler != null)
			scheduler.shutdownNow();

		if (instance != null)
			instance.pollExecutor.shutdownNow();

		scheduler = null;
		instance = null;
	}

	/** Fixes offset, disabling need for NTP replies. */
	public static synchronized void setFixedOffset(Long fixedOffset) {
		NTP.offset = fixedOffset == null ? 0 : fixedOffset;
		isOffsetSet = true;
	}

	/**
	 * Returns our estimate of internet time.
	 *
	 * @return internet time (ms), or null if unsynchronized.
	 */
	public static Long getTime() {
		if (!isOffsetSet)
			return null;

		return System.currentTimeMillis() + NTP.offset;
	}

	/** Returns {@link TimeSource} backed by {@link #getTime()}. */
	public static TimeSource timeSource() {
		return NTP::getTime;
	}

	private void pollServers() {
		final long now = System.currentTimeMillis();

		CompletionService<Boolean> completionService = new ExecutorCompletionService<>(this.pollExecutor);
		int pending = 0;

		for (NtpServer server : this.servers)
			if (now >= server.nextPoll) {
				completionService.submit(() -> server.poll(this.client, now));
				++pending;
			}

		boolean haveUpdate = false;
		try {
			for (int i = 0; i < pending; ++i)
				haveUpdate |= completionService.take().get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return;
		} catch (ExecutionException e) {
			LOGGER.debug(() -> String.format("NTP poll failed: %s", e.getMessage()));
		}

		if (haveUpdate)
			calculateOffset();
	}

	private void calculateOffset() {
		// Weight by stratum first, then discard outliers beyond one standard deviation
		double count = 0;
		double sum = 0;
		double sumSquares = 0;

		for (NtpServer server : this.servers) {
			if (server.offset == null)
				continue;

			double weighted = server.offset * server.stratum;
			count += 1;
			sum += weighted;
			sumSquares += weighted * weighted;
		}

		if (count < this.servers.size() / 3 + 1) {
			final double replies = count;
			LOGGER.debug(() -> String.format("Not enough replies (%.0f) to calculate network time", replies));
			return;
		}

		final double mean = sum / count;
		final double stddev = Math.sqrt(((count * sumSquares) - (sum * sum)) / (count * (count - 1)));

		double usefulCount = 0;
		double usefulSum = 0;

		for (NtpServer server : this.servers) {
			if (server.offset == null || server.reach == 0)
				continue;

			if (Math.abs(server.offset * server.stratum - mean) > stddev)
				continue;

			usefulCount += 1;
			usefulSum += server.offset;
		}

		if (usefulCount <= 1) {
			final double values = usefulCount;
			LOGGER.debug(() -> String.format("Not enough useful values (%.0f) to calculate network time (stddev: %7.4f)", values, stddev));
			return;
		}

		NTP.offset = (long) (usefulSum / usefulCount);
		isOffsetSet = true;
		LOGGER.debug(() -> String.format("New NTP offset: %d", NTP.offset));
	}

}
