package org.fairswap.api.websocket;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketClose;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketConnect;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketError;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketMessage;
import org.eclipse.jetty.websocket.api.annotations.WebSocket;
import org.eclipse.jetty.websocket.servlet.WebSocketServletFactory;
import org.fairswap.api.ApiError;
import org.fairswap.data.swap.SwapData;
import org.fairswap.event.Event;
import org.fairswap.event.EventBus;
import org.fairswap.event.Listener;
import org.fairswap.repository.DataException;
import org.fairswap.repository.Repository;
import org.fairswap.repository.RepositoryManager;
import org.fairswap.swap.SwapEvent;

/**
 * Pushes {@link SwapEvent}s to subscribers.
 * <p>
 * On connect, sends list of active swaps (or just the requested swap, if <tt>swapId</tt> query param given).
 */
@WebSocket
@SuppressWarnings("serial")
public class SwapsWebSocket extends ApiWebSocket implements Listener {

	private static final Logger LOGGER = LogManager.getLogger(SwapsWebSocket.class);

	/** Swap each session is interested in, or absent for all swaps */
	private static final Map<Session, Long> sessionSwapIds = Collections.synchronizedMap(new HashMap<>());

	@Override
	public void configure(WebSocketServletFactory factory) {
		factory.register(SwapsWebSocket.class);

		EventBus.INSTANCE.addListener(this::listen);
	}

	@Override
	public void listen(Event event) {
		if (!(event instanceof SwapEvent))
			return;

		SwapEvent swapEvent = (SwapEvent) event;

		for (Session session : getSessions()) {
			Long preferredSwapId = sessionSwapIds.get(session);

			if (preferredSwapId == null || preferredSwapId == swapEvent.getSwapId())
				send(session, swapEvent);
		}
	}

	@OnWebSocketConnect
	@Override
	public void onWebSocketConnect(Session session) {
		Map<String, List<String>> queryParams = session.getUpgradeRequest().getParameterMap();

		List<String> swapIds = queryParams.get("swapId");
		Long swapId = null;
		if (swapIds != null && !swapIds.isEmpty()) {
			try {
				swapId = Long.valueOf(swapIds.get(0));
			} catch (NumberFormatException e) {
				session.close(4003, "invalid swapId: " + swapIds.get(0));
				return;
			}
		}

		try (final Repository repository = RepositoryManager.getRepository()) {
			List<SwapData> swaps;

			if (swapId != null) {
				SwapData swapData = repository.getSwapRepository().fromSwapId(swapId);
				if (swapData == null) {
					sendError(session, ApiError.SWAP_UNKNOWN);
					session.close(4003, "unknown swap: " + swapId);
					return;
				}

				swaps = Collections.singletonList(swapData);
			} else {
				swaps = repository.getSwapRepository().getActiveSwaps();
			}

			StringWriter stringWriter = new StringWriter();
			marshall(stringWriter, swaps);
			session.getRemote().sendStringByFuture(stringWriter.toString());
		} catch (DataException e) {
			LOGGER.warn(() -> String.format("Repository issue fetching swaps for websocket: %s", e.getMessage()));
			session.close(4001, "repository issue fetching swaps");
			return;
		} catch (IOException e) {
			session.close(4002, "websocket issue");
			return;
		}

		if (swapId != null)
			sessionSwapIds.put(session, swapId);

		super.onWebSocketConnect(session);
	}

	@OnWebSocketClose
	@Override
	public void onWebSocketClose(Session session, int statusCode, String reason) {
		sessionSwapIds.remove(session);

		super.onWebSocketClose(session, statusCode, reason);
	}

	@OnWebSocketError
	public void onWebSocketError(Session session, Throwable throwable) {
		LOGGER.debug(() -> String.format("Swaps websocket error: %s", throwable.getMessage()));
	}

	@OnWebSocketMessage
	public void onWebSocketMessage(Session session, String message) {
		/* ignored */
	}

	private void send(Session session, SwapEvent swapEvent) {
		try {
			StringWriter stringWriter = new StringWriter();
			marshall(stringWriter, swapEvent);

			session.getRemote().sendStringByFuture(stringWriter.toString());
		} catch (IOException e) {
			LOGGER.debug(() -> String.format("Unable to send %s to websocket: %s", swapEvent, e.getMessage()));
		}
	}

}
