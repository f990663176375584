package com.relay.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relay.broker.event.BrokerEventListener;
import com.relay.broker.event.ErrorOccurred;
import com.relay.broker.popup.PopupCorrelator;
import com.relay.broker.popup.PopupInfo;
import com.relay.broker.routing.MessageRouter;
import com.relay.broker.session.ClientSession;
import com.relay.broker.session.SessionRegistry;
import com.relay.protocol.ClientRole;
import com.relay.protocol.ErrorCode;
import com.relay.protocol.MessageKind;
import com.relay.protocol.Messages;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Interprets messages arriving from client connections.
 *
 * Pending connections may only identify. Identified clients can report popup
 * results, answer pings, drive popups through {@code popup.*} requests and send
 * role-targeted messages through the router.
 *
 * Popup requests (requesters only):
 *   popup.create   { responderId?, options }   → { popupId }
 *   popup.await    { popupId, timeout? }       → popup result
 *   popup.awaitAny { timeout? }                → popup result
 *   popup.cancel   { popupId }                 → { popupId, cancelled:true }
 *   popup.closeAll { responderId? }            → { closed:[ids] }
 *   popup.list     { responderId? }            → { popups:[...] }
 *
 * Runs on the broker loop.
 */
public final class ClientMessageHandler {

    private static final Logger log = LoggerFactory.getLogger(ClientMessageHandler.class);

    static final String POPUP_PREFIX = "popup.";

    private final BrokerExecutor      loop;
    private final SessionRegistry     registry;
    private final MessageRouter       router;
    private final PopupCorrelator     popups;
    private final Clock               clock;
    private final BrokerEventListener events;

    public ClientMessageHandler(BrokerExecutor loop, SessionRegistry registry, MessageRouter router,
                                PopupCorrelator popups, Clock clock, BrokerEventListener events) {
        this.loop     = loop;
        this.registry = registry;
        this.router   = router;
        this.popups   = popups;
        this.clock    = clock;
        this.events   = events;
    }

    public void handleRaw(String clientId, String text) {
        JsonNode msg;
        try {
            msg = Messages.parse(text);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse message from {}: {}", clientId, e.getOriginalMessage());
            events.onEvent(new ErrorOccurred(clock.instant(), ErrorOccurred.ErrorKind.PROTOCOL,
                    "Unparseable message", clientId, e));
            return;
        }
        handle(clientId, msg);
    }

    public void handle(String clientId, JsonNode msg) {
        Optional<ClientSession> session = registry.session(clientId);
        if (session.isEmpty()) {
            handlePending(clientId, msg);
            return;
        }
        registry.touch(clientId);
        ClientSession s = session.get();

        String method = Messages.method(msg);
        if (Messages.TYPE_POPUP_RESPONSE.equals(Messages.type(msg))) {
            handlePopupResponse(s, msg);
        } else if (Messages.METHOD_PONG.equals(method)) {
            log.trace("Pong from {}", clientId);
        } else if (method.startsWith(POPUP_PREFIX) && msg.has("id")) {
            handlePopupRequest(s, msg, method);
        } else if (msg.has("target")) {
            handleRouted(s, msg);
        } else if (Messages.METHOD_IDENTIFY.equals(method)) {
            log.warn("Client {} sent identify after identification, ignoring", clientId);
        } else {
            log.debug("Ignoring unrecognized message from {}: method={} type={}", clientId, method, Messages.type(msg));
        }
    }

    // ── Identification ────────────────────────────────────────────────────────

    private void handlePending(String pendingId, JsonNode msg) {
        if (!Messages.METHOD_IDENTIFY.equals(Messages.method(msg))) {
            log.warn("Dropping message from unidentified connection {}: method={}", pendingId, Messages.method(msg));
            return;
        }
        JsonNode params = msg.path("params");
        registry.identify(pendingId, params).addListener(f -> {
            if (f.isSuccess()) return;
            ErrorCode code = BrokerException.codeOf(f.cause());
            log.warn("Rejecting connection {}: {}", pendingId, f.cause().getMessage());
            registry.rejectPending(pendingId, Messages.error(msg.get("id"), code, f.cause().getMessage()),
                    f.cause().getMessage());
        });
    }

    // ── Popup results ─────────────────────────────────────────────────────────

    private void handlePopupResponse(ClientSession s, JsonNode msg) {
        String popupId = msg.path("popupId").asText(null);
        if (popupId == null) {
            log.warn("popup_response without popupId from {}", s.id);
            return;
        }
        popups.resolve(popupId, msg.get("result")).addListener(f -> {
            if (f.isSuccess()) {
                log.debug("Popup {} resolved by {}", popupId, s.id);
                return;
            }
            log.warn("Could not resolve popup {} from {}: {}", popupId, s.id, f.cause().getMessage());
            events.onEvent(new ErrorOccurred(clock.instant(), ErrorOccurred.ErrorKind.POPUP,
                    "Popup resolve failed: " + f.cause().getMessage(), s.id, f.cause()));
        });
    }

    // ── Popup requests ────────────────────────────────────────────────────────

    private void handlePopupRequest(ClientSession s, JsonNode msg, String method) {
        JsonNode id = msg.get("id");
        if (s.role != ClientRole.REQUESTER) {
            reply(s, Messages.error(id, ErrorCode.BAD_REQUEST, "Popup operations are only available to requesters"));
            return;
        }
        JsonNode params = msg.path("params");

        Future<? extends JsonNode> result;
        try {
            result = switch (method) {
                case "popup.create"   -> create(s, params);
                case "popup.await"    -> popups.awaitResult(required(params, "popupId"), s.id, timeout(params));
                case "popup.awaitAny" -> popups.awaitAny(s.id, timeout(params));
                case "popup.cancel"   -> cancel(required(params, "popupId"));
                case "popup.closeAll" -> closeAll(params.path("responderId").asText(null));
                case "popup.list"     -> loop.succeeded(popupList(popups.active(params.path("responderId").asText(null))));
                default -> throw new BrokerException(ErrorCode.BAD_REQUEST, "Unknown method " + method);
            };
        } catch (BrokerException e) {
            reply(s, Messages.error(id, e.code(), e.getMessage()));
            return;
        }

        result.addListener(f -> {
            if (f.isSuccess()) {
                reply(s, Messages.response(id, (JsonNode) f.getNow()));
            } else {
                reply(s, Messages.error(id, BrokerException.codeOf(f.cause()), f.cause().getMessage()));
            }
        });
    }

    private Future<ObjectNode> create(ClientSession s, JsonNode params) {
        String responderId = params.path("responderId").asText(null);
        if (responderId == null) {
            responderId = registry.mostRecentlyActive(ClientRole.RESPONDER)
                    .map(r -> r.id)
                    .orElseThrow(() -> new BrokerException(ErrorCode.NO_TARGET_AVAILABLE, "No responder clients connected"));
        } else {
            String target = responderId;
            ClientSession responder = registry.session(target)
                    .orElseThrow(() -> new BrokerException(ErrorCode.NOT_FOUND, "Client " + target + " not found"));
            if (responder.role != ClientRole.RESPONDER) {
                throw new BrokerException(ErrorCode.BAD_REQUEST, "Client " + target + " is not a responder");
            }
        }
        return map(popups.create(s.id, responderId, params.get("options")), popupId -> {
            ObjectNode out = Messages.object();
            out.put("popupId", popupId);
            return out;
        });
    }

    private Future<ObjectNode> cancel(String popupId) {
        return map(popups.cancel(popupId), v -> {
            ObjectNode out = Messages.object();
            out.put("popupId", popupId);
            out.put("cancelled", true);
            return out;
        });
    }

    private Future<ObjectNode> closeAll(String responderId) {
        return map(popups.closeAll(responderId), ids -> {
            ObjectNode out = Messages.object();
            ArrayNode closed = out.putArray("closed");
            ids.forEach(closed::add);
            return out;
        });
    }

    static ObjectNode popupList(Iterable<PopupInfo> infos) {
        ObjectNode out = Messages.object();
        ArrayNode arr = out.putArray("popups");
        for (PopupInfo p : infos) {
            ObjectNode n = arr.addObject();
            n.put("id", p.id());
            n.put("requesterId", p.requesterId());
            n.put("responderId", p.responderId());
            n.put("status", p.status().wireName);
            n.put("createdAt", p.createdAt().toString());
            n.set("options", p.options());
        }
        return out;
    }

    // ── Routed messages ───────────────────────────────────────────────────────

    private void handleRouted(ClientSession s, JsonNode msg) {
        ClientRole target = Messages.targetRole(msg);
        if (target == null) {
            log.warn("Message from {} has unknown target {}", s.id, msg.path("target"));
            if (MessageKind.classify(msg) == MessageKind.REQUEST) {
                reply(s, Messages.error(msg.get("id"), ErrorCode.BAD_REQUEST, "Unknown target type"));
            }
            return;
        }
        router.route(msg, target, s.id).addListener(f -> {
            if (f.isSuccess()) return;
            log.warn("Routing from {} to {} failed: {}", s.id, target, f.cause().getMessage());
            if (MessageKind.classify(msg) == MessageKind.REQUEST) {
                reply(s, Messages.error(msg.get("id"), BrokerException.codeOf(f.cause()), f.cause().getMessage()));
            }
        });
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void reply(ClientSession s, JsonNode message) {
        registry.send(s.id, message).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("Reply to {} not delivered: {}", s.id, f.cause().getMessage());
            }
        });
    }

    private static String required(JsonNode params, String field) {
        String v = params.path(field).asText(null);
        if (v == null || v.isEmpty()) {
            throw new BrokerException(ErrorCode.BAD_REQUEST, "Missing parameter " + field);
        }
        return v;
    }

    private static Duration timeout(JsonNode params) {
        long ms = params.path("timeout").asLong(0);
        return ms > 0 ? Duration.ofMillis(ms) : null;
    }

    private <T> Future<ObjectNode> map(Future<T> future, Function<T, ObjectNode> fn) {
        Promise<ObjectNode> out = loop.newPromise();
        future.addListener(f -> {
            if (f.isSuccess()) {
                @SuppressWarnings("unchecked")
                T value = (T) f.getNow();
                try {
                    out.trySuccess(fn.apply(value));
                } catch (RuntimeException e) {
                    out.tryFailure(e);
                }
            } else {
                out.tryFailure(f.cause());
            }
        });
        return out;
    }
}
