package org.kurento.relay.rpc;

import java.io.IOException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.kurento.jsonrpc.Session;
import org.kurento.relay.api.RelayHandler;
import org.kurento.relay.api.RelayNotifier;
import org.kurento.relay.api.pojo.TransportRole;
import org.kurento.relay.internal.ProtocolElements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;

/**
 * Keeps the JSON-RPC session of every connected client (keyed by session id, which is also the
 * client id) and delivers the server events through them.
 */
public class RelayNotificationService implements RelayNotifier, RelayHandler {
    private static final Logger log = LoggerFactory.getLogger(RelayNotificationService.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public void addSession(Session session) {
        sessions.put(session.getSessionId(), session);
    }

    public void removeSession(String sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public void sendNotification(String clientId, String method, JsonObject params) {
        Session session = sessions.get(clientId);
        if (session == null) {
            log.debug("No session for client {}, dropping {} notification", clientId, method);
            return;
        }
        try {
            session.sendNotification(method, params);
        } catch (IOException e) {
            log.warn("Exception sending {} notification to client {}", method, clientId, e);
        }
    }

    @Override
    public void broadcast(String method, JsonObject params) {
        broadcastExcept(null, method, params);
    }

    @Override
    public void broadcastExcept(String excludedClientId, String method, JsonObject params) {
        for (String clientId : getConnectedClients()) {
            if (!clientId.equals(excludedClientId)) {
                sendNotification(clientId, method, params);
            }
        }
    }

    @Override
    public Set<String> getConnectedClients() {
        return new HashSet<>(sessions.keySet());
    }

    // ----------------- ENGINE EVENTS ------------

    @Override
    public void onIceCandidate(String clientId, String transportId, TransportRole role, JsonObject candidate) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.ICECANDIDATE_TRANSPORTID_PARAM, transportId);
        params.addProperty(ProtocolElements.ICECANDIDATE_ROLE_PARAM, role.getValue());
        params.add(ProtocolElements.ICECANDIDATE_CANDIDATE_PARAM, candidate);
        sendNotification(clientId, ProtocolElements.ICECANDIDATE_METHOD, params);
    }

    @Override
    public void onMediaElementError(String clientId, String errorDescription) {
        JsonObject params = new JsonObject();
        params.addProperty(ProtocolElements.MEDIAERROR_ERROR_PARAM, errorDescription);
        sendNotification(clientId, ProtocolElements.MEDIAERROR_METHOD, params);
    }

    @Override
    public void onEngineFailure(String errorDescription) {
        log.error("Media engine failed, shutting down the relay: {}", errorDescription);
        terminate(1);
    }

    protected void terminate(int status) {
        System.exit(status);
    }
}
