package org.kurento.relay.rpc;

import java.io.IOException;

import org.kurento.jsonrpc.DefaultJsonRpcHandler;
import org.kurento.jsonrpc.Session;
import org.kurento.jsonrpc.Transaction;
import org.kurento.jsonrpc.message.Request;
import org.kurento.relay.SignalingManager;
import org.kurento.relay.api.pojo.TransportRole;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.kurento.relay.internal.ProtocolElements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * JSON-RPC endpoint of the relay. Requests of a session are queued on the signaling manager so
 * that they run one at a time, and every request is answered, with a result or an error, once it
 * has been processed.
 */
public class RelayJsonRpcHandler extends DefaultJsonRpcHandler<JsonObject> {
    private static final Logger log = LoggerFactory.getLogger(RelayJsonRpcHandler.class);

    private final SignalingManager signalingManager;
    private final RelayNotificationService notificationService;

    public RelayJsonRpcHandler(SignalingManager signalingManager, RelayNotificationService notificationService) {
        this.signalingManager = signalingManager;
        this.notificationService = notificationService;
    }

    @Override
    public void afterConnectionEstablished(Session session) throws Exception {
        log.info("Client {} connected", session.getSessionId());
        notificationService.addSession(session);
        signalingManager.connect(session.getSessionId());
    }

    @Override
    public void afterConnectionClosed(Session session, String status) throws Exception {
        final String clientId = session.getSessionId();
        log.info("Client {} disconnected ({})", clientId, status);
        notificationService.removeSession(clientId);
        signalingManager.submit(clientId, new Runnable() {
            @Override
            public void run() {
                signalingManager.disconnect(clientId);
            }
        });
    }

    @Override
    public void handleRequest(final Transaction transaction, final Request<JsonObject> request) throws Exception {
        final String clientId = transaction.getSession().getSessionId();
        log.debug("Session #{} - request: {}", clientId, request);

        if (ProtocolElements.HEALTHCHECK_METHOD.equals(request.getMethod())) {
            JsonObject status = new JsonObject();
            status.addProperty(ProtocolElements.HEALTHCHECK_STATUS_PARAM, "ok");
            transaction.sendResponse(status);
            return;
        }

        final boolean notification = transaction.isNotification();
        if (!notification) {
            transaction.startAsync();
        }
        signalingManager.submit(clientId, new Runnable() {
            @Override
            public void run() {
                process(clientId, transaction, request, notification);
            }
        });
    }

    void process(String clientId, Transaction transaction, Request<JsonObject> request, boolean notification) {
        try {
            JsonObject result = dispatch(clientId, request);
            if (!notification) {
                transaction.sendResponse(result);
            }
        } catch (RelayException e) {
            log.warn("CLIENT {}: Error processing {}: {}", clientId, request.getMethod(), e.getMessage());
            sendError(clientId, transaction, request, notification, e);
        } catch (RuntimeException e) {
            log.error("CLIENT {}: Unexpected error processing {}", clientId, request.getMethod(), e);
            sendError(clientId, transaction, request, notification,
                    new RelayException(Code.GENERIC_ERROR_CODE, e.getMessage(), e));
        } catch (IOException e) {
            log.warn("CLIENT {}: Unable to send the response to {}", clientId, request.getMethod(), e);
        }
    }

    JsonObject dispatch(String clientId, Request<JsonObject> request) throws RelayException {
        JsonObject params = request.getParams();
        String method = request.getMethod();
        switch (method) {
            case ProtocolElements.GETRTPCAPABILITIES_METHOD:
                return signalingManager.getRtpCapabilities(clientId);
            case ProtocolElements.SETRTPCAPABILITIES_METHOD:
                signalingManager.setRtpCapabilities(clientId,
                        getObjectParam(params, ProtocolElements.SETRTPCAPABILITIES_RTPCAPABILITIES_PARAM));
                return success();
            case ProtocolElements.CREATEPRODUCERTRANSPORT_METHOD:
                return signalingManager.createTransport(clientId, TransportRole.PRODUCING);
            case ProtocolElements.CREATECONSUMERTRANSPORT_METHOD:
                return signalingManager.createTransport(clientId, TransportRole.CONSUMING);
            case ProtocolElements.CONNECTPRODUCERTRANSPORT_METHOD:
                return signalingManager.connectTransport(clientId, TransportRole.PRODUCING,
                        getObjectParam(params, ProtocolElements.CONNECTTRANSPORT_DTLSPARAMETERS_PARAM));
            case ProtocolElements.CONNECTCONSUMERTRANSPORT_METHOD:
                return signalingManager.connectTransport(clientId, TransportRole.CONSUMING,
                        getObjectParam(params, ProtocolElements.CONNECTTRANSPORT_DTLSPARAMETERS_PARAM));
            case ProtocolElements.ADDICECANDIDATE_METHOD:
                signalingManager.addIceCandidate(clientId,
                        getRoleParam(params, ProtocolElements.ADDICECANDIDATE_ROLE_PARAM),
                        getObjectParam(params, ProtocolElements.ADDICECANDIDATE_CANDIDATE_PARAM));
                return success();
            case ProtocolElements.PRODUCE_METHOD:
                return signalingManager.produce(clientId,
                        getStringParam(params, ProtocolElements.PRODUCE_KIND_PARAM),
                        getObjectParam(params, ProtocolElements.PRODUCE_RTPPARAMETERS_PARAM));
            case ProtocolElements.CONSUME_METHOD:
                return signalingManager.consume(clientId,
                        getStringParam(params, ProtocolElements.CONSUME_PRODUCERID_PARAM));
            case ProtocolElements.RESUMECONSUMER_METHOD:
                return signalingManager.resumeConsumer(clientId,
                        getStringParam(params, ProtocolElements.RESUMECONSUMER_CONSUMERID_PARAM));
            case ProtocolElements.GETPRODUCERS_METHOD:
                return signalingManager.getProducers(clientId);
            case ProtocolElements.STARTHLSSTREAM_METHOD:
                return signalingManager.startHlsStream(clientId,
                        getStringParam(params, ProtocolElements.HLSSTREAM_STREAMID_PARAM));
            case ProtocolElements.STOPHLSSTREAM_METHOD:
                return signalingManager.stopHlsStream(clientId,
                        getStringParam(params, ProtocolElements.HLSSTREAM_STREAMID_PARAM));
            case ProtocolElements.GETACTIVESTREAMS_METHOD:
                return signalingManager.getActiveStreams();
            default:
                throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE, "Unknown method '" + method + "'");
        }
    }

    private void sendError(String clientId, Transaction transaction, Request<JsonObject> request,
                           boolean notification, RelayException error) {
        if (notification) {
            return;
        }
        try {
            transaction.sendError(error.getCodeValue(), error.getMessage(), error.getCode().getKind());
        } catch (IOException e) {
            log.warn("CLIENT {}: Unable to send the error response to {}", clientId, request.getMethod(), e);
        }
    }

    private static JsonObject success() {
        JsonObject result = new JsonObject();
        result.addProperty(ProtocolElements.SUCCESS_PARAM, true);
        return result;
    }

    static String getStringParam(JsonObject params, String name) {
        if (params == null || !params.has(name) || params.get(name).isJsonNull()) {
            return null;
        }
        JsonElement value = params.get(name);
        if (!value.isJsonPrimitive()) {
            throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE, "Parameter '" + name + "' must be a string");
        }
        return value.getAsString();
    }

    static JsonObject getObjectParam(JsonObject params, String name) {
        if (params == null || !params.has(name) || params.get(name).isJsonNull()) {
            return null;
        }
        JsonElement value = params.get(name);
        if (!value.isJsonObject()) {
            throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE, "Parameter '" + name + "' must be an object");
        }
        return value.getAsJsonObject();
    }

    static TransportRole getRoleParam(JsonObject params, String name) {
        String role = getStringParam(params, name);
        if (TransportRole.PRODUCING.getValue().equals(role)) {
            return TransportRole.PRODUCING;
        }
        if (TransportRole.CONSUMING.getValue().equals(role)) {
            return TransportRole.CONSUMING;
        }
        throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
                "Parameter '" + name + "' must be '" + TransportRole.PRODUCING.getValue() + "' or '"
                        + TransportRole.CONSUMING.getValue() + "'");
    }
}
