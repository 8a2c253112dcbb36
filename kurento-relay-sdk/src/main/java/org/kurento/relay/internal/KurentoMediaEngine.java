/*
 * (C) Copyright 2015 Kurento (http://kurento.org/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.kurento.relay.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;

import org.kurento.client.Continuation;
import org.kurento.client.ErrorEvent;
import org.kurento.client.EventListener;
import org.kurento.client.IceCandidate;
import org.kurento.client.IceCandidateFoundEvent;
import org.kurento.client.KurentoClient;
import org.kurento.client.MediaElement;
import org.kurento.client.MediaObject;
import org.kurento.client.MediaPipeline;
import org.kurento.client.MediaType;
import org.kurento.client.RtpEndpoint;
import org.kurento.client.WebRtcEndpoint;
import org.kurento.commons.exception.KurentoException;
import org.kurento.relay.api.KurentoClientProvider;
import org.kurento.relay.api.MediaEngine;
import org.kurento.relay.api.RelayHandler;
import org.kurento.relay.api.pojo.CodecCapability;
import org.kurento.relay.api.pojo.ConsumerHandle;
import org.kurento.relay.api.pojo.MediaKind;
import org.kurento.relay.api.pojo.ProducerHandle;
import org.kurento.relay.api.pojo.RtpCapabilities;
import org.kurento.relay.api.pojo.TapHandle;
import org.kurento.relay.api.pojo.TransportHandle;
import org.kurento.relay.api.pojo.TransportRole;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * {@link MediaEngine} backed by a single Kurento {@link MediaPipeline}.
 * <p/>
 * Client transports are {@link WebRtcEndpoint}s negotiated through an SDP offer carried in the
 * connection parameters. A producer is the media of one kind sent by a producing endpoint, and a
 * consumer links it to a consuming endpoint (or to a tap): the link is only established when the
 * consumer is resumed. Taps are {@link RtpEndpoint}s sending plain RTP to a local encoder.
 */
public class KurentoMediaEngine implements MediaEngine {
  private static final Logger log = LoggerFactory.getLogger(KurentoMediaEngine.class);

  public static final String SDP_OFFER_PARAM = "sdpOffer";
  public static final String SDP_ANSWER_PARAM = "sdpAnswer";

  private final KurentoClientProvider kcProvider;
  private final RelayHandler relayHandler;
  private final KurentoEngineSettings settings;

  private volatile KurentoClient kurentoClient;
  private volatile MediaPipeline pipeline;
  private final Object pipelineLock = new Object();

  private final ConcurrentMap<String, TransportEntry> transports =
      new ConcurrentHashMap<String, TransportEntry>();
  private final ConcurrentMap<String, ProducerEntry> producers =
      new ConcurrentHashMap<String, ProducerEntry>();
  private final ConcurrentMap<String, ConsumerEntry> consumers =
      new ConcurrentHashMap<String, ConsumerEntry>();
  private final ConcurrentMap<String, TapEntry> taps = new ConcurrentHashMap<String, TapEntry>();
  private final Set<Integer> reservedPorts = ConcurrentHashMap.newKeySet();

  public KurentoMediaEngine(KurentoClientProvider kcProvider, RelayHandler relayHandler,
      KurentoEngineSettings settings) {
    this.kcProvider = kcProvider;
    this.relayHandler = relayHandler;
    this.settings = settings;
  }

  /**
   * Creates the routing context. A failure leaves the engine unavailable; it is logged and every
   * later operation fails with ENGINE_UNAVAILABLE.
   */
  @PostConstruct
  public void init() {
    synchronized (pipelineLock) {
      if (pipeline != null) {
        return;
      }
      log.info("Creating MediaPipeline");
      try {
        kurentoClient = kcProvider.getKurentoClient();
        MediaPipeline newPipeline = kurentoClient.createMediaPipeline();
        newPipeline.addErrorListener(new EventListener<ErrorEvent>() {
          @Override
          public void onEvent(ErrorEvent event) {
            String desc = event.getType() + ": " + event.getDescription() + "(errCode="
                + event.getErrorCode() + ")";
            log.error("Pipeline error encountered: {}", desc);
            relayHandler.onEngineFailure(desc);
          }
        });
        pipeline = newPipeline;
        log.debug("Created MediaPipeline {}", newPipeline.getId());
      } catch (KurentoException e) {
        log.error("Unable to create the media pipeline", e);
      } catch (RelayException e) {
        log.error("Unable to obtain a Kurento client: {}", e.getMessage());
      }
    }
  }

  @PreDestroy
  public void close() {
    for (String tapId : new ArrayList<String>(taps.keySet())) {
      closeTap(tapId);
    }
    for (String transportId : new ArrayList<String>(transports.keySet())) {
      closeTransport(transportId);
    }
    synchronized (pipelineLock) {
      if (pipeline != null) {
        release("pipeline", pipeline);
        pipeline = null;
      }
    }
    if (kurentoClient != null && kcProvider.destroyWhenUnused()) {
      kurentoClient.destroy();
    }
    log.info("Media engine closed");
  }

  public boolean isAvailable() {
    return pipeline != null;
  }

  // ----------------- CAPABILITIES ------------

  @Override
  public RtpCapabilities getCapabilities() throws RelayException {
    getPipeline();
    return new RtpCapabilities(settings.getCodecs());
  }

  // ----------------- TRANSPORTS ------------

  @Override
  public TransportHandle openTransport(final String clientId, final TransportRole role)
      throws RelayException {
    MediaPipeline mp = getPipeline();
    final WebRtcEndpoint endpoint;
    try {
      endpoint = new WebRtcEndpoint.Builder(mp).build();
    } catch (KurentoException e) {
      throw new RelayException(Code.CONNECT_ERROR_CODE,
          "Unable to create " + role.getValue() + " transport: " + e.getMessage(), e);
    }
    final String transportId = endpoint.getId();
    endpoint.addIceCandidateFoundListener(new EventListener<IceCandidateFoundEvent>() {
      @Override
      public void onEvent(IceCandidateFoundEvent event) {
        relayHandler.onIceCandidate(clientId, transportId, role, toJson(event.getCandidate()));
      }
    });
    endpoint.addErrorListener(new EventListener<ErrorEvent>() {
      @Override
      public void onEvent(ErrorEvent event) {
        String desc = event.getType() + ": " + event.getDescription() + "(errCode="
            + event.getErrorCode() + ")";
        log.warn("EP {}: Error on {} transport of client {}: {}", transportId, role.getValue(),
            clientId, desc);
        relayHandler.onMediaElementError(clientId, desc);
      }
    });

    JsonObject parameters = new JsonObject();
    parameters.addProperty("id", transportId);
    parameters.addProperty("role", role.getValue());
    TransportHandle handle = new TransportHandle(transportId, clientId, role, parameters);
    transports.put(transportId, new TransportEntry(handle, endpoint));
    log.debug("EP {}: Created {} transport for client {}", transportId, role.getValue(), clientId);
    return handle;
  }

  @Override
  public JsonObject connectTransport(TransportHandle transport, JsonObject dtlsParameters)
      throws RelayException {
    TransportEntry entry = getTransport(transport.getId(), Code.CONNECT_ERROR_CODE);
    JsonElement offer = dtlsParameters.get(SDP_OFFER_PARAM);
    if (offer == null || !offer.isJsonPrimitive()) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Connection parameters must carry an " + SDP_OFFER_PARAM);
    }
    String sdpAnswer;
    try {
      sdpAnswer = entry.endpoint.processOffer(offer.getAsString());
    } catch (KurentoException e) {
      throw new RelayException(Code.CONNECT_ERROR_CODE,
          "Unable to negotiate transport " + transport.getId() + ": " + e.getMessage(), e);
    }
    gatherCandidates(entry);
    JsonObject answer = new JsonObject();
    answer.addProperty(SDP_ANSWER_PARAM, sdpAnswer);
    return answer;
  }

  @Override
  public void addIceCandidate(TransportHandle transport, JsonObject candidate)
      throws RelayException {
    TransportEntry entry = getTransport(transport.getId(), Code.CONNECT_ERROR_CODE);
    IceCandidate iceCandidate;
    try {
      iceCandidate = new IceCandidate(candidate.get("candidate").getAsString(),
          candidate.get("sdpMid").getAsString(), candidate.get("sdpMLineIndex").getAsInt());
    } catch (RuntimeException e) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Malformed ICE candidate " + candidate, e);
    }
    try {
      entry.endpoint.addIceCandidate(iceCandidate);
    } catch (KurentoException e) {
      throw new RelayException(Code.CONNECT_ERROR_CODE,
          "Unable to add ICE candidate to transport " + transport.getId(), e);
    }
  }

  // ----------------- PRODUCERS ------------

  @Override
  public ProducerHandle produce(TransportHandle transport, MediaKind kind, JsonObject rtpParameters)
      throws RelayException {
    TransportEntry entry = getTransport(transport.getId(), Code.PRODUCE_ERROR_CODE);
    if (entry.handle.getRole() != TransportRole.PRODUCING) {
      throw new RelayException(Code.PRODUCE_ERROR_CODE,
          "Transport " + transport.getId() + " is not a producer transport");
    }
    String producerId = UUID.randomUUID().toString();
    producers.put(producerId, new ProducerEntry(producerId, kind, entry));
    log.debug("EP {}: Registered {} producer {}", transport.getId(), kind.getValue(), producerId);
    return new ProducerHandle(producerId, kind, transport.getId());
  }

  // ----------------- CONSUMERS ------------

  @Override
  public boolean canConsume(String producerId, RtpCapabilities capabilities) {
    ProducerEntry producer = producers.get(producerId);
    if (producer == null || capabilities == null || pipeline == null) {
      return false;
    }
    return capabilities.canReceive(producer.kind, getCapabilities());
  }

  @Override
  public ConsumerHandle consume(TransportHandle transport, String producerId,
      RtpCapabilities capabilities) throws RelayException {
    TransportEntry entry = getTransport(transport.getId(), Code.CONSUME_ERROR_CODE);
    if (entry.handle.getRole() != TransportRole.CONSUMING) {
      throw new RelayException(Code.CONSUME_ERROR_CODE,
          "Transport " + transport.getId() + " is not a consumer transport");
    }
    ProducerEntry producer = getProducer(producerId);
    if (!canConsume(producerId, capabilities)) {
      throw new RelayException(Code.CONSUME_ERROR_CODE,
          "Capabilities do not allow consuming producer " + producerId);
    }
    ConsumerEntry consumer = new ConsumerEntry(UUID.randomUUID().toString(), producer,
        entry.endpoint);
    consumers.put(consumer.id, consumer);
    log.debug("EP {}: Created paused consumer {} of producer {}", transport.getId(), consumer.id,
        producerId);
    return new ConsumerHandle(consumer.id, producerId, producer.kind,
        rtpParameters(producer.kind, consumer.id));
  }

  @Override
  public void resumeConsumer(String consumerId) throws RelayException {
    ConsumerEntry consumer = consumers.get(consumerId);
    if (consumer == null) {
      throw new RelayException(Code.NOT_FOUND_ERROR_CODE,
          "No consumer with id '" + consumerId + "' was found");
    }
    synchronized (consumer) {
      if (!consumer.paused) {
        return;
      }
      try {
        consumer.producer.transport.endpoint.connect(consumer.sink, mediaType(consumer.producer));
      } catch (KurentoException e) {
        throw new RelayException(Code.CONSUME_ERROR_CODE,
            "Unable to resume consumer " + consumerId + ": " + e.getMessage(), e);
      }
      consumer.paused = false;
    }
    log.debug("Resumed consumer {} of producer {}", consumerId, consumer.producer.id);
  }

  // ----------------- TAPS ------------

  @Override
  public TapHandle openPassiveTap(String listenAddress) throws RelayException {
    MediaPipeline mp = getPipeline();
    int port;
    synchronized (reservedPorts) {
      port = UdpPorts.findFreeRtpPort(listenAddress, settings.getRtpMinPort(),
          settings.getRtpMaxPort(), reservedPorts);
      reservedPorts.add(port);
    }
    RtpEndpoint endpoint;
    try {
      endpoint = new RtpEndpoint.Builder(mp).build();
    } catch (KurentoException e) {
      reservedPorts.remove(port);
      throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
          "Unable to create tap transport: " + e.getMessage(), e);
    }
    TapHandle tap = new TapHandle(endpoint.getId(), listenAddress, port,
        tapSessionDescription(listenAddress, port));
    taps.put(tap.getId(), new TapEntry(tap, endpoint));
    log.debug("TAP {}: Created towards {}:{}", tap.getId(), listenAddress, port);
    return tap;
  }

  @Override
  public ConsumerHandle tapConsume(TapHandle tap, String producerId) throws RelayException {
    TapEntry entry = getTap(tap.getId());
    ProducerEntry producer = getProducer(producerId);
    ConsumerEntry consumer = new ConsumerEntry(UUID.randomUUID().toString(), producer,
        entry.endpoint);
    consumers.put(consumer.id, consumer);
    log.debug("TAP {}: Created paused consumer {} of producer {}", tap.getId(), consumer.id,
        producerId);
    return new ConsumerHandle(consumer.id, producerId, producer.kind,
        rtpParameters(producer.kind, consumer.id));
  }

  @Override
  public void connectTap(TapHandle tap) throws RelayException {
    TapEntry entry = getTap(tap.getId());
    try {
      String answer = entry.endpoint.processOffer(tap.getSessionDescription());
      log.trace("TAP {}: SDP answer {}", tap.getId(), answer);
    } catch (KurentoException e) {
      throw new RelayException(Code.CONNECT_ERROR_CODE,
          "Unable to connect tap " + tap.getId() + ": " + e.getMessage(), e);
    }
    log.debug("TAP {}: Sending to {}:{}", tap.getId(), tap.getAddress(), tap.getLocalPort());
  }

  // ----------------- RELEASE ------------

  @Override
  public void closeTransport(String transportId) {
    TransportEntry entry = transports.remove(transportId);
    if (entry == null) {
      return;
    }
    for (ProducerEntry producer : new ArrayList<ProducerEntry>(producers.values())) {
      if (producer.transport == entry) {
        closeProducer(producer.id);
      }
    }
    removeConsumersOfSink(entry.endpoint);
    release("transport " + transportId, entry.endpoint);
  }

  @Override
  public void closeProducer(String producerId) {
    ProducerEntry producer = producers.remove(producerId);
    if (producer == null) {
      return;
    }
    for (ConsumerEntry consumer : new ArrayList<ConsumerEntry>(consumers.values())) {
      if (consumer.producer == producer) {
        closeConsumer(consumer.id);
      }
    }
    log.debug("Closed producer {}", producerId);
  }

  @Override
  public void closeConsumer(String consumerId) {
    ConsumerEntry consumer = consumers.remove(consumerId);
    if (consumer == null) {
      return;
    }
    synchronized (consumer) {
      if (consumer.paused) {
        return;
      }
      consumer.paused = true;
      try {
        consumer.producer.transport.endpoint.disconnect(consumer.sink,
            mediaType(consumer.producer));
      } catch (KurentoException e) {
        log.warn("Could not disconnect consumer {} from producer {}: {}", consumerId,
            consumer.producer.id, e.getMessage());
      }
    }
  }

  @Override
  public void closeTap(String tapId) {
    TapEntry entry = taps.remove(tapId);
    if (entry == null) {
      return;
    }
    removeConsumersOfSink(entry.endpoint);
    release("tap " + tapId, entry.endpoint);
    reservedPorts.remove(entry.handle.getLocalPort());
  }

  // ----------------- INTERNAL ------------

  private MediaPipeline getPipeline() throws RelayException {
    MediaPipeline mp = pipeline;
    if (mp == null) {
      throw new RelayException(Code.ENGINE_UNAVAILABLE_ERROR_CODE,
          "The media pipeline is not available");
    }
    return mp;
  }

  private TransportEntry getTransport(String transportId, Code code) {
    TransportEntry entry = transports.get(transportId);
    if (entry == null) {
      throw new RelayException(code, "Unknown transport " + transportId);
    }
    return entry;
  }

  private ProducerEntry getProducer(String producerId) {
    ProducerEntry producer = producers.get(producerId);
    if (producer == null) {
      throw new RelayException(Code.CONSUME_ERROR_CODE, "Unknown producer " + producerId);
    }
    return producer;
  }

  private TapEntry getTap(String tapId) {
    TapEntry entry = taps.get(tapId);
    if (entry == null) {
      throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE, "Unknown tap " + tapId);
    }
    return entry;
  }

  private void removeConsumersOfSink(MediaElement sink) {
    for (ConsumerEntry consumer : new ArrayList<ConsumerEntry>(consumers.values())) {
      if (consumer.sink == sink) {
        closeConsumer(consumer.id);
      }
    }
  }

  private void gatherCandidates(final TransportEntry entry) {
    entry.endpoint.gatherCandidates(new Continuation<Void>() {
      @Override
      public void onSuccess(Void result) throws Exception {
        log.trace("EP {}: Internal endpoint started to gather candidates", entry.handle.getId());
      }

      @Override
      public void onError(Throwable cause) throws Exception {
        log.warn("EP {}: Internal endpoint failed to start gathering candidates",
            entry.handle.getId(), cause);
      }
    });
  }

  private void release(final String what, MediaObject object) {
    object.release(new Continuation<Void>() {
      @Override
      public void onSuccess(Void result) throws Exception {
        log.debug("Released {}", what);
      }

      @Override
      public void onError(Throwable cause) throws Exception {
        log.warn("Could not successfully release {}", what, cause);
      }
    });
  }

  private JsonObject rtpParameters(MediaKind kind, String consumerId) {
    JsonArray codecs = new JsonArray();
    for (CodecCapability codec : settings.getCodecs()) {
      if (codec.getKind() == kind) {
        JsonObject json = new JsonObject();
        json.addProperty("mimeType", codec.getMimeType());
        json.addProperty("clockRate", codec.getClockRate());
        if (codec.getChannels() != null) {
          json.addProperty("channels", codec.getChannels());
        }
        codecs.add(json);
      }
    }
    JsonObject parameters = new JsonObject();
    parameters.addProperty("mid", consumerId);
    parameters.add("codecs", codecs);
    return parameters;
  }

  String tapSessionDescription(String address, int port) {
    int pt = settings.getTapPayloadType();
    StringBuilder sdp = new StringBuilder();
    sdp.append("v=0\r\n");
    sdp.append("o=- 0 0 IN IP4 ").append(address).append("\r\n");
    sdp.append("s=Kurento Relay HLS\r\n");
    sdp.append("c=IN IP4 ").append(address).append("\r\n");
    sdp.append("t=0 0\r\n");
    sdp.append("m=video ").append(port).append(" RTP/AVP ").append(pt).append("\r\n");
    sdp.append("a=rtpmap:").append(pt).append(' ').append(settings.getTapCodec()).append("\r\n");
    sdp.append("a=fmtp:").append(pt).append(" packetization-mode=1\r\n");
    sdp.append("a=recvonly\r\n");
    return sdp.toString();
  }

  private static MediaType mediaType(ProducerEntry producer) {
    return producer.kind == MediaKind.AUDIO ? MediaType.AUDIO : MediaType.VIDEO;
  }

  private static JsonObject toJson(IceCandidate candidate) {
    JsonObject json = new JsonObject();
    json.addProperty("candidate", candidate.getCandidate());
    json.addProperty("sdpMid", candidate.getSdpMid());
    json.addProperty("sdpMLineIndex", candidate.getSdpMLineIndex());
    return json;
  }

  private static class TransportEntry {
    private final TransportHandle handle;
    private final WebRtcEndpoint endpoint;

    TransportEntry(TransportHandle handle, WebRtcEndpoint endpoint) {
      this.handle = handle;
      this.endpoint = endpoint;
    }
  }

  private static class ProducerEntry {
    private final String id;
    private final MediaKind kind;
    private final TransportEntry transport;

    ProducerEntry(String id, MediaKind kind, TransportEntry transport) {
      this.id = id;
      this.kind = kind;
      this.transport = transport;
    }
  }

  private static class ConsumerEntry {
    private final String id;
    private final ProducerEntry producer;
    private final MediaElement sink;
    private boolean paused = true;

    ConsumerEntry(String id, ProducerEntry producer, MediaElement sink) {
      this.id = id;
      this.producer = producer;
      this.sink = sink;
    }
  }

  private static class TapEntry {
    private final TapHandle handle;
    private final RtpEndpoint endpoint;

    TapEntry(TapHandle handle, RtpEndpoint endpoint) {
      this.handle = handle;
      this.endpoint = endpoint;
    }
  }
}
