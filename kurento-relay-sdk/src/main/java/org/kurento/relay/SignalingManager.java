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
package org.kurento.relay;

import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

import org.kurento.relay.api.MediaEngine;
import org.kurento.relay.api.RelayNotifier;
import org.kurento.relay.api.pojo.ConsumerHandle;
import org.kurento.relay.api.pojo.MediaKind;
import org.kurento.relay.api.pojo.ProducerHandle;
import org.kurento.relay.api.pojo.RtpCapabilities;
import org.kurento.relay.api.pojo.TransportHandle;
import org.kurento.relay.api.pojo.TransportRole;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.kurento.relay.internal.ClientTaskQueue;
import org.kurento.relay.internal.ProtocolElements;
import org.kurento.relay.registry.ClientResources;
import org.kurento.relay.registry.ClientSession;
import org.kurento.relay.registry.ConsumerRecord;
import org.kurento.relay.registry.ProducerRecord;
import org.kurento.relay.registry.SessionRegistry;
import org.kurento.relay.registry.TransportRecord;
import org.kurento.relay.stream.StreamInfo;
import org.kurento.relay.stream.StreamManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Entry point of the relay protocol. Each operation validates its input, drives the media engine,
 * updates the session registry and returns the result to send back to the client, or throws a
 * {@link RelayException} describing why the request failed.
 * <p/>
 * Operations of the same client are expected to run one at a time: callers submit them through
 * {@link #submit(String, Runnable)}, which keeps a sequential queue per client on top of the
 * worker executor. Operations of different clients run concurrently.
 */
public class SignalingManager {
  private static final Logger log = LoggerFactory.getLogger(SignalingManager.class);

  private final MediaEngine engine;
  private final SessionRegistry registry;
  private final StreamManager streamManager;
  private final RelayNotifier notifier;
  private final Executor workers;

  private final ConcurrentMap<String, ClientTaskQueue> queues =
      new ConcurrentHashMap<String, ClientTaskQueue>();

  public SignalingManager(MediaEngine engine, SessionRegistry registry,
      StreamManager streamManager, RelayNotifier notifier, Executor workers) {
    this.engine = engine;
    this.registry = registry;
    this.streamManager = streamManager;
    this.notifier = notifier;
    this.workers = workers;
  }

  public SessionRegistry getRegistry() {
    return registry;
  }

  public StreamManager getStreamManager() {
    return streamManager;
  }

  /**
   * Queues a task behind every task previously submitted for the same client.
   */
  public void submit(String clientId, Runnable task) {
    ClientTaskQueue queue = queues.get(clientId);
    if (queue == null) {
      ClientTaskQueue newQueue = new ClientTaskQueue(clientId, workers);
      queue = queues.putIfAbsent(clientId, newQueue);
      if (queue == null) {
        queue = newQueue;
      }
    }
    queue.execute(task);
  }

  // ----------------- CLIENT LIFECYCLE ------------

  public void connect(String clientId) {
    registry.register(clientId);
  }

  /**
   * Releases everything the client owned: its engine resources and registry records first, then
   * its broadcast memberships, and finally announces the removal of its producers to the other
   * clients.
   */
  public void disconnect(String clientId) {
    log.debug("Request [DISCONNECT] clientId={}", clientId);
    ClientResources resources = registry.removeAllForClient(clientId);

    for (ConsumerRecord consumer : resources.getConsumers()) {
      engine.closeConsumer(consumer.getConsumerId());
    }
    for (ProducerRecord producer : resources.getProducers()) {
      closeDependentConsumers(producer.getProducerId());
      engine.closeProducer(producer.getProducerId());
    }
    for (TransportRecord transport : resources.getTransports()) {
      engine.closeTransport(transport.getId());
    }

    streamManager.removeClient(clientId);

    for (ProducerRecord producer : resources.getProducers()) {
      streamManager.onProducerClosed(producer.getProducerId());
      notifyProducerClosed(producer.getProducerId());
    }
    queues.remove(clientId);
    log.info("CLIENT {}: Disconnected, released {} transports, {} producers, {} consumers",
        clientId, resources.getTransports().size(), resources.getProducers().size(),
        resources.getConsumers().size());
  }

  // ----------------- CAPABILITIES ------------

  public JsonObject getRtpCapabilities(String clientId) throws RelayException {
    log.debug("Request [GET_RTP_CAPABILITIES] clientId={}", clientId);
    ClientSession session = registry.getClient(clientId);
    RtpCapabilities capabilities = engine.getCapabilities();
    session.markCapabilitiesRequested();
    JsonObject result = new JsonObject();
    result.add(ProtocolElements.GETRTPCAPABILITIES_RTPCAPABILITIES_PARAM, capabilities.toJson());
    return result;
  }

  public void setRtpCapabilities(String clientId, JsonObject rtpCapabilities)
      throws RelayException {
    log.debug("Request [SET_RTP_CAPABILITIES] clientId={}", clientId);
    ClientSession session = registry.getClient(clientId);
    if (!session.isCapabilitiesRequested()) {
      throw new RelayException(Code.PRECONDITION_FAILED_ERROR_CODE,
          "Capabilities must be requested before being set");
    }
    session.setRtpCapabilities(RtpCapabilities.fromJson(rtpCapabilities));
  }

  // ----------------- TRANSPORTS ------------

  /**
   * Opens a new transport for the role. A transport the client already owned for the same role is
   * released first, together with the producer or consumers that depended on it.
   */
  public JsonObject createTransport(String clientId, TransportRole role) throws RelayException {
    log.debug("Request [CREATE_TRANSPORT] clientId={} role={}", clientId, role);
    ClientSession session = registry.getClient(clientId);
    if (session.getTransport(role) != null) {
      releaseTransport(session, role);
    }
    TransportHandle handle = engine.openTransport(clientId, role);
    try {
      registry.upsertTransport(clientId, new TransportRecord(handle));
    } catch (RelayException e) {
      engine.closeTransport(handle.getId());
      throw e;
    }
    JsonObject result = handle.getParameters();
    if (!result.has(ProtocolElements.CREATETRANSPORT_ID_PARAM)) {
      result.addProperty(ProtocolElements.CREATETRANSPORT_ID_PARAM, handle.getId());
    }
    log.info("CLIENT {}: Created {} transport {}", clientId, role.getValue(), handle.getId());
    return result;
  }

  public JsonObject connectTransport(String clientId, TransportRole role,
      JsonObject dtlsParameters) throws RelayException {
    log.debug("Request [CONNECT_TRANSPORT] clientId={} role={}", clientId, role);
    if (dtlsParameters == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Missing " + ProtocolElements.CONNECTTRANSPORT_DTLSPARAMETERS_PARAM);
    }
    TransportRecord transport = requireTransport(registry.getClient(clientId), role);
    JsonObject answer = engine.connectTransport(transport.getHandle(), dtlsParameters);
    transport.setConnected(true);

    JsonObject result = new JsonObject();
    result.addProperty(ProtocolElements.SUCCESS_PARAM, true);
    if (answer != null) {
      for (Entry<String, JsonElement> entry : answer.entrySet()) {
        result.add(entry.getKey(), entry.getValue());
      }
    }
    log.info("CLIENT {}: Connected {} transport {}", clientId, role.getValue(), transport.getId());
    return result;
  }

  public void addIceCandidate(String clientId, TransportRole role, JsonObject candidate)
      throws RelayException {
    log.trace("Request [ADD_ICE_CANDIDATE] clientId={} role={}", clientId, role);
    if (candidate == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Missing " + ProtocolElements.ADDICECANDIDATE_CANDIDATE_PARAM);
    }
    TransportRecord transport = requireTransport(registry.getClient(clientId), role);
    engine.addIceCandidate(transport.getHandle(), candidate);
  }

  // ----------------- PRODUCERS ------------

  /**
   * Registers the client's outbound stream and announces it to every other client. A producer the
   * client already owned is closed and its removal announced first.
   */
  public JsonObject produce(String clientId, String kindValue, JsonObject rtpParameters)
      throws RelayException {
    log.debug("Request [PRODUCE] clientId={} kind={}", clientId, kindValue);
    if (kindValue == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Missing " + ProtocolElements.PRODUCE_KIND_PARAM);
    }
    if (rtpParameters == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Missing " + ProtocolElements.PRODUCE_RTPPARAMETERS_PARAM);
    }
    MediaKind kind = MediaKind.fromValue(kindValue);
    ClientSession session = registry.getClient(clientId);
    TransportRecord transport = requireTransport(session, TransportRole.PRODUCING);
    if (!transport.isConnected()) {
      throw new RelayException(Code.PRECONDITION_FAILED_ERROR_CODE,
          "Producer transport " + transport.getId() + " is not connected");
    }

    ProducerRecord previous = registry.removeProducer(clientId);
    if (previous != null) {
      log.info("CLIENT {}: Replacing producer {}", clientId, previous.getProducerId());
      releaseProducer(previous);
    }

    ProducerHandle handle = engine.produce(transport.getHandle(), kind, rtpParameters);
    try {
      registry.upsertProducer(clientId, new ProducerRecord(handle.getId(), kind, clientId));
    } catch (RelayException e) {
      engine.closeProducer(handle.getId());
      throw e;
    }
    log.info("CLIENT {}: Producing {} as {}", clientId, kind.getValue(), handle.getId());

    JsonObject announcement = new JsonObject();
    announcement.addProperty(ProtocolElements.NEWPRODUCER_PRODUCERID_PARAM, handle.getId());
    announcement.addProperty(ProtocolElements.NEWPRODUCER_CLIENTID_PARAM, clientId);
    notifier.broadcastExcept(clientId, ProtocolElements.NEWPRODUCER_METHOD, announcement);

    if (kind == MediaKind.VIDEO) {
      final String producerId = handle.getId();
      workers.execute(new Runnable() {
        @Override
        public void run() {
          streamManager.onVideoProducerAvailable(producerId);
        }
      });
    }

    JsonObject result = new JsonObject();
    result.addProperty(ProtocolElements.PRODUCE_ID_PARAM, handle.getId());
    return result;
  }

  public JsonObject getProducers(String clientId) throws RelayException {
    log.debug("Request [GET_PRODUCERS] clientId={}", clientId);
    registry.getClient(clientId);
    JsonArray producerList = new JsonArray();
    for (ProducerRecord producer : registry.listProducersExcluding(clientId)) {
      JsonObject entry = new JsonObject();
      entry.addProperty(ProtocolElements.GETPRODUCERS_PRODUCERID_PARAM, producer.getProducerId());
      entry.addProperty(ProtocolElements.GETPRODUCERS_CLIENTID_PARAM, producer.getClientId());
      producerList.add(entry);
    }
    JsonObject result = new JsonObject();
    result.add(ProtocolElements.GETPRODUCERS_PRODUCERLIST_PARAM, producerList);
    return result;
  }

  // ----------------- CONSUMERS ------------

  /**
   * Creates a paused consumer of another client's producer. The client must have declared its
   * receive capabilities, and they must be compatible with the producer.
   */
  public JsonObject consume(String clientId, String producerId) throws RelayException {
    log.debug("Request [CONSUME] clientId={} producerId={}", clientId, producerId);
    if (producerId == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Missing " + ProtocolElements.CONSUME_PRODUCERID_PARAM);
    }
    ClientSession session = registry.getClient(clientId);
    RtpCapabilities capabilities = session.getRtpCapabilities();
    if (capabilities == null) {
      throw new RelayException(Code.PRECONDITION_FAILED_ERROR_CODE,
          "Capabilities must be set before consuming");
    }
    TransportRecord transport = requireTransport(session, TransportRole.CONSUMING);
    ProducerRecord producer = registry.getProducer(producerId);
    if (!engine.canConsume(producerId, capabilities)) {
      throw new RelayException(Code.CONSUME_ERROR_CODE,
          "Cannot consume " + producer.getKind().getValue() + " producer " + producerId
              + " with the declared capabilities");
    }

    ConsumerHandle handle = engine.consume(transport.getHandle(), producerId, capabilities);
    try {
      registry.upsertConsumer(clientId,
          new ConsumerRecord(handle.getId(), producerId, clientId, handle.getKind()));
    } catch (RelayException e) {
      engine.closeConsumer(handle.getId());
      throw e;
    }
    if (!registry.hasProducer(producerId)) {
      // the producer was released while the consumer was being created
      if (registry.removeConsumer(clientId, handle.getId()) != null) {
        engine.closeConsumer(handle.getId());
      }
      throw new RelayException(Code.NOT_FOUND_ERROR_CODE,
          "Producer '" + producerId + "' was closed while consuming it");
    }
    log.info("CLIENT {}: Consuming producer {} as {}", clientId, producerId, handle.getId());

    JsonObject result = new JsonObject();
    result.addProperty(ProtocolElements.CONSUME_ID_PARAM, handle.getId());
    result.addProperty(ProtocolElements.CONSUME_PRODUCERID_PARAM, producerId);
    result.addProperty(ProtocolElements.CONSUME_KIND_PARAM, handle.getKind().getValue());
    result.add(ProtocolElements.CONSUME_RTPPARAMETERS_PARAM, handle.getRtpParameters());
    return result;
  }

  public JsonObject resumeConsumer(String clientId, String consumerId) throws RelayException {
    log.debug("Request [RESUME_CONSUMER] clientId={} consumerId={}", clientId, consumerId);
    if (consumerId == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Missing " + ProtocolElements.RESUMECONSUMER_CONSUMERID_PARAM);
    }
    ConsumerRecord consumer = registry.getConsumer(clientId, consumerId);
    engine.resumeConsumer(consumerId);
    consumer.setPaused(false);
    return success();
  }

  // ----------------- BROADCASTS ------------

  public JsonObject startHlsStream(String clientId, String streamId) throws RelayException {
    log.debug("Request [START_HLS_STREAM] clientId={} streamId={}", clientId, streamId);
    registry.getClient(clientId);
    StreamInfo stream = streamManager.startBroadcast(clientId, streamId);
    JsonObject result = success();
    result.addProperty(ProtocolElements.HLSSTREAM_STREAMID_PARAM, stream.getStreamKey());
    if (stream.getPlaylistUrl() != null) {
      result.addProperty(ProtocolElements.HLSSTREAM_PLAYLISTURL_PARAM, stream.getPlaylistUrl());
    }
    return result;
  }

  public JsonObject stopHlsStream(String clientId, String streamId) throws RelayException {
    log.debug("Request [STOP_HLS_STREAM] clientId={} streamId={}", clientId, streamId);
    if (streamId == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Missing " + ProtocolElements.HLSSTREAM_STREAMID_PARAM);
    }
    streamManager.stopBroadcast(clientId, streamId);
    return success();
  }

  public JsonObject getActiveStreams() {
    JsonArray streams = new JsonArray();
    for (StreamInfo stream : streamManager.listStreams()) {
      streams.add(stream.toJson());
    }
    JsonObject result = new JsonObject();
    result.add(ProtocolElements.GETACTIVESTREAMS_STREAMS_PARAM, streams);
    return result;
  }

  // ----------------- INTERNAL ------------

  private TransportRecord requireTransport(ClientSession session, TransportRole role) {
    TransportRecord transport = session.getTransport(role);
    if (transport == null) {
      throw new RelayException(Code.PRECONDITION_FAILED_ERROR_CODE,
          "A " + role.getValue() + " transport must be created first");
    }
    return transport;
  }

  private void releaseTransport(ClientSession session, TransportRole role) {
    String clientId = session.getId();
    if (role == TransportRole.PRODUCING) {
      ProducerRecord producer = registry.removeProducer(clientId);
      if (producer != null) {
        releaseProducer(producer);
      }
    } else {
      for (ConsumerRecord consumer : session.getConsumers()) {
        registry.removeConsumer(clientId, consumer.getConsumerId());
        engine.closeConsumer(consumer.getConsumerId());
      }
    }
    TransportRecord previous = registry.removeTransport(clientId, role);
    if (previous != null) {
      engine.closeTransport(previous.getId());
      log.info("CLIENT {}: Released previous {} transport {}", clientId, role.getValue(),
          previous.getId());
    }
  }

  private void releaseProducer(ProducerRecord producer) {
    closeDependentConsumers(producer.getProducerId());
    engine.closeProducer(producer.getProducerId());
    streamManager.onProducerClosed(producer.getProducerId());
    notifyProducerClosed(producer.getProducerId());
  }

  private void closeDependentConsumers(String producerId) {
    List<ConsumerRecord> dependents =
        new ArrayList<ConsumerRecord>(registry.findConsumersOfProducer(producerId));
    for (ConsumerRecord consumer : dependents) {
      if (registry.removeConsumer(consumer.getClientId(), consumer.getConsumerId()) == null) {
        continue;
      }
      engine.closeConsumer(consumer.getConsumerId());
      log.debug("CLIENT {}: Closed consumer {} of producer {}", consumer.getClientId(),
          consumer.getConsumerId(), producerId);
    }
  }

  private void notifyProducerClosed(String producerId) {
    JsonObject params = new JsonObject();
    params.addProperty(ProtocolElements.PRODUCERCLOSED_PRODUCERID_PARAM, producerId);
    notifier.broadcast(ProtocolElements.PRODUCERCLOSED_METHOD, params);
  }

  private static JsonObject success() {
    JsonObject result = new JsonObject();
    result.addProperty(ProtocolElements.SUCCESS_PARAM, true);
    return result;
  }
}
