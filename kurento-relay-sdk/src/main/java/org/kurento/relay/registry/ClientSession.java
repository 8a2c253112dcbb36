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
package org.kurento.relay.registry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.kurento.relay.api.pojo.RtpCapabilities;
import org.kurento.relay.api.pojo.TransportRole;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resources owned by one connected client: one transport per role, at most one producer and any
 * number of consumers, keyed by consumer id.
 * <p/>
 * Replacing a live record is refused with {@link Code#CONFLICT_ERROR_CODE}: the previous record
 * has to be removed (and its engine resource released) first.
 */
public class ClientSession {
  private static final Logger log = LoggerFactory.getLogger(ClientSession.class);

  private final String id;

  private final Map<TransportRole, TransportRecord> transports =
      new EnumMap<TransportRole, TransportRecord>(TransportRole.class);
  private ProducerRecord producer;
  private final Map<String, ConsumerRecord> consumers = new LinkedHashMap<String, ConsumerRecord>();

  private volatile boolean capabilitiesRequested = false;
  private volatile RtpCapabilities rtpCapabilities;

  private volatile boolean closed = false;

  public ClientSession(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public boolean isClosed() {
    return closed;
  }

  // ------------------ CAPABILITIES ------------------------------------------

  public boolean isCapabilitiesRequested() {
    return capabilitiesRequested;
  }

  public void markCapabilitiesRequested() {
    this.capabilitiesRequested = true;
  }

  public RtpCapabilities getRtpCapabilities() {
    return rtpCapabilities;
  }

  public void setRtpCapabilities(RtpCapabilities rtpCapabilities) {
    this.rtpCapabilities = rtpCapabilities;
  }

  // ------------------ TRANSPORTS --------------------------------------------

  public synchronized TransportRecord getTransport(TransportRole role) {
    return transports.get(role);
  }

  synchronized void putTransport(TransportRecord transport) {
    checkClosed();
    TransportRecord existing = transports.get(transport.getRole());
    if (existing != null) {
      throw new RelayException(Code.CONFLICT_ERROR_CODE, "Client '" + id + "' already owns a "
          + transport.getRole().getValue() + " transport (" + existing.getId() + ")");
    }
    transports.put(transport.getRole(), transport);
    log.debug("CLIENT {}: Registered {}", id, transport);
  }

  synchronized TransportRecord removeTransport(TransportRole role) {
    return transports.remove(role);
  }

  // ------------------ PRODUCER ----------------------------------------------

  public synchronized ProducerRecord getProducer() {
    return producer;
  }

  synchronized void putProducer(ProducerRecord record) {
    checkClosed();
    if (producer != null) {
      throw new RelayException(Code.CONFLICT_ERROR_CODE,
          "Client '" + id + "' already owns producer " + producer.getProducerId());
    }
    producer = record;
    log.debug("CLIENT {}: Registered {}", id, record);
  }

  synchronized ProducerRecord removeProducer() {
    ProducerRecord removed = producer;
    producer = null;
    return removed;
  }

  // ------------------ CONSUMERS ---------------------------------------------

  public synchronized ConsumerRecord getConsumer(String consumerId) {
    return consumers.get(consumerId);
  }

  public synchronized List<ConsumerRecord> getConsumers() {
    return new ArrayList<ConsumerRecord>(consumers.values());
  }

  synchronized void putConsumer(ConsumerRecord record) {
    checkClosed();
    if (consumers.containsKey(record.getConsumerId())) {
      throw new RelayException(Code.CONFLICT_ERROR_CODE,
          "Consumer " + record.getConsumerId() + " is already registered for client '" + id + "'");
    }
    consumers.put(record.getConsumerId(), record);
    log.debug("CLIENT {}: Registered {}", id, record);
  }

  synchronized ConsumerRecord removeConsumer(String consumerId) {
    return consumers.remove(consumerId);
  }

  // ------------------ LIFECYCLE ---------------------------------------------

  /**
   * Marks the session as closed and hands back every record it owned.
   */
  synchronized ClientResources close() {
    if (closed) {
      log.warn("CLIENT {}: Already closed", id);
      return ClientResources.empty(id);
    }
    closed = true;
    List<TransportRecord> removedTransports = new ArrayList<TransportRecord>(transports.values());
    List<ProducerRecord> removedProducers = new ArrayList<ProducerRecord>();
    if (producer != null) {
      removedProducers.add(producer);
    }
    List<ConsumerRecord> removedConsumers = new ArrayList<ConsumerRecord>(consumers.values());
    transports.clear();
    producer = null;
    consumers.clear();
    log.debug("CLIENT {}: Closed, released {} transports, {} producers and {} consumers", id,
        removedTransports.size(), removedProducers.size(), removedConsumers.size());
    return new ClientResources(id, removedTransports, removedProducers, removedConsumers);
  }

  private void checkClosed() {
    if (closed) {
      throw new RelayException(Code.NOT_FOUND_ERROR_CODE, "Client '" + id + "' is closed");
    }
  }

  @Override
  public String toString() {
    return "[Client: " + id + "]";
  }

  @Override
  public int hashCode() {
    return id == null ? 0 : id.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ClientSession)) {
      return false;
    }
    ClientSession other = (ClientSession) obj;
    return id == null ? other.id == null : id.equals(other.id);
  }
}
