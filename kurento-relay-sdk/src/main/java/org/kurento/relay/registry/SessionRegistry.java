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
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.kurento.relay.api.pojo.MediaKind;
import org.kurento.relay.api.pojo.TransportRole;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single source of truth for the live resources of every connected client.
 * <p/>
 * Mutations are keyed by client id and resource role. The registry does no ordering of its own:
 * operations for the same client must be serialized by the caller. Only lookups can fail
 * ({@link Code#NOT_FOUND_ERROR_CODE}); replacing a live record fails with
 * {@link Code#CONFLICT_ERROR_CODE}.
 */
public class SessionRegistry {
  private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

  private static final Comparator<ProducerRecord> CREATION_ORDER =
      new Comparator<ProducerRecord>() {
        @Override
        public int compare(ProducerRecord o1, ProducerRecord o2) {
          return Long.compare(o1.getOrder(), o2.getOrder());
        }
      };

  private final ConcurrentMap<String, ClientSession> clients =
      new ConcurrentHashMap<String, ClientSession>();

  public ClientSession register(String clientId) {
    ClientSession session = new ClientSession(clientId);
    ClientSession existing = clients.putIfAbsent(clientId, session);
    if (existing != null) {
      log.warn("Client '{}' was already registered", clientId);
      return existing;
    }
    log.info("Client '{}' registered ({} connected)", clientId, clients.size());
    return session;
  }

  public boolean isRegistered(String clientId) {
    return clients.containsKey(clientId);
  }

  public ClientSession getClient(String clientId) throws RelayException {
    ClientSession session = clients.get(clientId);
    if (session == null) {
      throw new RelayException(Code.NOT_FOUND_ERROR_CODE,
          "No client with id '" + clientId + "' was found");
    }
    return session;
  }

  public Set<String> getClientIds() {
    return new HashSet<String>(clients.keySet());
  }

  // ------------------ TRANSPORTS --------------------------------------------

  public void upsertTransport(String clientId, TransportRecord transport) throws RelayException {
    getClient(clientId).putTransport(transport);
  }

  public TransportRecord getTransport(String clientId, TransportRole role) throws RelayException {
    TransportRecord transport = getClient(clientId).getTransport(role);
    if (transport == null) {
      throw new RelayException(Code.NOT_FOUND_ERROR_CODE,
          "Client '" + clientId + "' has no " + role.getValue() + " transport");
    }
    return transport;
  }

  public TransportRecord removeTransport(String clientId, TransportRole role) {
    ClientSession session = clients.get(clientId);
    return session != null ? session.removeTransport(role) : null;
  }

  // ------------------ PRODUCERS ---------------------------------------------

  public void upsertProducer(String clientId, ProducerRecord producer) throws RelayException {
    getClient(clientId).putProducer(producer);
  }

  public ProducerRecord removeProducer(String clientId) {
    ClientSession session = clients.get(clientId);
    return session != null ? session.removeProducer() : null;
  }

  public ProducerRecord getProducer(String producerId) throws RelayException {
    for (ClientSession session : clients.values()) {
      ProducerRecord producer = session.getProducer();
      if (producer != null && producer.getProducerId().equals(producerId)) {
        return producer;
      }
    }
    throw new RelayException(Code.NOT_FOUND_ERROR_CODE,
        "No producer with id '" + producerId + "' was found");
  }

  public boolean hasProducer(String producerId) {
    for (ClientSession session : clients.values()) {
      ProducerRecord producer = session.getProducer();
      if (producer != null && producer.getProducerId().equals(producerId)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Producers of every client except the given one, in creation order.
   */
  public List<ProducerRecord> listProducersExcluding(String clientId) {
    List<ProducerRecord> result = new ArrayList<ProducerRecord>();
    for (ClientSession session : clients.values()) {
      if (session.getId().equals(clientId)) {
        continue;
      }
      ProducerRecord producer = session.getProducer();
      if (producer != null) {
        result.add(producer);
      }
    }
    Collections.sort(result, CREATION_ORDER);
    return result;
  }

  /**
   * Producers of the given kind, in creation order (oldest first).
   */
  public List<ProducerRecord> findProducers(MediaKind kind) {
    List<ProducerRecord> result = new ArrayList<ProducerRecord>();
    for (ClientSession session : clients.values()) {
      ProducerRecord producer = session.getProducer();
      if (producer != null && producer.getKind() == kind) {
        result.add(producer);
      }
    }
    Collections.sort(result, CREATION_ORDER);
    return result;
  }

  // ------------------ CONSUMERS ---------------------------------------------

  public void upsertConsumer(String clientId, ConsumerRecord consumer) throws RelayException {
    getClient(clientId).putConsumer(consumer);
  }

  public ConsumerRecord getConsumer(String clientId, String consumerId) throws RelayException {
    ConsumerRecord consumer = getClient(clientId).getConsumer(consumerId);
    if (consumer == null) {
      throw new RelayException(Code.NOT_FOUND_ERROR_CODE,
          "No consumer with id '" + consumerId + "' was found for client '" + clientId + "'");
    }
    return consumer;
  }

  public ConsumerRecord removeConsumer(String clientId, String consumerId) {
    ClientSession session = clients.get(clientId);
    return session != null ? session.removeConsumer(consumerId) : null;
  }

  /**
   * Consumers of every client that receive the given producer.
   */
  public List<ConsumerRecord> findConsumersOfProducer(String producerId) {
    List<ConsumerRecord> result = new ArrayList<ConsumerRecord>();
    for (ClientSession session : clients.values()) {
      for (ConsumerRecord consumer : session.getConsumers()) {
        if (consumer.getProducerId().equals(producerId)) {
          result.add(consumer);
        }
      }
    }
    return result;
  }

  // ------------------ LIFECYCLE ---------------------------------------------

  /**
   * Removes the client and every record it owns.
   *
   * @return the removed records, empty if the client was unknown
   */
  public ClientResources removeAllForClient(String clientId) {
    ClientSession session = clients.remove(clientId);
    if (session == null) {
      log.debug("Client '{}' not registered, nothing to remove", clientId);
      return ClientResources.empty(clientId);
    }
    ClientResources removed = session.close();
    log.info("Client '{}' removed ({} connected)", clientId, clients.size());
    return removed;
  }
}
