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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kurento.relay.api.pojo.MediaKind;
import org.kurento.relay.api.pojo.TransportHandle;
import org.kurento.relay.api.pojo.TransportRole;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;

import com.google.gson.JsonObject;

public class SessionRegistryTest {

  private SessionRegistry registry;

  @BeforeEach
  public void setup() {
    registry = new SessionRegistry();
    registry.register("a");
    registry.register("b");
  }

  private static TransportRecord transport(String id, String clientId, TransportRole role) {
    return new TransportRecord(new TransportHandle(id, clientId, role, new JsonObject()));
  }

  @Test
  public void unknownClientIsNotFound() {
    RelayException e = assertThrows(RelayException.class, () -> registry.getClient("nobody"));

    assertEquals(Code.NOT_FOUND_ERROR_CODE, e.getCode());
  }

  @Test
  public void registeringTwiceKeepsTheSession() {
    ClientSession first = registry.getClient("a");

    assertSame(first, registry.register("a"));
  }

  @Test
  public void replacingLiveTransportIsAConflict() {
    registry.upsertTransport("a", transport("t1", "a", TransportRole.PRODUCING));

    RelayException e = assertThrows(RelayException.class,
        () -> registry.upsertTransport("a", transport("t2", "a", TransportRole.PRODUCING)));

    assertEquals(Code.CONFLICT_ERROR_CODE, e.getCode());
    assertEquals("t1", registry.getTransport("a", TransportRole.PRODUCING).getId());
  }

  @Test
  public void transportCanBeReplacedAfterRemoval() {
    registry.upsertTransport("a", transport("t1", "a", TransportRole.PRODUCING));
    registry.upsertTransport("a", transport("t3", "a", TransportRole.CONSUMING));

    assertEquals("t1", registry.removeTransport("a", TransportRole.PRODUCING).getId());
    registry.upsertTransport("a", transport("t2", "a", TransportRole.PRODUCING));

    assertEquals("t2", registry.getTransport("a", TransportRole.PRODUCING).getId());
    assertEquals("t3", registry.getTransport("a", TransportRole.CONSUMING).getId());
  }

  @Test
  public void missingTransportIsNotFound() {
    RelayException e = assertThrows(RelayException.class,
        () -> registry.getTransport("a", TransportRole.CONSUMING));

    assertEquals(Code.NOT_FOUND_ERROR_CODE, e.getCode());
  }

  @Test
  public void secondProducerIsAConflict() {
    registry.upsertProducer("a", new ProducerRecord("p1", MediaKind.VIDEO, "a"));

    RelayException e = assertThrows(RelayException.class,
        () -> registry.upsertProducer("a", new ProducerRecord("p2", MediaKind.AUDIO, "a")));

    assertEquals(Code.CONFLICT_ERROR_CODE, e.getCode());
  }

  @Test
  public void listProducersExcludesCaller() {
    registry.upsertProducer("a", new ProducerRecord("p1", MediaKind.VIDEO, "a"));
    registry.upsertProducer("b", new ProducerRecord("p2", MediaKind.AUDIO, "b"));

    List<ProducerRecord> seenByA = registry.listProducersExcluding("a");

    assertEquals(1, seenByA.size());
    assertEquals("p2", seenByA.get(0).getProducerId());
    assertEquals(2, registry.listProducersExcluding("c").size());
  }

  @Test
  public void videoProducersComeInCreationOrder() {
    registry.register("c");
    registry.upsertProducer("b", new ProducerRecord("p-first", MediaKind.VIDEO, "b"));
    registry.upsertProducer("c", new ProducerRecord("p-audio", MediaKind.AUDIO, "c"));
    registry.upsertProducer("a", new ProducerRecord("p-second", MediaKind.VIDEO, "a"));

    List<ProducerRecord> video = registry.findProducers(MediaKind.VIDEO);

    assertEquals(2, video.size());
    assertEquals("p-first", video.get(0).getProducerId());
    assertEquals("p-second", video.get(1).getProducerId());
  }

  @Test
  public void consumersAreKeyedById() {
    registry.upsertConsumer("b", new ConsumerRecord("c1", "p1", "b", MediaKind.VIDEO));
    registry.upsertConsumer("b", new ConsumerRecord("c2", "p2", "b", MediaKind.AUDIO));

    assertEquals(2, registry.getClient("b").getConsumers().size());
    assertTrue(registry.getConsumer("b", "c1").isPaused());
    assertEquals(1, registry.findConsumersOfProducer("p2").size());

    RelayException e = assertThrows(RelayException.class,
        () -> registry.upsertConsumer("b", new ConsumerRecord("c1", "p3", "b", MediaKind.VIDEO)));
    assertEquals(Code.CONFLICT_ERROR_CODE, e.getCode());
  }

  @Test
  public void removeAllForClientReturnsEverything() {
    registry.upsertTransport("a", transport("t1", "a", TransportRole.PRODUCING));
    registry.upsertTransport("a", transport("t2", "a", TransportRole.CONSUMING));
    registry.upsertProducer("a", new ProducerRecord("p1", MediaKind.VIDEO, "a"));
    registry.upsertConsumer("a", new ConsumerRecord("c1", "p9", "a", MediaKind.AUDIO));

    ClientResources removed = registry.removeAllForClient("a");

    assertEquals(2, removed.getTransports().size());
    assertEquals(1, removed.getProducers().size());
    assertEquals(1, removed.getConsumers().size());
    assertFalse(registry.isRegistered("a"));
    assertTrue(registry.listProducersExcluding("b").isEmpty());
    assertTrue(registry.findConsumersOfProducer("p9").isEmpty());
  }

  @Test
  public void removingUnknownClientIsHarmless() {
    ClientResources removed = registry.removeAllForClient("nobody");

    assertTrue(removed.isEmpty());
    assertNull(registry.removeProducer("nobody"));
  }

  @Test
  public void closedSessionRejectsNewRecords() {
    ClientSession session = registry.getClient("a");
    registry.removeAllForClient("a");

    assertTrue(session.isClosed());
    RelayException e = assertThrows(RelayException.class,
        () -> session.putProducer(new ProducerRecord("p1", MediaKind.VIDEO, "a")));
    assertEquals(Code.NOT_FOUND_ERROR_CODE, e.getCode());
  }
}
