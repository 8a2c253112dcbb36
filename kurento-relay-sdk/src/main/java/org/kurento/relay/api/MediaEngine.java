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
package org.kurento.relay.api;

import org.kurento.relay.api.pojo.ConsumerHandle;
import org.kurento.relay.api.pojo.MediaKind;
import org.kurento.relay.api.pojo.ProducerHandle;
import org.kurento.relay.api.pojo.RtpCapabilities;
import org.kurento.relay.api.pojo.TapHandle;
import org.kurento.relay.api.pojo.TransportHandle;
import org.kurento.relay.api.pojo.TransportRole;
import org.kurento.relay.exception.RelayException;

import com.google.gson.JsonObject;

/**
 * Capabilities consumed from the external media engine (the SFU). The relay never reaches the
 * engine through any other path, so an implementation of this interface is all that is needed to
 * bind the orchestration layer to a concrete media server.
 * <p/>
 * All operations block until the engine has answered. Engine-side failures are reported as
 * {@link RelayException}s carrying the code named in each method.
 */
public interface MediaEngine {

  /**
   * @return the codecs offered by the routing context
   * @throws RelayException ENGINE_UNAVAILABLE if the routing context does not exist yet
   */
  RtpCapabilities getCapabilities() throws RelayException;

  /**
   * Opens a client transport. Candidates gathered later on are reported through
   * {@link RelayHandler#onIceCandidate(String, String, TransportRole, JsonObject)}.
   *
   * @param clientId owner of the transport
   * @param role     producing or consuming
   * @return the transport together with the parameters to relay to the client
   */
  TransportHandle openTransport(String clientId, TransportRole role)
      throws RelayException;

  /**
   * Completes the negotiation of a transport with the parameters sent by the client.
   *
   * @return negotiation answer to relay to the client (may be empty)
   * @throws RelayException CONNECT_ERROR
   */
  JsonObject connectTransport(TransportHandle transport, JsonObject dtlsParameters)
      throws RelayException;

  /**
   * Adds a remote candidate gathered by the client for the given transport.
   */
  void addIceCandidate(TransportHandle transport, JsonObject candidate) throws RelayException;

  /**
   * @throws RelayException PRODUCE_ERROR
   */
  ProducerHandle produce(TransportHandle transport, MediaKind kind, JsonObject rtpParameters)
      throws RelayException;

  /**
   * @return true if a consumer with the given receive capabilities can be created for the producer
   */
  boolean canConsume(String producerId, RtpCapabilities capabilities);

  /**
   * Creates a paused consumer. The compatibility check is repeated here, whatever the caller
   * already verified.
   *
   * @throws RelayException CONSUME_ERROR
   */
  ConsumerHandle consume(TransportHandle transport, String producerId, RtpCapabilities capabilities)
      throws RelayException;

  /**
   * Starts the flow of media towards a paused consumer (client or tap consumer).
   */
  void resumeConsumer(String consumerId) throws RelayException;

  /**
   * Opens a passive plain-RTP tap transport whose media is delivered to a local process listening
   * on {@code listenAddress}.
   *
   * @throws RelayException RECORDER_START_FAILED
   */
  TapHandle openPassiveTap(String listenAddress) throws RelayException;

  /**
   * Creates a paused consumer of {@code producerId} on a tap transport.
   *
   * @throws RelayException CONSUME_ERROR
   */
  ConsumerHandle tapConsume(TapHandle tap, String producerId) throws RelayException;

  /**
   * Tells the tap transport to start sending towards its local listener. The listener must be
   * bound before this call.
   *
   * @throws RelayException CONNECT_ERROR
   */
  void connectTap(TapHandle tap) throws RelayException;

  void closeTransport(String transportId);

  void closeProducer(String producerId);

  void closeConsumer(String consumerId);

  void closeTap(String tapId);
}
