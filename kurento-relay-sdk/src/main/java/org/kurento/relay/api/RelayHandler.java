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

import org.kurento.relay.api.pojo.TransportRole;

import com.google.gson.JsonObject;

/**
 * Handler for events triggered from media objects of the engine.
 */
public interface RelayHandler {

  /**
   * Called when a new ICE candidate is gathered for a client transport. The client should receive
   * a notification so that the candidate is added to its remote peer.
   *
   * @param clientId    owner of the transport
   * @param transportId identifier of the engine transport
   * @param role        role of the transport inside the client session
   * @param candidate   the gathered candidate ({@code candidate}, {@code sdpMid},
   *                    {@code sdpMLineIndex})
   */
  void onIceCandidate(String clientId, String transportId, TransportRole role, JsonObject candidate);

  /**
   * Called as a result of an error intercepted on a media element owned by a client.
   *
   * @param clientId         owner of the element
   * @param errorDescription description of the error
   */
  void onMediaElementError(String clientId, String errorDescription);

  /**
   * Called when the routing context of the engine fails. This condition is not recoverable: the
   * engine is never restarted by the relay.
   *
   * @param errorDescription description of the failure
   */
  void onEngineFailure(String errorDescription);
}
