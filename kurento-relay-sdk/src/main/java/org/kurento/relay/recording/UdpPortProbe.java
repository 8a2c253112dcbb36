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
package org.kurento.relay.recording;

import org.kurento.relay.internal.UdpPorts;

/**
 * Considers the encoder ready once its RTP input port can no longer be bound by anybody else.
 * Each poll binds the port for an instant, see {@link UdpPorts#isBound(String, int)}.
 */
public class UdpPortProbe implements EncoderReadinessProbe {

  @Override
  public boolean isListening(String address, int port) {
    return UdpPorts.isBound(address, port);
  }
}
