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

import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.util.Collections;
import java.util.Set;

import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;

/**
 * Helpers for local UDP ports handed to encoder processes.
 */
public final class UdpPorts {

  private UdpPorts() {
  }

  /**
   * Checks the port by binding it for an instant. The test socket is closed before returning, so a
   * free port is left free, but for that instant a process trying to bind the same port would
   * fail, including an encoder whose readiness is being polled.
   *
   * @return true if the port is already bound on the given address
   */
  public static boolean isBound(String address, int port) {
    try (DatagramSocket socket = new DatagramSocket(null)) {
      socket.setReuseAddress(false);
      socket.bind(new InetSocketAddress(address, port));
      return false;
    } catch (SocketException e) {
      return true;
    }
  }

  /**
   * Finds an even port in {@code [min, max]} whose RTCP companion (port + 1) is free as well.
   *
   * @throws RelayException RECORDER_START_FAILED if the range is exhausted
   */
  public static int findFreeRtpPort(String address, int min, int max) {
    return findFreeRtpPort(address, min, max, Collections.<Integer>emptySet());
  }

  /**
   * Same as {@link #findFreeRtpPort(String, int, int)}, skipping the ports already handed out.
   */
  public static int findFreeRtpPort(String address, int min, int max, Set<Integer> reserved) {
    int first = min % 2 == 0 ? min : min + 1;
    for (int port = first; port + 1 <= max; port += 2) {
      if (reserved.contains(port)) {
        continue;
      }
      if (!isBound(address, port) && !isBound(address, port + 1)) {
        return port;
      }
    }
    throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
        "No free RTP port pair in range " + min + "-" + max + " on " + address);
  }
}
