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

/**
 * Lifecycle of an {@link HlsRecorder}. A recorder only moves forward; once {@link #STOPPED} it is
 * never started again.
 */
public enum RecorderState {
  IDLE,
  /** Tap transport and paused tap consumer exist. */
  TAP_CREATED,
  /** Encoder launched, waiting for it to bind its input port. */
  AWAITING_ENCODER,
  /** Tap connected and consumer resumed. */
  CONNECTED,
  /** Encoder reported encoded frames. */
  RECORDING,
  STOPPED;

  public boolean isActive() {
    return this == CONNECTED || this == RECORDING;
  }
}
