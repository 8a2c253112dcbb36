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

import org.kurento.relay.api.MediaEngine;
import org.kurento.relay.registry.SessionRegistry;

/**
 * Builds the recorders of a stream manager, sharing the engine, the registry and the encoder
 * configuration.
 */
public class HlsRecorderFactory {

  private final MediaEngine engine;
  private final SessionRegistry registry;
  private final RecordingSettings settings;
  private final EncoderLauncher launcher;
  private final EncoderReadinessProbe readinessProbe;

  public HlsRecorderFactory(MediaEngine engine, SessionRegistry registry,
      RecordingSettings settings) {
    this(engine, registry, settings, new FfmpegLauncher(), new UdpPortProbe());
  }

  public HlsRecorderFactory(MediaEngine engine, SessionRegistry registry,
      RecordingSettings settings, EncoderLauncher launcher, EncoderReadinessProbe readinessProbe) {
    this.engine = engine;
    this.registry = registry;
    this.settings = settings;
    this.launcher = launcher;
    this.readinessProbe = readinessProbe;
  }

  public RecordingSettings getSettings() {
    return settings;
  }

  public HlsRecorder create(String streamKey, RecorderListener listener) {
    return new HlsRecorder(streamKey, engine, registry, settings, launcher, readinessProbe,
        listener);
  }
}
