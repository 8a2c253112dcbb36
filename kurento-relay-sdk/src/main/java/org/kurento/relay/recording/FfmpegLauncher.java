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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches ffmpeg through a {@link ProcessBuilder}, with stderr redirected into stdout so a single
 * reader can follow the encoder progress.
 */
public class FfmpegLauncher implements EncoderLauncher {
  private static final Logger log = LoggerFactory.getLogger(FfmpegLauncher.class);

  @Override
  public Process launch(List<String> command, Path workingDirectory) throws IOException {
    log.debug("Starting encoder: {}", String.join(" ", command));
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.directory(workingDirectory.toFile());
    pb.redirectErrorStream(true);
    pb.redirectInput(ProcessBuilder.Redirect.PIPE);
    return pb.start();
  }
}
