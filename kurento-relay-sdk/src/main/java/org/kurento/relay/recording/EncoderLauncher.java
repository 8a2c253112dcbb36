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

/**
 * Spawns the external encoding process. The returned process must merge its diagnostic output
 * into {@link Process#getInputStream()}.
 */
public interface EncoderLauncher {

  Process launch(List<String> command, Path workingDirectory) throws IOException;
}
