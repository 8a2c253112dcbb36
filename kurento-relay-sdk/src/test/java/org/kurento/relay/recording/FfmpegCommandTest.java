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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Test;

public class FfmpegCommandTest {

  private static String valueOf(List<String> cmd, String option) {
    int index = cmd.indexOf(option);
    assertTrue(index >= 0, "missing option " + option);
    return cmd.get(index + 1);
  }

  @Test
  public void readsSdpAndWritesSlidingWindowPlaylist() {
    RecordingSettings settings = new RecordingSettings();
    settings.setFfmpegPath("/usr/bin/ffmpeg");
    Path out = Paths.get("/var/hls/live").toAbsolutePath();
    Path sdp = out.resolve("input.sdp");

    List<String> cmd = FfmpegCommand.build(settings, sdp, out);

    assertEquals("/usr/bin/ffmpeg", cmd.get(0));
    assertEquals("file,udp,rtp", valueOf(cmd, "-protocol_whitelist"));
    assertEquals(sdp.toString(), valueOf(cmd, "-i"));
    assertEquals("libx264", valueOf(cmd, "-vcodec"));
    assertTrue(cmd.contains("-an"));
    assertTrue(cmd.indexOf("-protocol_whitelist") < cmd.indexOf("-i"));
    assertTrue(cmd.indexOf("-i") < cmd.indexOf("-hls_time"));
    assertEquals("zerolatency", valueOf(cmd, "-tune"));
    assertEquals("hls", valueOf(cmd, "-f"));
    assertEquals("2", valueOf(cmd, "-hls_time"));
    assertEquals("5", valueOf(cmd, "-hls_list_size"));
    assertEquals("delete_segments+independent_segments", valueOf(cmd, "-hls_flags"));
    assertEquals(out.resolve("segment_%03d.ts").toString(),
        valueOf(cmd, "-hls_segment_filename"));
    assertEquals(out.resolve("playlist.m3u8").toString(), cmd.get(cmd.size() - 1));
  }

  @Test
  public void usesConfiguredEncoderSettings() {
    RecordingSettings settings = new RecordingSettings();
    settings.setSegmentSeconds(4);
    settings.setListSize(10);
    settings.setGopSize(120);
    settings.setVideoBitrate("2500k");
    Path out = Paths.get("out").toAbsolutePath();

    List<String> cmd = FfmpegCommand.build(settings, out.resolve("input.sdp"), out);

    assertEquals("4", valueOf(cmd, "-hls_time"));
    assertEquals("10", valueOf(cmd, "-hls_list_size"));
    assertEquals("120", valueOf(cmd, "-g"));
    assertEquals("2500k", valueOf(cmd, "-b:v"));
  }
}
