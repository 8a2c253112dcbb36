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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import net.bramp.ffmpeg.builder.FFmpegBuilder;

/**
 * Builds the ffmpeg command line that reads the tap RTP session described by an SDP file and
 * writes a live HLS playlist with a sliding window of segments.
 */
public final class FfmpegCommand {

  private FfmpegCommand() {
  }

  public static List<String> build(RecordingSettings settings, Path sdpFile, Path outputDir) {
    String gop = String.valueOf(settings.getGopSize());
    String playlist =
        outputDir.resolve(RecordingSettings.PLAYLIST_NAME).toAbsolutePath().toString();
    FFmpegBuilder builder = new FFmpegBuilder()
        .overrideOutputFiles(true)
        .setVerbosity(FFmpegBuilder.Verbosity.INFO)
        .addExtraArgs("-hide_banner", "-nostdin")
        // input options, placed before -i
        .addExtraArgs("-protocol_whitelist", "file,udp,rtp")
        .addExtraArgs("-fflags", "+genpts+igndts")
        .addExtraArgs("-thread_queue_size", "1024")
        .setInput(sdpFile.toAbsolutePath().toString());

    // the tap only carries video
    builder.addOutput(playlist)
        .setFormat("hls")
        .disableAudio()
        .setVideoCodec("libx264")
        .addExtraArgs("-preset", settings.getPreset())
        .addExtraArgs("-tune", "zerolatency")
        .addExtraArgs("-profile:v", "baseline")
        .addExtraArgs("-level", "3.0")
        .addExtraArgs("-pix_fmt", "yuv420p")
        .addExtraArgs("-g", gop)
        .addExtraArgs("-keyint_min", gop)
        .addExtraArgs("-sc_threshold", "0")
        .addExtraArgs("-b:v", settings.getVideoBitrate())
        .addExtraArgs("-maxrate", settings.getMaxRate())
        .addExtraArgs("-bufsize", settings.getBufferSize())
        .addExtraArgs("-hls_time", String.valueOf(settings.getSegmentSeconds()))
        .addExtraArgs("-hls_list_size", String.valueOf(settings.getListSize()))
        .addExtraArgs("-hls_flags", "delete_segments+independent_segments")
        .addExtraArgs("-hls_start_number_source", "epoch")
        .addExtraArgs("-hls_segment_filename",
            outputDir.resolve(RecordingSettings.SEGMENT_PATTERN).toAbsolutePath().toString())
        .done();

    List<String> cmd = new ArrayList<String>();
    cmd.add(settings.getFfmpegPath());
    cmd.addAll(builder.build());
    return cmd;
  }
}
