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
import java.nio.file.Paths;

/**
 * Settings of the HLS recording bridge. Defaults match a low-latency live HLS output: 2 second
 * segments and a sliding window of 5 segments.
 */
public class RecordingSettings {
  public static final String PLAYLIST_NAME = "playlist.m3u8";
  public static final String SEGMENT_PATTERN = "segment_%03d.ts";
  public static final String INPUT_SDP_NAME = "input.sdp";

  private Path hlsRoot = Paths.get("hls");
  private String playbackPrefix = "/hls";
  private String ffmpegPath = "ffmpeg";
  private String tapAddress = "127.0.0.1";
  private int segmentSeconds = 2;
  private int listSize = 5;
  private int gopSize = 60;
  private String preset = "veryfast";
  private String videoBitrate = "1000k";
  private String maxRate = "1200k";
  private String bufferSize = "2000k";
  private long startupTimeoutMillis = 10000;
  private long readinessPollMillis = 100;
  private long stopTimeoutMillis = 5000;

  public Path getHlsRoot() {
    return hlsRoot;
  }

  public void setHlsRoot(Path hlsRoot) {
    this.hlsRoot = hlsRoot;
  }

  public String getPlaybackPrefix() {
    return playbackPrefix;
  }

  public void setPlaybackPrefix(String playbackPrefix) {
    this.playbackPrefix = playbackPrefix.endsWith("/")
        ? playbackPrefix.substring(0, playbackPrefix.length() - 1) : playbackPrefix;
  }

  public String getFfmpegPath() {
    return ffmpegPath;
  }

  public void setFfmpegPath(String ffmpegPath) {
    this.ffmpegPath = ffmpegPath;
  }

  public String getTapAddress() {
    return tapAddress;
  }

  public void setTapAddress(String tapAddress) {
    this.tapAddress = tapAddress;
  }

  public int getSegmentSeconds() {
    return segmentSeconds;
  }

  public void setSegmentSeconds(int segmentSeconds) {
    this.segmentSeconds = segmentSeconds;
  }

  public int getListSize() {
    return listSize;
  }

  public void setListSize(int listSize) {
    this.listSize = listSize;
  }

  public int getGopSize() {
    return gopSize;
  }

  public void setGopSize(int gopSize) {
    this.gopSize = gopSize;
  }

  public String getPreset() {
    return preset;
  }

  public void setPreset(String preset) {
    this.preset = preset;
  }

  public String getVideoBitrate() {
    return videoBitrate;
  }

  public void setVideoBitrate(String videoBitrate) {
    this.videoBitrate = videoBitrate;
  }

  public String getMaxRate() {
    return maxRate;
  }

  public void setMaxRate(String maxRate) {
    this.maxRate = maxRate;
  }

  public String getBufferSize() {
    return bufferSize;
  }

  public void setBufferSize(String bufferSize) {
    this.bufferSize = bufferSize;
  }

  public long getStartupTimeoutMillis() {
    return startupTimeoutMillis;
  }

  public void setStartupTimeoutMillis(long startupTimeoutMillis) {
    this.startupTimeoutMillis = startupTimeoutMillis;
  }

  public long getReadinessPollMillis() {
    return readinessPollMillis;
  }

  public void setReadinessPollMillis(long readinessPollMillis) {
    this.readinessPollMillis = readinessPollMillis;
  }

  public long getStopTimeoutMillis() {
    return stopTimeoutMillis;
  }

  public void setStopTimeoutMillis(long stopTimeoutMillis) {
    this.stopTimeoutMillis = stopTimeoutMillis;
  }

  public Path getOutputDirectory(String streamKey) {
    return hlsRoot.resolve(streamKey);
  }

  public String getPlaylistUrl(String streamKey) {
    return playbackPrefix + "/" + streamKey + "/" + PLAYLIST_NAME;
  }
}
