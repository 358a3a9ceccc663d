package com.alphamind.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Event streaming settings.
 */
@Component
@ConfigurationProperties(prefix = "alphamind.streaming")
public class StreamingProperties {

    /** Log entries replayed to a newly attached subscriber. */
    private int replaySize = 20;
    private long heartbeatIntervalSeconds = 30;
    /** SSE emitter timeout; long-running trials keep connections open for hours. */
    private long emitterTimeoutMinutes = 30;

    public int getReplaySize() { return replaySize; }
    public void setReplaySize(int replaySize) { this.replaySize = replaySize; }
    public long getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
    public void setHeartbeatIntervalSeconds(long heartbeatIntervalSeconds) { this.heartbeatIntervalSeconds = heartbeatIntervalSeconds; }
    public long getEmitterTimeoutMinutes() { return emitterTimeoutMinutes; }
    public void setEmitterTimeoutMinutes(long emitterTimeoutMinutes) { this.emitterTimeoutMinutes = emitterTimeoutMinutes; }
}
