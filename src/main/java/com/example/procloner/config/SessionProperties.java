package com.example.procloner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "procloner.session")
public class SessionProperties {

	// wall-clock ceiling of one execution
	private Duration timeout = Duration.ofMinutes(5);

	// how long terminal and interrupted sessions stay recoverable
	private Duration retention = Duration.ofHours(1);

	private Duration evictionInterval = Duration.ofMinutes(1);

	private int checkpointEveryAssets = 5;

	// events kept per session for replay
	private int historySize = 200;

	private int maxConcurrentSessions = 5;

	public Duration getTimeout() { return timeout; }
	public void setTimeout(Duration timeout) { this.timeout = timeout; }
	public Duration getRetention() { return retention; }
	public void setRetention(Duration retention) { this.retention = retention; }
	public Duration getEvictionInterval() { return evictionInterval; }
	public void setEvictionInterval(Duration evictionInterval) { this.evictionInterval = evictionInterval; }
	public int getCheckpointEveryAssets() { return checkpointEveryAssets; }
	public void setCheckpointEveryAssets(int checkpointEveryAssets) { this.checkpointEveryAssets = checkpointEveryAssets; }
	public int getHistorySize() { return historySize; }
	public void setHistorySize(int historySize) { this.historySize = historySize; }
	public int getMaxConcurrentSessions() { return maxConcurrentSessions; }
	public void setMaxConcurrentSessions(int maxConcurrentSessions) { this.maxConcurrentSessions = maxConcurrentSessions; }
}
