package com.example.procloner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "procloner.crawl")
public class CrawlProperties {

	// per-session cap on concurrent fetches
	private int downloadConcurrency = 5;

	// shared worker threads across all sessions
	private int workerPoolSize = 16;

	private int maxDepth = 5;

	private int defaultDepth = 3;

	private Duration requestTimeout = Duration.ofSeconds(30);

	private int retryAttempts = 3;

	private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

	private int maxRedirects = 5;

	// prefix handed to the classifier for signature sniffing
	private int sampleBytes = 64;

	private boolean crossOriginAssets = true;

	// empty: any host when cross-origin assets are on
	private List<String> allowedAssetHosts = new ArrayList<>();

	private long maxAssetBytes = 100L * 1024 * 1024;

	public int getDownloadConcurrency() { return downloadConcurrency; }
	public void setDownloadConcurrency(int downloadConcurrency) { this.downloadConcurrency = downloadConcurrency; }
	public int getWorkerPoolSize() { return workerPoolSize; }
	public void setWorkerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; }
	public int getMaxDepth() { return maxDepth; }
	public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
	public int getDefaultDepth() { return defaultDepth; }
	public void setDefaultDepth(int defaultDepth) { this.defaultDepth = defaultDepth; }
	public Duration getRequestTimeout() { return requestTimeout; }
	public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
	public int getRetryAttempts() { return retryAttempts; }
	public void setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; }
	public String getUserAgent() { return userAgent; }
	public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
	public int getMaxRedirects() { return maxRedirects; }
	public void setMaxRedirects(int maxRedirects) { this.maxRedirects = maxRedirects; }
	public int getSampleBytes() { return sampleBytes; }
	public void setSampleBytes(int sampleBytes) { this.sampleBytes = sampleBytes; }
	public boolean isCrossOriginAssets() { return crossOriginAssets; }
	public void setCrossOriginAssets(boolean crossOriginAssets) { this.crossOriginAssets = crossOriginAssets; }
	public List<String> getAllowedAssetHosts() { return allowedAssetHosts; }
	public void setAllowedAssetHosts(List<String> allowedAssetHosts) {
		this.allowedAssetHosts = allowedAssetHosts == null ? new ArrayList<String>() : allowedAssetHosts;
	}
	public long getMaxAssetBytes() { return maxAssetBytes; }
	public void setMaxAssetBytes(long maxAssetBytes) { this.maxAssetBytes = maxAssetBytes; }

	/**
	 * Clamps a requested depth into {@code [1, maxDepth]}; a missing depth uses the default.
	 */
	public int effectiveDepth(Integer requested) {
		int d = requested == null ? defaultDepth : requested;
		return Math.max(1, Math.min(maxDepth, d));
	}
}
