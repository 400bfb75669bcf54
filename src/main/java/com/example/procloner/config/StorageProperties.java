package com.example.procloner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;

@ConfigurationProperties(prefix = "procloner.storage")
public class StorageProperties {

	// parent of every per-session output root, overridable from external config
	private String outputBaseDir = "output";

	public String getOutputBaseDir() {
		return outputBaseDir;
	}

	public void setOutputBaseDir(String outputBaseDir) {
		this.outputBaseDir = outputBaseDir;
	}

	public Path sessionRoot(String sessionId) {
		return Paths.get(sanitizePathConfig(outputBaseDir)).resolve(sessionId);
	}

	// strips surrounding quotes and whitespace from an externally configured path
	static String sanitizePathConfig(String raw) {
		if (raw == null) return "output";
		String v = raw.trim();
		if (v.length() >= 2 && ((v.startsWith("\"") && v.endsWith("\"")) || (v.startsWith("'") && v.endsWith("'")))) {
			v = v.substring(1, v.length() - 1).trim();
		}
		return v.isEmpty() ? "output" : v;
	}
}
