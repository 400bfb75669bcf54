package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Clone request as handed over by the validation layer: the URL is already restricted to
 * http/https and internal hosts are already rejected.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CloneRequest {

	private String url;

	private CloneOptions options = new CloneOptions();

	public CloneRequest() {
	}

	public CloneRequest(String url, CloneOptions options) {
		this.url = url;
		setOptions(options);
	}

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public CloneOptions getOptions() {
		return options;
	}

	public void setOptions(CloneOptions options) {
		this.options = options == null ? new CloneOptions() : options;
	}
}
