package com.example.procloner.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlPropertiesTest {

	@Test
	void depthIsClampedIntoRange() {
		CrawlProperties props = new CrawlProperties();

		assertThat(props.effectiveDepth(null)).isEqualTo(3);
		assertThat(props.effectiveDepth(0)).isEqualTo(1);
		assertThat(props.effectiveDepth(-4)).isEqualTo(1);
		assertThat(props.effectiveDepth(2)).isEqualTo(2);
		assertThat(props.effectiveDepth(50)).isEqualTo(5);
	}

	@Test
	void outputBaseDirIsSanitized() {
		StorageProperties storage = new StorageProperties();
		storage.setOutputBaseDir(" \"/srv/clones\" ");

		assertThat(storage.sessionRoot("abc")).isEqualTo(Paths.get("/srv/clones", "abc"));
		assertThat(StorageProperties.sanitizePathConfig("''")).isEqualTo("output");
		assertThat(StorageProperties.sanitizePathConfig(null)).isEqualTo("output");
	}
}
