package org.entitybrowser.core.model;

import org.jetbrains.annotations.NotNull;

/**
 * Release metadata of a loaded dataset.
 */
public record BuildInfo(
		String buildNumber,
		String tagName,
		boolean prerelease,
		String createdAt
) {
	public static BuildInfo unknown() {
		return new BuildInfo("", "", false, "");
	}

	@NotNull
	@Override
	public String toString() {
		return String.format("BuildInfo{build='%s', tag='%s', prerelease=%s, created='%s'}",
				buildNumber, tagName, prerelease, createdAt);
	}
}
