package my.performancemanager.app.scoring;

import java.util.Locale;

public enum OrganizationLevel {
	OFFICE,
	DIVISION,
	DEPARTMENT,
	ENTERPRISE;

	public OrganizationLevel child() {
		return this == OFFICE ? null : values()[ordinal() - 1];
	}

	public OrganizationLevel parent() {
		return this == ENTERPRISE ? null : values()[ordinal() + 1];
	}

	public static OrganizationLevel fromPath(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Organization level is required");
		}
		String normalized = value.trim().toUpperCase(Locale.ROOT);
		if (normalized.endsWith("S")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		for (OrganizationLevel level : values()) {
			if (level.name().equals(normalized)) {
				return level;
			}
		}
		throw new IllegalArgumentException("Unknown organization level: " + value);
	}
}
