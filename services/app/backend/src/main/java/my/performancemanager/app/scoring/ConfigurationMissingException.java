package my.performancemanager.app.scoring;

public class ConfigurationMissingException extends ScoringException {
	public ConfigurationMissingException(String message) {
		super(message);
	}

	public static ConfigurationMissingException weight(String reviewPeriodId, String categoryId, String reviewTypeId) {
		return new ConfigurationMissingException("No category weight configured for period=" + reviewPeriodId
				+ ", category=" + categoryId + ", reviewType=" + reviewTypeId);
	}
}
