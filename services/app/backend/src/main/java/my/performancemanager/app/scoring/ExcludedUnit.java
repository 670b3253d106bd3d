package my.performancemanager.app.scoring;

public record ExcludedUnit(String unitId, String reason) {
}
