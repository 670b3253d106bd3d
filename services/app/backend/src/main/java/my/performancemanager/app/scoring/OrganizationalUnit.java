package my.performancemanager.app.scoring;

public record OrganizationalUnit(String unitId, String name, OrganizationLevel level, String parentUnitId) {
}
