package my.performancemanager.app.dto;

import my.performancemanager.app.scoring.ExcludedUnit;
import my.performancemanager.app.scoring.OrganizationLevel;
import my.performancemanager.app.scoring.OrganizationalUnitSummary;

import java.util.List;

public record UnitLevelSummaryDto(String reviewPeriodId,
								  OrganizationLevel level,
								  List<OrganizationalUnitSummary> units,
								  List<ExcludedUnit> excludedUnits) {
}
