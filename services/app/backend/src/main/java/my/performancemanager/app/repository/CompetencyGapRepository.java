package my.performancemanager.app.repository;

import my.performancemanager.app.domain.CompetencyGap;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CompetencyGapRepository extends JpaRepository<CompetencyGap, Long> {
	@Modifying
	@Query("delete from CompetencyGap g where g.staffId = :staffId and g.reviewPeriodId = :reviewPeriodId")
	int deleteByStaffAndPeriod(@Param("staffId") String staffId, @Param("reviewPeriodId") String reviewPeriodId);
}
