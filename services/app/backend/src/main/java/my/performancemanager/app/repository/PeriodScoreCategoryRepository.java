package my.performancemanager.app.repository;

import my.performancemanager.app.domain.PeriodScoreCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PeriodScoreCategoryRepository extends JpaRepository<PeriodScoreCategory, Long> {
	@Modifying
	@Query("delete from PeriodScoreCategory c where c.periodScoreId = :periodScoreId")
	int deleteByPeriodScore(@Param("periodScoreId") Long periodScoreId);
}
