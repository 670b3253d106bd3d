package my.performancemanager.app.repository;

import my.performancemanager.app.domain.PeriodScore;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PeriodScoreRepository extends JpaRepository<PeriodScore, Long> {
	Optional<PeriodScore> findByStaffIdAndReviewPeriodId(String staffId, String reviewPeriodId);

	@Modifying
	@Query("delete from PeriodScore p where p.staffId = :staffId and p.reviewPeriodId = :reviewPeriodId")
	int deleteByStaffAndPeriod(@Param("staffId") String staffId, @Param("reviewPeriodId") String reviewPeriodId);
}
