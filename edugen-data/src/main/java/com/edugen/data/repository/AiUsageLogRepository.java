package com.edugen.data.repository;

import com.edugen.data.entity.AiUsageLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface AiUsageLogRepository extends JpaRepository<AiUsageLog, UUID> {
    
    List<AiUsageLog> findByTeacherIdOrderByCreatedAtDesc(String teacherId, Pageable pageable);
    
    long countByTeacherIdAndCreatedAtAfter(String teacherId, Instant since);
    
    /**
     * Per-provider totals since a cutoff.
     * Row layout: provider, operationType, attempts, successes, totalCost.
     */
    @Query("SELECT u.provider, u.operationType, COUNT(u), " +
           "SUM(CASE WHEN u.success = true THEN 1 ELSE 0 END), SUM(u.estimatedCost) " +
           "FROM AiUsageLog u WHERE u.createdAt >= :since " +
           "GROUP BY u.provider, u.operationType ORDER BY u.provider")
    List<Object[]> summarizeByProviderSince(@Param("since") Instant since);
    
    /**
     * Clean up audit rows past retention.
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM AiUsageLog u WHERE u.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
