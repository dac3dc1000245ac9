package com.community.tracker.repository;

import com.community.tracker.entity.ProgressRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProgressRecordRepository extends JpaRepository<ProgressRecord, Long> {

    Optional<ProgressRecord> findByPersonIdAndCommunityIdAndDefinitionKey(Long personId, Long communityId, String definitionKey);

    List<ProgressRecord> findByCommunityIdAndDefinitionKey(Long communityId, String definitionKey);

    List<ProgressRecord> findByPersonIdAndCommunityIdOrderByDefinitionKeyAsc(Long personId, Long communityId);

    List<ProgressRecord> findByCommunityIdInAndDefinitionKey(Collection<Long> communityIds, String definitionKey);

    /**
     * 原子单调写入：只会提高进度值，不会降低
     *
     * @return 进度值提高时为 1，观测值过期或相等时为 0
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ProgressRecord r SET r.progressValue = :value, r.updatedAt = :now " +
           "WHERE r.recordId = :recordId AND r.progressValue < :value")
    int advanceProgress(@Param("recordId") Long recordId,
                        @Param("value") long value,
                        @Param("now") LocalDateTime now);

    /**
     * 原子完成标记：每条记录只有一个调用方能成功
     *
     * @return 本次调用设置了 completed_at 时为 1，否则为 0
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ProgressRecord r SET r.completedAt = :now, r.updatedAt = :now " +
           "WHERE r.recordId = :recordId AND r.completedAt IS NULL AND r.progressValue >= :target")
    int markCompleted(@Param("recordId") Long recordId,
                      @Param("target") long target,
                      @Param("now") LocalDateTime now);

    // 赛季重置：仅影响一个社区的一个挑战
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ProgressRecord r SET r.progressValue = 0, r.completedAt = NULL, r.updatedAt = :now " +
           "WHERE r.communityId = :communityId AND r.definitionKey = :definitionKey")
    int resetProgress(@Param("communityId") Long communityId,
                      @Param("definitionKey") String definitionKey,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ProgressRecord r WHERE r.communityId = :communityId AND r.definitionKey = :definitionKey")
    int deleteAllByCommunityIdAndDefinitionKey(@Param("communityId") Long communityId,
                                               @Param("definitionKey") String definitionKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ProgressRecord r WHERE r.communityId = :communityId AND r.personId = :personId")
    int deleteAllByCommunityIdAndPersonId(@Param("communityId") Long communityId,
                                          @Param("personId") Long personId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ProgressRecord r WHERE r.communityId = :communityId")
    int deleteAllByCommunityId(@Param("communityId") Long communityId);

    /**
     * 统计指定社区内每个成员完成的挑战数
     * 返回行格式：[0: person_id, 1: 完成数, 2: 最近的 completed_at]
     */
    @Query("SELECT r.personId, COUNT(r), MAX(r.completedAt) FROM ProgressRecord r " +
           "WHERE r.communityId IN :communityIds AND r.completedAt IS NOT NULL " +
           "GROUP BY r.personId")
    List<Object[]> countCompletionsByPerson(@Param("communityIds") Collection<Long> communityIds);
}
