package com.community.tracker.repository;

import com.community.tracker.entity.CommunityChallengeSelection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CommunityChallengeSelectionRepository extends JpaRepository<CommunityChallengeSelection, Long> {

    /**
     * 按选用顺序返回社区的挑战（展示顺序稳定）
     */
    List<CommunityChallengeSelection> findByCommunityIdOrderBySelectedAtAscSelectionIdAsc(Long communityId);

    Optional<CommunityChallengeSelection> findByCommunityIdAndDefinitionKey(Long communityId, String definitionKey);

    boolean existsByCommunityIdAndDefinitionKey(Long communityId, String definitionKey);

    long countByDefinitionKey(String definitionKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CommunityChallengeSelection s WHERE s.communityId = :communityId")
    int deleteAllByCommunityId(@Param("communityId") Long communityId);
}
