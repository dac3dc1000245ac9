package com.community.tracker.repository;

import com.community.tracker.entity.RoleConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RoleConfigRepository extends JpaRepository<RoleConfig, Long> {

    List<RoleConfig> findByCommunityIdOrderByTierKeyAsc(Long communityId);

    Optional<RoleConfig> findByCommunityIdAndTierKey(Long communityId, String tierKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RoleConfig c WHERE c.communityId = :communityId")
    int deleteAllByCommunityId(@Param("communityId") Long communityId);
}
