package com.community.tracker.repository;

import com.community.tracker.entity.CommunityMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CommunityMemberRepository extends JpaRepository<CommunityMember, Long> {

    Optional<CommunityMember> findByPersonIdAndCommunityId(Long personId, Long communityId);

    boolean existsByPersonIdAndCommunityId(Long personId, Long communityId);

    // 成员所属的全部社区 ID
    @Query("SELECT m.communityId FROM CommunityMember m WHERE m.personId = :personId ORDER BY m.communityId")
    List<Long> findCommunityIdsByPersonId(@Param("personId") Long personId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CommunityMember m WHERE m.communityId = :communityId")
    int deleteAllByCommunityId(@Param("communityId") Long communityId);
}
