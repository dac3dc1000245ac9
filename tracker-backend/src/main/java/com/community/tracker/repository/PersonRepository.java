package com.community.tracker.repository;

import com.community.tracker.entity.Person;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PersonRepository extends JpaRepository<Person, Long> {

    Optional<Person> findByExternalUserId(Long externalUserId);

    // 外部账号名不区分大小写，与外部目录的处理方式一致
    Optional<Person> findByExternalHandleIgnoreCase(String externalHandle);

    /**
     * 某社区中已绑定账号的成员，供定时刷新使用
     */
    @Query("SELECT p FROM Person p, CommunityMember m " +
           "WHERE m.personId = p.personId AND m.communityId = :communityId AND p.externalHandle IS NOT NULL " +
           "ORDER BY p.personId")
    List<Person> findLinkedMembersOfCommunity(@Param("communityId") Long communityId);
}
