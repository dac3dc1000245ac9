package com.community.tracker.repository;

import com.community.tracker.entity.ChallengeDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChallengeDefinitionRepository extends JpaRepository<ChallengeDefinition, String> {

    List<ChallengeDefinition> findAllByOrderByDefinitionKeyAsc();
}
