package com.community.tracker.repository;

import com.community.tracker.entity.PersonStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PersonStatsRepository extends JpaRepository<PersonStats, Long> {
}
