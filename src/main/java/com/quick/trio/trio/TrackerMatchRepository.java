package com.quick.trio.trio;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TrackerMatchRepository extends JpaRepository<TrackerMatch, Long> {
    List<TrackerMatch> findAllByOrderByPlayedAtDescIdDesc();

    List<TrackerMatch> findAllByOrderByPlayedAtDescIdDesc(Pageable pageable);

    boolean existsByParticipants_Id(Long playerId);
}
