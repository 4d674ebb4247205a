package com.quick.trio.trio;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TrackerPlayerRepository extends JpaRepository<TrackerPlayer, Long> {
    List<TrackerPlayer> findAllByOrderByNameAsc();

    boolean existsByName(String name);
}
