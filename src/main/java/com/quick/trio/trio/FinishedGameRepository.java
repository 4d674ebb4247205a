package com.quick.trio.trio;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FinishedGameRepository extends JpaRepository<FinishedGame, Long> {
    List<FinishedGame> findTop20ByOrderByFinishedAtDesc();
}
