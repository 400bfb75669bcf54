package com.example.procloner.repo;

import com.example.procloner.model.CloneSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CloneSessionRepository extends JpaRepository<CloneSessionEntity, String> {
}
