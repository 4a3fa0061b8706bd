package com.kidsmap.datablock.repository;

import com.kidsmap.datablock.entity.MigrationCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MigrationCheckpointRepository extends JpaRepository<MigrationCheckpoint, String> {

    List<MigrationCheckpoint> findAllByOrderByCreatedAtDesc();
}
