package com.firehose.infrastructure.persistence.repository;

import com.firehose.infrastructure.persistence.entity.DeadLetterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DeadLetterRepository extends JpaRepository<DeadLetterEntity, Long> {
}
