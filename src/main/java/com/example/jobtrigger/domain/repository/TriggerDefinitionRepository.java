package com.example.jobtrigger.domain.repository;

import com.example.jobtrigger.domain.entity.TriggerDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TriggerDefinitionRepository extends JpaRepository<TriggerDefinition, UUID> {

    Optional<TriggerDefinition> findByTriggerName(String triggerName);
}
