package com.project.recall.backend.repository;

import com.project.recall.backend.entity.CardNotification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CardNotificationRepository extends JpaRepository<CardNotification, Long> {
    List<CardNotification> findByCardIdOrderBySentAtAsc(UUID cardId);

    void deleteByCardId(UUID cardId);
}
