package com.ureca.eventbus.subscription.repository;

import com.ureca.eventbus.subscription.entity.EventSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EventSubscriptionRepository extends JpaRepository<EventSubscription, UUID> {

    Optional<EventSubscription> findBySubscriberNameAndHandlerName(String subscriberName, String handlerName);

    List<EventSubscription> findAllByActiveTrue();

    List<EventSubscription> findAllByOrderBySubscriberNameAscHandlerNameAsc();

    /**
     * 전달 결과 통계 누적 (원자적 증가)
     *
     * @param processedDelta 성공 시 1
     * @param failedDelta    최종 실패 시 1
     */
    @Modifying
    @Query("UPDATE EventSubscription s " +
            "SET s.totalEventsProcessed = s.totalEventsProcessed + :processedDelta, " +
            "s.totalEventsFailed = s.totalEventsFailed + :failedDelta, " +
            "s.lastTriggeredAt = :now " +
            "WHERE s.id = :id")
    int recordDelivery(
            @Param("id") UUID id,
            @Param("processedDelta") long processedDelta,
            @Param("failedDelta") long failedDelta,
            @Param("now") LocalDateTime now
    );
}
