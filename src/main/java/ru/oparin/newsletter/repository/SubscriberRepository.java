package ru.oparin.newsletter.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.model.entity.Subscriber;

import java.util.UUID;

@Repository
public interface SubscriberRepository extends ReactiveCrudRepository<Subscriber, UUID> {

    Mono<Subscriber> findByEmail(String email);

    @Modifying
    @Query("UPDATE subscriptions SET status = 'CONFIRMED' WHERE id = :id AND status = 'PENDING_CONFIRMATION'")
    Mono<Integer> confirmIfPending(UUID id);

    @Query("SELECT * FROM subscriptions WHERE status = 'CONFIRMED' ORDER BY id LIMIT :limit")
    Flux<Subscriber> findFirstConfirmed(int limit);

    @Query("SELECT * FROM subscriptions WHERE status = 'CONFIRMED' AND id > :after ORDER BY id LIMIT :limit")
    Flux<Subscriber> findConfirmedAfter(UUID after, int limit);
}
