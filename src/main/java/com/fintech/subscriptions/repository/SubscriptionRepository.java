package com.fintech.subscriptions.repository;

import com.fintech.subscriptions.entity.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for subscription windows.
 * <p>
 * Writes that decide between insert, update and no-op are single {@code MERGE} statements,
 * so concurrent writers for the same username are serialized by the database.
 */
@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, String> {

    /**
     * Opens a new window {@code [now, expiration]} unless the user already has one that
     * has not lapsed yet.
     *
     * @return 1 if a row was inserted or overwritten, 0 if the existing window is still running
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "MERGE INTO subscriptions AS s " +
            "USING (SELECT CAST(:username AS VARCHAR(16)) AS username) AS v " +
            "ON s.username = v.username " +
            "WHEN MATCHED AND s.expiration_date < :now THEN " +
            "UPDATE SET subscription_date = :now, expiration_date = :expiration, " +
            "updated_at = :now, active = TRUE " +
            "WHEN NOT MATCHED THEN " +
            "INSERT (username, subscription_date, expiration_date, updated_at, active) " +
            "VALUES (v.username, :now, :expiration, :now, TRUE)",
            nativeQuery = true)
    int grantIfLapsed(@Param("username") String username,
                      @Param("now") LocalDateTime now,
                      @Param("expiration") LocalDateTime expiration);

    /**
     * Sets the window to {@code [now, expiration]} when the user has no window or one that
     * ends before {@code expiration}. Never shortens a window.
     *
     * @return 1 if a row was inserted or overwritten, 0 if the existing window ends later
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "MERGE INTO subscriptions AS s " +
            "USING (SELECT CAST(:username AS VARCHAR(16)) AS username) AS v " +
            "ON s.username = v.username " +
            "WHEN MATCHED AND s.expiration_date < :expiration THEN " +
            "UPDATE SET subscription_date = :now, expiration_date = :expiration, " +
            "updated_at = :now, active = TRUE " +
            "WHEN NOT MATCHED THEN " +
            "INSERT (username, subscription_date, expiration_date, updated_at, active) " +
            "VALUES (v.username, :now, :expiration, :now, TRUE)",
            nativeQuery = true)
    int extendUntil(@Param("username") String username,
                    @Param("now") LocalDateTime now,
                    @Param("expiration") LocalDateTime expiration);

    /**
     * Ends a window immediately. The only write that moves an expiration backwards.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Subscription s SET s.expirationDate = :now, s.active = false, s.updatedAt = :now " +
            "WHERE s.username = :username")
    int revoke(@Param("username") String username, @Param("now") LocalDateTime now);

    /**
     * Usernames whose window has passed but are still flagged active.
     */
    @Query("SELECT s.username FROM Subscription s WHERE s.active = true " +
            "AND s.expirationDate < :now ORDER BY s.expirationDate ASC")
    List<String> findLapsedActiveUsernames(@Param("now") LocalDateTime now);

    /**
     * Clears the active flag. The expiration condition is re-checked so a window renewed
     * in the meantime is left alone.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Subscription s SET s.active = false, s.updatedAt = :now " +
            "WHERE s.username IN :usernames AND s.active = true AND s.expirationDate < :now")
    int deactivate(@Param("usernames") List<String> usernames, @Param("now") LocalDateTime now);

    long countByActiveTrue();
}
