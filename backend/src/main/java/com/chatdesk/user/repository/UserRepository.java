package com.chatdesk.user.repository;

import com.chatdesk.user.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Finds an active user whose tenant is active as well.
     * Used once per realtime handshake.
     */
    @Query("SELECT u FROM User u, Tenant t " +
           "WHERE t.id = u.tenantId AND u.id = :userId " +
           "AND u.active = true AND t.active = true")
    Optional<User> findActiveInActiveTenant(@Param("userId") UUID userId);
}
