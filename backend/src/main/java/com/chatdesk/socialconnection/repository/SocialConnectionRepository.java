package com.chatdesk.socialconnection.repository;

import com.chatdesk.socialconnection.domain.SocialConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface SocialConnectionRepository extends JpaRepository<SocialConnection, UUID> {

    /**
     * Active connections on active tenants for one external account, oldest first. More than
     * one row is possible because the account id is unique per tenant, not globally.
     */
    @Query("SELECT sc FROM SocialConnection sc, Tenant t " +
           "WHERE t.id = sc.tenantId AND sc.platform = :platform " +
           "AND sc.platformAccountId = :accountId " +
           "AND sc.active = true AND t.active = true " +
           "ORDER BY sc.createdAt ASC, sc.id ASC")
    List<SocialConnection> findRoutable(@Param("platform") String platform,
                                        @Param("accountId") String accountId);
}
