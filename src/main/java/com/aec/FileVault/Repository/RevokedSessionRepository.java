package com.aec.FileVault.Repository;

import com.aec.FileVault.model.RevokedSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface RevokedSessionRepository extends JpaRepository<RevokedSession, Long> {
    boolean existsByTokenId(String tokenId);

    @Transactional
    @Modifying
    @Query("delete from RevokedSession r where r.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
