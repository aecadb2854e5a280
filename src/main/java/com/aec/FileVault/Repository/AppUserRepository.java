package com.aec.FileVault.Repository;

import com.aec.FileVault.model.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {
    Optional<AppUser> findByThirdPartyId(String thirdPartyId);
    Optional<AppUser> findByEmail(String email);
}
