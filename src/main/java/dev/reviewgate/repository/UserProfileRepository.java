package dev.reviewgate.repository;

import dev.reviewgate.domain.entity.UserProfile;
import dev.reviewgate.domain.enums.Role;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, String> {
    List<UserProfile> findByRole(Role role);
    List<UserProfile> findByIdIn(Collection<String> ids);
}
