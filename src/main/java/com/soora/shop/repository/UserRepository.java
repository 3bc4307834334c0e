package com.soora.shop.repository;

import com.soora.shop.domain.model.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for User entity.
 *
 * @author Soora Platform Team
 */
@Repository
public interface UserRepository extends JpaRepository<User, String> {

    /**
     * Find users, newest accounts first.
     *
     * @param pageable Page window
     * @return Page of users
     */
    Page<User> findAllByOrderByCreatedAtDesc(Pageable pageable);

    /**
     * Find user with pessimistic write lock.
     * Address writes that move the default flag take this lock first, so two of them
     * for the same user run one after the other.
     *
     * @param id User ID
     * @return Optional containing the user if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") String id);
}
