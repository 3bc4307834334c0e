package com.soora.shop.repository;

import com.soora.shop.domain.model.Address;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Address entity.
 *
 * @author Soora Platform Team
 */
@Repository
public interface AddressRepository extends JpaRepository<Address, String> {

    /**
     * Find a user's addresses, default first.
     *
     * @param userId Owning user ID
     * @return Addresses of the user
     */
    List<Address> findByUserIdOrderByIsDefaultDescCreatedAtAsc(String userId);

    Optional<Address> findFirstByUserIdAndIsDefaultTrue(String userId);

    long countByUserIdAndIsDefaultTrue(String userId);

    /**
     * Clear the default flag on every address of a user.
     *
     * @param userId Owning user ID
     * @return Number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Address a SET a.isDefault = false WHERE a.userId = :userId AND a.isDefault = true")
    int clearDefaultForUser(@Param("userId") String userId);

    /**
     * Clear the default flag on every address of a user except one.
     *
     * @param userId Owning user ID
     * @param keepAddressId Address that keeps its flag
     * @return Number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Address a SET a.isDefault = false " +
           "WHERE a.userId = :userId AND a.isDefault = true AND a.id <> :keepAddressId")
    int clearDefaultForUserExcept(
            @Param("userId") String userId,
            @Param("keepAddressId") String keepAddressId
    );
}
