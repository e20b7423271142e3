package com.flagship.ledger_query.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for account lookups.
 */
@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, Long> {

    Optional<AccountEntity> findBySlug(String slug);

    /**
     * Children of the given parents, skipping one account type (vendors).
     */
    List<AccountEntity> findByParentAccountIdInAndTypeNot(Collection<Long> parentAccountIds, AccountType type);

    List<AccountEntity> findByParentAccountIdIn(Collection<Long> parentAccountIds);

    @Query("SELECT a FROM AccountEntity a WHERE a.incognito = true AND a.incognitoOwnerId = :ownerId")
    Optional<AccountEntity> findIncognitoProfile(@Param("ownerId") Long ownerId);
}
