package com.flagship.ledger_query.account;

import com.flagship.ledger_query.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * JPA-backed account directory.
 *
 * Bridges the persistence layer (AccountEntity) and the domain layer (Account).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService implements AccountDirectory {

    private final AccountRepository accountRepository;

    @Override
    @Transactional(readOnly = true)
    public Account fetchAccount(AccountReference reference) {
        if (reference == null) {
            throw new IllegalArgumentException("Account reference is required");
        }
        Optional<AccountEntity> entity = reference.getLegacyId() != null
            ? accountRepository.findById(reference.getLegacyId())
            : accountRepository.findBySlug(reference.getSlug());

        return entity
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Account Not Found: " + reference));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> fetchAccounts(List<AccountReference> references) {
        return references.stream()
            .map(this::fetchAccount)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> getChildren(List<Account> parents) {
        if (parents.isEmpty()) {
            return List.of();
        }
        List<Long> parentIds = parents.stream().map(Account::getId).toList();
        List<Account> children = accountRepository
            .findByParentAccountIdInAndTypeNot(parentIds, AccountType.VENDOR)
            .stream()
            .map(AccountEntity::toDomain)
            .toList();
        log.debug("Found {} children for accounts {}", children.size(), parentIds);
        return children;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> getAllChildren(List<Account> parents) {
        if (parents.isEmpty()) {
            return List.of();
        }
        List<Long> parentIds = parents.stream().map(Account::getId).toList();
        return accountRepository.findByParentAccountIdIn(parentIds)
            .stream()
            .map(AccountEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> getIncognitoProfile(Long accountId) {
        return accountRepository.findIncognitoProfile(accountId)
            .map(AccountEntity::toDomain);
    }
}
