package com.connectfood.backend.modules.account.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.connectfood.backend.modules.account.domain.Account;
import com.connectfood.backend.modules.account.domain.AccountRole;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    List<Account> findByRoleAndActiveTrue(AccountRole role);
}
