package com.gprintex.commission.repository;

import com.gprintex.commission.domain.AccountExecutive;

import java.util.List;
import java.util.Optional;

/**
 * Account executive directory.
 */
public interface AccountExecutiveRepository {

    AccountExecutive insert(AccountExecutive ae);

    Optional<AccountExecutive> findById(Long id);

    Optional<AccountExecutive> findByEmail(String email);

    List<AccountExecutive> findAll();

    boolean exists(Long id);
}
