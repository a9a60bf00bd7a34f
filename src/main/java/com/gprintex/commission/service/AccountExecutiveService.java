package com.gprintex.commission.service;

import com.gprintex.commission.domain.AccountExecutive;
import com.gprintex.commission.domain.ValidationResult;
import com.gprintex.commission.repository.AccountExecutiveRepository;
import io.vavr.control.Either;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class AccountExecutiveService {

    private final AccountExecutiveRepository repository;

    public AccountExecutiveService(AccountExecutiveRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public Either<List<ValidationResult>, AccountExecutive> create(AccountExecutive ae) {
        if (!ae.email().contains("@")) {
            return Either.left(List.of(ValidationResult.error("INVALID_EMAIL", "Email address is not valid", "email")));
        }
        if (repository.findByEmail(ae.email()).isPresent()) {
            return Either.left(List.of(ValidationResult.error("EMAIL_TAKEN", "Email is already registered", "email")));
        }
        return Either.right(repository.insert(ae));
    }

    @Transactional(readOnly = true)
    public Optional<AccountExecutive> findById(Long id) {
        return repository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<AccountExecutive> findAll() {
        return repository.findAll();
    }
}
