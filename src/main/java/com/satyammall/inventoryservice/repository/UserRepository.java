package com.satyammall.inventoryservice.repository;

import com.satyammall.inventoryservice.model.AppUser;

import java.util.Optional;

public interface UserRepository {

    Optional<AppUser> findByEmail(String email);
}
