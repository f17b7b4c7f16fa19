package com.example.mltranslation.repository;

import com.example.mltranslation.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * UserRepository
 *
 * 以正規化 email 查詢；並發註冊最終由唯一鍵 uk_users_email 擋下
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);
}
