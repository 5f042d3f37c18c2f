package com.flagship.restaurant_ledger.user;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class JdbcUserDirectory implements UserDirectory {

    private final JdbcTemplate jdbcTemplate;

    public JdbcUserDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<UserRole> getRole(Long userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query("SELECT role FROM users WHERE id = ?",
                        (rs, rowNum) -> UserRole.fromValue(rs.getString("role")), userId)
                .stream()
                .findFirst();
    }
}
