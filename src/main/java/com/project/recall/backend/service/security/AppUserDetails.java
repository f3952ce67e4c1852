package com.project.recall.backend.service.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.List;

public class AppUserDetails implements UserDetails {
    private final Integer userId;
    private final String username;
    private final String password;
    private final boolean approved;

    public AppUserDetails(Integer userId, String username, String password, boolean approved) {
        this.userId = userId;
        this.username = username;
        this.password = password;
        this.approved = approved;
    }

    public Integer getUserId() {
        return userId;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of();
    }

    @Override
    public String getPassword() {
        return password;
    }

    @Override
    public String getUsername() {
        return username;
    }

    // only approved users may use the api
    @Override
    public boolean isEnabled() {
        return approved;
    }
}
