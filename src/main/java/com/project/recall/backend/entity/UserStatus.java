package com.project.recall.backend.entity;

public enum UserStatus {
    PENDING,
    APPROVED,
    REJECTED
}
