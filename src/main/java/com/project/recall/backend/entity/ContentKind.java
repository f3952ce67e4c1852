package com.project.recall.backend.entity;

public enum ContentKind {
    TEXT,
    PHOTO,
    VIDEO
}
