package com.example.hoopstats_backend.dto;

public record ClassifierInfo(String id, String name, boolean loaded, boolean ready) {
}
