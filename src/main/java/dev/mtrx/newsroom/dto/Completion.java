package dev.mtrx.newsroom.dto;

public record Completion(String text, String model) {
}
