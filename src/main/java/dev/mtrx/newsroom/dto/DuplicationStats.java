package dev.mtrx.newsroom.dto;

public record DuplicationStats(int total, int duplicates, int newCount) {
}
